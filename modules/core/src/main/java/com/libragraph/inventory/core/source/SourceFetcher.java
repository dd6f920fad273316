package com.libragraph.inventory.core.source;

import com.libragraph.inventory.core.storage.ObjectNotFoundException;
import com.libragraph.inventory.core.storage.ObjectStore;
import com.libragraph.inventory.core.storage.StorageException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Object store reads with bounded retry.
 *
 * <p>Any failure except {@link ObjectNotFoundException} is retried with
 * exponential backoff; once the attempts are exhausted the last failure is
 * surfaced as {@link SourceUnavailableException}. Not-found is final and
 * propagates unchanged.
 */
public class SourceFetcher {

    private static final Logger log = Logger.getLogger(SourceFetcher.class);

    private final ObjectStore store;
    private final RetryPolicy policy;

    public SourceFetcher(ObjectStore store, RetryPolicy policy) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    public RetryPolicy policy() {
        return policy;
    }

    public List<String> list(String bucket, String prefix) {
        return withRetry(bucket, prefix, () -> store.listObjects(bucket, prefix));
    }

    /** Opens an object; the caller must close the stream. */
    public InputStream open(String bucket, String key) {
        return withRetry(bucket, key, () -> store.getObject(bucket, key));
    }

    /** Reads a small object (a manifest) fully. */
    public byte[] readAll(String bucket, String key) {
        return withRetry(bucket, key, () -> {
            try (InputStream in = store.getObject(bucket, key)) {
                return in.readAllBytes();
            } catch (IOException e) {
                throw new StorageException("Failed to read object: " + bucket + "/" + key, e);
            }
        });
    }

    private <T> T withRetry(String bucket, String key, Supplier<T> call) {
        Uni<T> uni = Uni.createFrom().item(call);
        if (policy.maxAttempts() > 1) {
            uni = uni.onFailure(SourceFetcher::retryable)
                    .invoke(e -> log.debugf("Retrying %s/%s after: %s", bucket, key, e.getMessage()))
                    .onFailure(SourceFetcher::retryable)
                    .retry()
                    .withBackOff(policy.initialBackoff(), policy.maxBackoff())
                    .atMost(policy.maxAttempts() - 1);
        }
        return uni.onFailure(SourceFetcher::retryable)
                .transform(e -> {
                    log.warnf("Giving up on %s/%s after %d attempt(s): %s",
                            bucket, key, policy.maxAttempts(), e.getMessage());
                    return new SourceUnavailableException(bucket, key, policy.maxAttempts(), e);
                })
                .await().indefinitely();
    }

    private static boolean retryable(Throwable t) {
        return !(t instanceof ObjectNotFoundException);
    }
}
