package com.libragraph.inventory.core.scan;

import com.libragraph.inventory.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of platform threads shared by every scan. Each task decodes one
 * data file, so the pool size caps concurrent object fetches and in-flight
 * decode buffers across all queries.
 */
@ApplicationScoped
@Startup
public class ScanWorkerPool extends AbstractManagedService implements Executor {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    @ConfigProperty(name = "inventory.scan.workers", defaultValue = "4")
    int workerCount;

    private volatile ExecutorService executor;

    @Override
    public String serviceId() {
        return "scan-worker-pool";
    }

    public int workerCount() {
        return workerCount;
    }

    @Override
    protected void doStart() {
        if (workerCount < 1) {
            throw new IllegalStateException("inventory.scan.workers must be >= 1, got: " + workerCount);
        }
        executor = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
        log.infof("ScanWorkerPool started with %d workers", workerCount);
    }

    @Override
    protected void doStop() throws InterruptedException {
        ExecutorService current = executor;
        executor = null;
        if (current == null) {
            return;
        }
        current.shutdown();
        if (!current.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warnf("Scan workers still busy after %ds, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
            current.shutdownNow();
        }
        log.info("ScanWorkerPool stopped");
    }

    @Override
    public void execute(Runnable task) {
        ExecutorService current = executor;
        if (current == null || !isRunning()) {
            throw new RejectedExecutionException("Scan worker pool is " + state());
        }
        current.execute(task);
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("ScanWorkerPool failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping ScanWorkerPool", e);
        } catch (Exception e) {
            log.warn("Error stopping ScanWorkerPool", e);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "scan-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
