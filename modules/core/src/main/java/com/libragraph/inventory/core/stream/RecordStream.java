package com.libragraph.inventory.core.stream;

import com.libragraph.inventory.core.source.RetryPolicy;
import com.libragraph.inventory.core.source.SourceUnavailableException;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Single-pass iterator over the records of one data file.
 *
 * <p>Malformed rows are counted, handed to the listener and skipped. Once
 * more than {@code maxConsecutiveMalformed} of them follow each other the
 * stream fails with {@link RecordStreamCorruptException}.
 *
 * <p>When the object body breaks off mid-read the object is fetched again and
 * the lines already consumed are skipped, so no row is lost or delivered
 * twice. After {@link RetryPolicy#maxAttempts()} reads of the body have failed
 * the stream gives up with {@link SourceUnavailableException}. The stream must
 * be closed; closing releases the underlying object stream.
 */
public class RecordStream implements Iterator<InventoryRecord>, AutoCloseable {

    private static final Logger log = Logger.getLogger(RecordStream.class);

    /** Opens the object and returns its decoded lines. */
    @FunctionalInterface
    interface Opener {
        BufferedReader open() throws IOException;
    }

    @FunctionalInterface
    private interface LineRead<T> {
        T read(BufferedReader reader) throws IOException;
    }

    private final String bucket;
    private final String fileKey;
    private final Opener opener;
    private final RetryPolicy retryPolicy;
    private final RowMapper mapper;
    private final int maxConsecutiveMalformed;
    private final Consumer<RecordFormatException> listener;

    private BufferedReader reader;
    private long linesToSkip;
    private int failedReads;
    private InventoryRecord next;
    private boolean exhausted;
    private boolean closed;
    private long lineNumber;
    private long rowsRead;
    private long recordsRead;
    private long malformedRows;
    private int consecutiveMalformed;

    RecordStream(String bucket, String fileKey, Opener opener, RetryPolicy retryPolicy, RowMapper mapper,
                 int maxConsecutiveMalformed, Consumer<RecordFormatException> listener) {
        this.bucket = bucket;
        this.fileKey = fileKey;
        this.opener = opener;
        this.retryPolicy = retryPolicy;
        this.mapper = mapper;
        this.maxConsecutiveMalformed = maxConsecutiveMalformed;
        this.listener = listener;
    }

    public String fileKey() {
        return fileKey;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (exhausted || closed) {
            return false;
        }
        next = advance();
        return next != null;
    }

    @Override
    public InventoryRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        InventoryRecord record = next;
        next = null;
        return record;
    }

    private InventoryRecord advance() {
        String line;
        while ((line = readLine()) != null) {
            lineNumber++;
            if (line.isEmpty()) {
                continue;
            }
            rowsRead++;
            try {
                InventoryRecord record = mapper.map(line);
                consecutiveMalformed = 0;
                recordsRead++;
                return record;
            } catch (IllegalArgumentException e) {
                malformed(e.getMessage());
            }
        }
        exhausted = true;
        return null;
    }

    private void malformed(String reason) {
        malformedRows++;
        consecutiveMalformed++;
        RecordFormatException error = new RecordFormatException(fileKey, lineNumber, reason);
        log.debugf("%s", error.getMessage());
        if (listener != null) {
            listener.accept(error);
        }
        if (consecutiveMalformed > maxConsecutiveMalformed) {
            exhausted = true;
            throw new RecordStreamCorruptException(fileKey,
                    consecutiveMalformed + " consecutive malformed rows");
        }
    }

    /** Opens the object eagerly so fetch and header errors surface from the reader's open call. */
    void connect() {
        withReader(r -> null);
    }

    private String readLine() {
        return withReader(BufferedReader::readLine);
    }

    private <T> T withReader(LineRead<T> read) {
        while (true) {
            boolean opened = reader != null;
            try {
                if (reader == null) {
                    reader = opener.open();
                    opened = true;
                }
                while (linesToSkip > 0) {
                    if (reader.readLine() == null) {
                        exhausted = true;
                        throw new RecordStreamCorruptException(fileKey,
                                "object ended before line " + lineNumber + " when read again");
                    }
                    linesToSkip--;
                }
                return read.read(reader);
            } catch (UncheckedIOException e) {
                throw readFailure(e.getCause(), opened);
            } catch (IOException e) {
                if (!ObjectReadException.isTransport(e)) {
                    throw readFailure(e, opened);
                }
                retryAfter(e);
            }
        }
    }

    private RecordStreamCorruptException readFailure(IOException e, boolean opened) {
        exhausted = true;
        String reason = opened ? "read failed at line " + (lineNumber + 1) : "cannot decode stream";
        return new RecordStreamCorruptException(fileKey, reason, e);
    }

    private void retryAfter(IOException cause) {
        closeReader();
        failedReads++;
        if (failedReads >= retryPolicy.maxAttempts()) {
            exhausted = true;
            log.warnf("Giving up on %s/%s after %d failed read(s): %s",
                    bucket, fileKey, failedReads, cause.getMessage());
            throw new SourceUnavailableException(bucket, fileKey, failedReads, cause);
        }
        log.debugf("Read of %s/%s broke off after line %d, fetching again: %s",
                bucket, fileKey, lineNumber, cause.getMessage());
        try {
            Thread.sleep(backoff(failedReads).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exhausted = true;
            throw new SourceUnavailableException(bucket, fileKey, failedReads, cause);
        }
        linesToSkip = lineNumber;
    }

    private Duration backoff(int retry) {
        Duration delay = retryPolicy.initialBackoff();
        for (int i = 1; i < retry && delay.compareTo(retryPolicy.maxBackoff()) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(retryPolicy.maxBackoff()) > 0 ? retryPolicy.maxBackoff() : delay;
    }

    /** Non-empty rows read so far, malformed ones included. */
    public long rowsRead() {
        return rowsRead;
    }

    /** Rows successfully turned into records. */
    public long recordsRead() {
        return recordsRead;
    }

    public long malformedRows() {
        return malformedRows;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeReader();
    }

    private void closeReader() {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (IOException e) {
            log.warnf("Failed to close data file %s: %s", fileKey, e.getMessage());
        } finally {
            reader = null;
        }
    }
}
