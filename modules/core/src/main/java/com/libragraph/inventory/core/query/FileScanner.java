package com.libragraph.inventory.core.query;

import com.libragraph.inventory.core.InventoryException;
import com.libragraph.inventory.core.manifest.DataFileRef;
import com.libragraph.inventory.core.manifest.Manifest;
import com.libragraph.inventory.core.storage.ObjectNotFoundException;
import com.libragraph.inventory.core.storage.StorageException;
import com.libragraph.inventory.core.stream.InventoryRecord;
import com.libragraph.inventory.core.stream.RecordStream;
import com.libragraph.inventory.core.stream.RecordStreamReader;
import org.jboss.logging.Logger;

import java.util.function.Consumer;

/**
 * Reads one data file to the end, feeding every record to a consumer and
 * booking the outcome in a {@link ScanProgress}. File-level failures are
 * recorded, never thrown.
 */
final class FileScanner {

    private static final Logger log = Logger.getLogger(FileScanner.class);

    private final RecordStreamReader reader;

    FileScanner(RecordStreamReader reader) {
        this.reader = reader;
    }

    void scan(Manifest manifest, int index, QueryCancellation cancellation,
              ScanProgress progress, Consumer<InventoryRecord> onRecord) {
        DataFileRef file = manifest.files().get(index);
        if (cancellation.isCancelled()) {
            return;
        }
        RecordStream stream = null;
        try {
            stream = reader.open(manifest, file, null);
            while (true) {
                cancellation.throwIfCancelled();
                if (!stream.hasNext()) {
                    break;
                }
                onRecord.accept(stream.next());
            }
            progress.fileScanned(stream);
            log.debugf("Scanned %s: %d rows, %d malformed", file.key(), stream.rowsRead(), stream.malformedRows());
        } catch (QueryCancelledException e) {
            progress.filePartial(stream);
            log.debugf("Scan of %s cancelled", file.key());
        } catch (InventoryException | ObjectNotFoundException | StorageException e) {
            log.warnf("Data file %s failed: %s", file.key(), e.getMessage());
            progress.fileFailed(index, file.key(), e.getMessage(), stream);
        } catch (RuntimeException e) {
            log.errorf(e, "Unexpected error scanning %s", file.key());
            progress.fileFailed(index, file.key(), e.toString(), stream);
        } finally {
            if (stream != null) {
                stream.close();
            }
        }
    }
}
