package com.banking.scd.bulk;

import com.banking.scd.api.LoadResult;
import com.banking.scd.core.exception.ScdException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Running counts of one import, shared by the importers.
 */
class ImportTally {
    private static final Logger log = LoggerFactory.getLogger(ImportTally.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final ProgressCallback callback;
    private final List<ImportResult.ImportError> errors = new ArrayList<>();
    private long totalRecords;
    private long newEntities;
    private long newVersions;
    private long overwrites;
    private long unchanged;

    ImportTally(ProgressCallback callback) {
        this.callback = callback != null ? callback : ProgressCallback.NOOP;
    }

    void applied(LoadResult result) {
        switch (result.changeType()) {
            case NEW_ENTITY -> newEntities++;
            case TYPE2_VERSION -> newVersions++;
            case TYPE1_UPDATE -> overwrites++;
            case NO_CHANGE -> unchanged++;
        }
        progressed();
    }

    /**
     * Records a rejected data record. Only argument and engine errors are recoverable per record.
     */
    void failed(long lineNumber, String naturalKey, RuntimeException e) {
        if (!(e instanceof IllegalArgumentException) && !(e instanceof ScdException)) {
            throw e;
        }
        errors.add(new ImportResult.ImportError(lineNumber, naturalKey != null ? naturalKey : "", e.getMessage()));
        progressed();
    }

    /**
     * Records an error that stops the import.
     */
    void aborted(long lineNumber, String message) {
        errors.add(new ImportResult.ImportError(lineNumber, "", message));
    }

    ImportResult finish() {
        ImportResult result = new ImportResult(totalRecords, newEntities, newVersions, overwrites, unchanged, errors);
        callback.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    private void progressed() {
        totalRecords++;
        if (totalRecords % PROGRESS_INTERVAL == 0) {
            callback.onProgress(totalRecords, -1, "Processed " + totalRecords + " records");
        }
    }
}
