package com.gprintex.gtm.domain;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a tabular import. Rows are independent, so one bad row only adds to the error count.
 */
public record ImportResult(
    String sourceSystem,
    String entityType,
    LocalDateTime importedAt,
    long recordCount,
    long successCount,
    long errorCount,
    List<String> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ImportResult start(String sourceSystem, String entityType, LocalDateTime at) {
        return new ImportResult(sourceSystem, entityType, at, 0, 0, 0, List.of());
    }

    public ImportResult withSuccess() {
        return new ImportResult(sourceSystem, entityType, importedAt,
            recordCount + 1, successCount + 1, errorCount, errors);
    }

    public ImportResult withError(long rowNumber, String message) {
        var allErrors = new ArrayList<>(errors);
        allErrors.add("Row " + rowNumber + ": " + message);
        return new ImportResult(sourceSystem, entityType, importedAt,
            recordCount + 1, successCount, errorCount + 1, allErrors);
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public double successRate() {
        if (recordCount <= 0) return 0;
        return (double) successCount / recordCount * 100;
    }
}
