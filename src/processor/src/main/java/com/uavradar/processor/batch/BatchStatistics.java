package com.uavradar.processor.batch;

import java.util.List;

/**
 * Aggregated counters and messages for one processed batch.
 *
 * @param originalCount number of input lines
 * @param processedCount lines parsed and validated before the time budget ran out
 * @param validCount records without blocking errors
 * @param invalidCount records with at least one blocking error
 * @param warningCount records with at least one warning, valid or not
 * @param duplicatesRemoved valid records dropped as in-batch duplicates
 * @param acceptedCount {@code validCount - duplicatesRemoved}
 * @param validationErrors blocking errors of invalid records, in input order
 * @param warnings warnings of all records, in input order
 * @param duplicateGroups identifiers of dropped duplicates, one group per fingerprint
 * @param truncated {@code true} when the time budget stopped processing early
 */
public record BatchStatistics(
    int originalCount,
    int processedCount,
    int validCount,
    int invalidCount,
    int warningCount,
    int duplicatesRemoved,
    int acceptedCount,
    List<String> validationErrors,
    List<String> warnings,
    List<List<String>> duplicateGroups,
    boolean truncated) {}
