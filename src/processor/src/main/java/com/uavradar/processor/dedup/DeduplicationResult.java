package com.uavradar.processor.dedup;

import com.uavradar.processor.model.ParsedRecord;
import java.util.List;

/**
 * Outcome of collapsing duplicates within one batch.
 *
 * @param uniqueRecords first record of each fingerprint, in first-occurrence order
 * @param removedCount number of dropped records
 * @param duplicateGroups identifiers of dropped records, one group per duplicated fingerprint
 */
public record DeduplicationResult(
    List<ParsedRecord> uniqueRecords,
    int removedCount,
    List<List<String>> duplicateGroups) {}
