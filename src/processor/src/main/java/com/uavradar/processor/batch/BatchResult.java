package com.uavradar.processor.batch;

import com.uavradar.processor.model.ParsedRecord;
import java.util.List;

/**
 * Records accepted from a batch, with the batch statistics.
 *
 * @param acceptedRecords valid, normalized and deduplicated records in input order
 * @param statistics batch counters and messages
 */
public record BatchResult(List<ParsedRecord> acceptedRecords, BatchStatistics statistics) {}
