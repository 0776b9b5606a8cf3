package com.uavradar.processor.batch;

import com.uavradar.processor.dedup.DeduplicationResult;
import com.uavradar.processor.dedup.Deduplicator;
import com.uavradar.processor.model.ParsedRecord;
import com.uavradar.processor.telegram.MessageParser;
import com.uavradar.processor.validation.FlightRecordValidator;
import com.uavradar.processor.validation.ValidationOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs parse, validate and dedupe over a batch of telegram lines.
 *
 * <p>Lines are handled one at a time in input order, so "first occurrence wins" during
 * deduplication is reproducible. The processor performs no I/O; persistence and geocoding of
 * accepted records belong to the caller.
 */
public class BatchProcessor {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchProcessor.class);

  private final MessageParser parser;
  private final FlightRecordValidator validator;
  private final Deduplicator deduplicator;
  private final Clock clock;

  public BatchProcessor(
      MessageParser parser,
      FlightRecordValidator validator,
      Deduplicator deduplicator,
      Clock clock) {
    this.parser = parser;
    this.validator = validator;
    this.deduplicator = deduplicator;
    this.clock = clock;
  }

  public BatchResult process(List<String> rawLines) {
    return process(rawLines, clock.instant(), null);
  }

  public BatchResult process(List<String> rawLines, Instant now) {
    return process(rawLines, now, null);
  }

  /**
   * Processes a batch with an optional time budget.
   *
   * <p>When the budget is exhausted, the remaining lines are skipped and the statistics are
   * marked as truncated; records processed so far are still deduplicated and returned.
   *
   * @param rawLines telegram lines in input order
   * @param now reference instant for time resolution and validation
   * @param timeBudget maximum wall-clock time for the batch, or {@code null} for no limit
   * @return accepted records and statistics
   */
  public BatchResult process(List<String> rawLines, Instant now, Duration timeBudget) {
    return process(rawLines, now, timeBudget, new HashSet<>());
  }

  /**
   * Processes one chunk of a batch whose earlier chunks were already processed.
   *
   * <p>Valid records whose fingerprint is in {@code seenFingerprints} count as duplicates.
   *
   * @param rawLines telegram lines in input order
   * @param now reference instant for time resolution and validation
   * @param timeBudget maximum wall-clock time for the chunk, or {@code null} for no limit
   * @param seenFingerprints fingerprints accepted by earlier chunks, updated in place
   * @return accepted records and statistics of this chunk
   */
  public BatchResult process(
      List<String> rawLines, Instant now, Duration timeBudget, Set<String> seenFingerprints) {
    Instant deadline = timeBudget == null ? null : clock.instant().plus(timeBudget);

    List<ParsedRecord> valid = new ArrayList<>();
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    int processed = 0;
    int invalid = 0;
    int withWarnings = 0;
    boolean truncated = false;

    for (String line : rawLines) {
      if (deadline != null && clock.instant().isAfter(deadline)) {
        truncated = true;
        break;
      }
      ParsedRecord record = parser.parse(line, now);
      ValidationOutcome outcome = validator.validate(record, now);
      if (outcome.isValid()) {
        record.apply(outcome.patch());
        record.addValidationWarnings(outcome.warnings());
        valid.add(record);
      } else {
        invalid++;
        errors.addAll(outcome.errors());
      }
      if (outcome.hasWarnings()) {
        withWarnings++;
        warnings.addAll(outcome.warnings());
      }
      processed++;
    }

    if (truncated) {
      LOGGER.warn("Batch time budget {} exhausted after {} of {} lines",
          timeBudget, processed, rawLines.size());
    }

    DeduplicationResult dedup = deduplicator.dedupe(valid, seenFingerprints);
    BatchStatistics statistics = new BatchStatistics(
        rawLines.size(),
        processed,
        valid.size(),
        invalid,
        withWarnings,
        dedup.removedCount(),
        valid.size() - dedup.removedCount(),
        List.copyOf(errors),
        List.copyOf(warnings),
        dedup.duplicateGroups(),
        truncated);
    return new BatchResult(dedup.uniqueRecords(), statistics);
  }
}
