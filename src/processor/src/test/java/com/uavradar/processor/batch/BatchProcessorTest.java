package com.uavradar.processor.batch;

import static org.assertj.core.api.Assertions.assertThat;

import com.uavradar.processor.config.ProcessorProperties;
import com.uavradar.processor.dedup.Deduplicator;
import com.uavradar.processor.model.ParsedRecord;
import com.uavradar.processor.telegram.MessageParser;
import com.uavradar.processor.validation.FlightRecordValidator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class BatchProcessorTest {
  private static final Instant NOW = Instant.parse("2026-06-15T12:00:00Z");

  private static final String VALID = "FPL-RA1234-QUAD-UUEE1000 55.7 37.6";
  private static final String OUTSIDE = "FPL-RA5678-QUAD-UUEE1000 50.0 10.0";
  private static final String INVALID = "FPL QUAD";

  @Test
  void aggregatesStatisticsAcrossBatch() {
    BatchProcessor processor = processor(Clock.fixed(NOW, ZoneOffset.UTC));

    BatchResult result = processor.process(List.of(VALID, VALID, OUTSIDE, INVALID), NOW);
    BatchStatistics stats = result.statistics();

    assertThat(stats.originalCount()).isEqualTo(4);
    assertThat(stats.processedCount()).isEqualTo(4);
    assertThat(stats.validCount()).isEqualTo(3);
    assertThat(stats.invalidCount()).isEqualTo(1);
    assertThat(stats.warningCount()).isEqualTo(2);
    assertThat(stats.duplicatesRemoved()).isEqualTo(1);
    assertThat(stats.acceptedCount()).isEqualTo(2);
    assertThat(stats.truncated()).isFalse();
    assertThat(stats.validationErrors()).containsExactly(
        "Flight identifier is missing",
        "Departure time is missing",
        "Departure coordinates are missing");
    assertThat(stats.warnings()).containsExactly(
        "Departure coordinates may be outside the territory",
        "Aircraft type not specified, set to UNKN");
    assertThat(stats.duplicateGroups()).containsExactly(List.of("RA1234"));
  }

  @Test
  void returnsNormalizedAcceptedRecordsInInputOrder() {
    BatchProcessor processor = processor(Clock.fixed(NOW, ZoneOffset.UTC));

    BatchResult result = processor.process(List.of(OUTSIDE, VALID), NOW);

    assertThat(result.acceptedRecords())
        .extracting(ParsedRecord::getFlightId)
        .containsExactly("RA5678", "RA1234");
    assertThat(result.acceptedRecords().get(1).getAircraftType()).isEqualTo("QUAD");
  }

  @Test
  void carriesValidationWarningsOnAcceptedRecords() {
    BatchResult result = processor(Clock.fixed(NOW, ZoneOffset.UTC)).process(List.of(OUTSIDE, VALID), NOW);

    assertThat(result.acceptedRecords().get(0).getValidationWarnings())
        .containsExactly("Departure coordinates may be outside the territory");
    assertThat(result.acceptedRecords().get(1).getValidationWarnings()).isEmpty();
  }

  @Test
  void dropsRecordsAlreadySeenInEarlierChunk() {
    BatchProcessor processor = processor(Clock.fixed(NOW, ZoneOffset.UTC));
    Set<String> seen = new HashSet<>();

    BatchResult first = processor.process(List.of(VALID), NOW, Duration.ofMinutes(5), seen);
    BatchResult second = processor.process(List.of(VALID, OUTSIDE), NOW, Duration.ofMinutes(5), seen);

    assertThat(first.acceptedRecords()).hasSize(1);
    assertThat(second.acceptedRecords())
        .extracting(ParsedRecord::getFlightId)
        .containsExactly("RA5678");
    assertThat(second.statistics().duplicatesRemoved()).isEqualTo(1);
    assertThat(second.statistics().duplicateGroups()).containsExactly(List.of("RA1234"));
  }

  @Test
  void handlesEmptyBatch() {
    BatchResult result = processor(Clock.fixed(NOW, ZoneOffset.UTC)).process(List.of(), NOW);

    assertThat(result.acceptedRecords()).isEmpty();
    assertThat(result.statistics().originalCount()).isZero();
    assertThat(result.statistics().acceptedCount()).isZero();
  }

  @Test
  void stopsWhenTimeBudgetIsExhausted() {
    BatchProcessor processor = processor(new TickingClock(NOW, Duration.ofMinutes(1)));

    BatchResult result = processor.process(List.of(VALID, OUTSIDE, INVALID), NOW, Duration.ofSeconds(90));
    BatchStatistics stats = result.statistics();

    assertThat(stats.truncated()).isTrue();
    assertThat(stats.originalCount()).isEqualTo(3);
    assertThat(stats.processedCount()).isEqualTo(1);
    assertThat(stats.validCount()).isEqualTo(1);
    assertThat(result.acceptedRecords()).extracting(ParsedRecord::getFlightId).containsExactly("RA1234");
  }

  private static BatchProcessor processor(Clock clock) {
    ProcessorProperties properties = new ProcessorProperties();
    Clock fixed = Clock.fixed(NOW, ZoneOffset.UTC);
    return new BatchProcessor(
        new MessageParser(properties.getTerritory().toBbox(), fixed),
        new FlightRecordValidator(properties, fixed),
        new Deduplicator(),
        clock);
  }

  /** Clock that moves forward by a fixed step on every read. */
  private static final class TickingClock extends Clock {
    private Instant current;
    private final Duration step;

    TickingClock(Instant start, Duration step) {
      this.current = start;
      this.step = step;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      Instant value = current;
      current = current.plus(step);
      return value;
    }
  }
}
