package com.uavradar.processor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uavradar.processor.batch.BatchProcessor;
import com.uavradar.processor.batch.BatchStatistics;
import com.uavradar.processor.config.ProcessorProperties;
import com.uavradar.processor.dedup.Deduplicator;
import com.uavradar.processor.geo.RegionInfo;
import com.uavradar.processor.geo.SpatialRegionLookup;
import com.uavradar.processor.sink.BatchStatusStore;
import com.uavradar.processor.sink.FlightDocument;
import com.uavradar.processor.sink.PersistenceSink;
import com.uavradar.processor.sink.SaveOutcome;
import com.uavradar.processor.telegram.MessageParser;
import com.uavradar.processor.validation.FlightRecordValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.StringRedisTemplate;

class TelegramQueueProcessorTest {
  private static final Instant NOW = Instant.parse("2026-06-15T12:00:00Z");
  private static final String VALID = "FPL-RA1234-QUAD-UUEE1000 55.7 37.6 55.9 37.9";
  private static final String OTHER = "FPL-RA5678-HELI-UUEE1030 56.0 38.0";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private ProcessorProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private PersistenceSink sink;
  private BatchStatusStore batchStatusStore;

  @BeforeEach
  void setUp() {
    properties = new ProcessorProperties();
    meterRegistry = new SimpleMeterRegistry();
    sink = mock(PersistenceSink.class);
    batchStatusStore = mock(BatchStatusStore.class);
    when(sink.save(any())).thenReturn(SaveOutcome.STORED);
  }

  @Test
  void flushesPendingBatchWhenBatchIdChanges() throws Exception {
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload(envelope("b1", VALID));
    processor.handlePayload(envelope("b1", VALID));
    verify(sink, never()).save(any());

    processor.handlePayload(envelope("b2", OTHER));

    ArgumentCaptor<BatchStatistics> stats = ArgumentCaptor.forClass(BatchStatistics.class);
    verify(batchStatusStore).record(eq("b1"), eq("file:a.txt"), stats.capture(), eq(1), eq("processed"));
    assertThat(stats.getValue().originalCount()).isEqualTo(2);
    assertThat(stats.getValue().duplicatesRemoved()).isEqualTo(1);
    verify(sink, times(1)).save(any());

    processor.flushPending();

    verify(batchStatusStore).record(eq("b2"), eq("file:a.txt"), any(), eq(1), eq("processed"));
    verify(sink, times(2)).save(any());
    assertThat(meterRegistry.counter("processor.telegrams.received").count()).isEqualTo(3.0);
    assertThat(meterRegistry.counter("processor.telegrams.duplicates").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("processor.flights.saved", "outcome", "stored").count()).isEqualTo(2.0);
  }

  @Test
  void flushesWhenMaxBatchSizeIsReached() throws Exception {
    properties.getBatch().setMaxSize(2);
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload(envelope("b1", VALID));
    processor.handlePayload(envelope("b1", OTHER));

    verify(batchStatusStore).record(eq("b1"), anyString(), any(), eq(2), eq("processed"));
  }

  @Test
  void dedupesAcrossChunksOfTheSameBatch() throws Exception {
    properties.getBatch().setMaxSize(2);
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload(envelope("b1", VALID));
    processor.handlePayload(envelope("b1", VALID));
    processor.handlePayload(envelope("b1", VALID));
    processor.flushPending();

    verify(sink, times(1)).save(any());
    verify(batchStatusStore, times(2)).record(eq("b1"), anyString(), any(), anyInt(), eq("processed"));
    assertThat(meterRegistry.counter("processor.telegrams.duplicates").count()).isEqualTo(2.0);
  }

  @Test
  void forgetsFingerprintsWhenBatchIdChanges() throws Exception {
    properties.getBatch().setMaxSize(1);
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload(envelope("b1", VALID));
    processor.handlePayload(envelope("b2", VALID));

    verify(sink, times(2)).save(any());
    assertThat(meterRegistry.counter("processor.telegrams.duplicates").count()).isEqualTo(0.0);
  }

  @Test
  void flushesPendingEnvelopesOnStop() throws Exception {
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload(envelope("b1", VALID));
    verify(sink, never()).save(any());

    processor.stop();

    verify(sink, times(1)).save(any());
    verify(batchStatusStore).record(eq("b1"), eq("file:a.txt"), any(), eq(1), eq("processed"));
    assertThat(meterRegistry.counter("processor.telegrams.dropped").count()).isEqualTo(0.0);
  }

  @Test
  void countsPendingEnvelopesDroppedWhenShutdownFlushFails() throws Exception {
    doThrow(new IllegalStateException("redis down"))
        .when(batchStatusStore).record(anyString(), any(), any(), anyInt(), anyString());
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload(envelope("b1", VALID));
    processor.handlePayload(envelope("b1", OTHER));
    processor.stop();

    assertThat(meterRegistry.counter("processor.telegrams.dropped").count()).isEqualTo(2.0);
  }

  @Test
  void attachesValidationWarningsToStoredDocument() throws Exception {
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload(envelope("b1", "FPL-RA5678-QUAD-UUEE1000 50.0 10.0"));
    processor.flushPending();

    ArgumentCaptor<FlightDocument> document = ArgumentCaptor.forClass(FlightDocument.class);
    verify(sink).save(document.capture());
    assertThat(document.getValue().warnings())
        .containsExactly("Departure coordinates may be outside the territory");
    assertThat(document.getValue().parseErrors()).isEmpty();
  }

  @Test
  void groupsEnvelopesWithoutBatchIdTogether() throws Exception {
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload(objectMapper.writeValueAsString(Map.of("raw", VALID)));
    processor.handlePayload(objectMapper.writeValueAsString(Map.of("raw", OTHER, "batch_id", " ")));
    processor.flushPending();

    verify(batchStatusStore, times(1))
        .record(eq(TelegramQueueProcessor.UNBATCHED), any(), any(), eq(2), eq("processed"));
  }

  @Test
  void skipsUndecodablePayloads() {
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload("{not json");
    processor.handlePayload("{\"batch_id\":\"b1\"}");
    processor.flushPending();

    assertThat(meterRegistry.counter("processor.telegrams.payload_errors").count()).isEqualTo(2.0);
    verify(batchStatusStore, never()).record(anyString(), any(), any(), anyInt(), anyString());
  }

  @Test
  void doesNotStoreInvalidTelegrams() throws Exception {
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload(envelope("b1", "FPL QUAD"));
    processor.flushPending();

    verify(sink, never()).save(any());
    verify(batchStatusStore).record(eq("b1"), any(), any(), eq(0), eq("processed"));
    assertThat(meterRegistry.counter("processor.telegrams.invalid").count()).isEqualTo(1.0);
  }

  @Test
  void attachesResolvedRegionsToStoredDocument() throws Exception {
    SpatialRegionLookup lookup = mock(SpatialRegionLookup.class);
    when(lookup.geocode(37.6, 55.7))
        .thenReturn(Optional.of(new RegionInfo("77", "Moscow", "Central", "city")));
    when(lookup.geocode(37.9, 55.9))
        .thenReturn(Optional.of(new RegionInfo("50", "Moscow Oblast", "Central", "oblast")));
    TelegramQueueProcessor processor = processor(Optional.of(lookup));

    processor.handlePayload(envelope("b1", VALID));
    processor.flushPending();

    ArgumentCaptor<FlightDocument> document = ArgumentCaptor.forClass(FlightDocument.class);
    verify(sink).save(document.capture());
    assertThat(document.getValue().regionDepartureCode()).isEqualTo("77");
    assertThat(document.getValue().regionArrival()).isEqualTo("Moscow Oblast");
    assertThat(document.getValue().batchId()).isEqualTo("b1");
    assertThat(document.getValue().messageSource()).isEqualTo("file:a.txt");
    assertThat(meterRegistry.counter("processor.geocoding.lookups", "outcome", "hit").count()).isEqualTo(2.0);
  }

  @Test
  void storesRecordEvenWhenGeocodingFails() throws Exception {
    SpatialRegionLookup lookup = mock(SpatialRegionLookup.class);
    when(lookup.geocode(anyDouble(), anyDouble())).thenThrow(new IllegalStateException("lookup down"));
    TelegramQueueProcessor processor = processor(Optional.of(lookup));

    processor.handlePayload(envelope("b1", VALID));
    processor.flushPending();

    ArgumentCaptor<FlightDocument> document = ArgumentCaptor.forClass(FlightDocument.class);
    verify(sink).save(document.capture());
    assertThat(document.getValue().regionDepartureCode()).isNull();
    assertThat(meterRegistry.counter("processor.geocoding.lookups", "outcome", "error").count()).isEqualTo(2.0);
  }

  @Test
  void continuesBatchWhenSinkFails() throws Exception {
    when(sink.save(any()))
        .thenThrow(new IllegalStateException("sink down"))
        .thenReturn(SaveOutcome.STORED);
    TelegramQueueProcessor processor = processor(Optional.empty());

    processor.handlePayload(envelope("b1", VALID));
    processor.handlePayload(envelope("b1", OTHER));
    processor.flushPending();

    verify(sink, times(2)).save(any());
    verify(batchStatusStore).record(eq("b1"), any(), any(), eq(1), eq("processed"));
    assertThat(meterRegistry.counter("processor.flights.saved", "outcome", "failed").count()).isEqualTo(1.0);
  }

  private TelegramQueueProcessor processor(Optional<SpatialRegionLookup> lookup) {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    BatchProcessor batchProcessor = new BatchProcessor(
        new MessageParser(properties.getTerritory().toBbox(), clock),
        new FlightRecordValidator(properties, clock),
        new Deduplicator(),
        clock);
    return new TelegramQueueProcessor(
        mock(StringRedisTemplate.class),
        objectMapper,
        properties,
        meterRegistry,
        batchProcessor,
        sink,
        batchStatusStore,
        lookup,
        clock);
  }

  private String envelope(String batchId, String raw) throws Exception {
    return objectMapper.writeValueAsString(Map.of(
        "batch_id", batchId,
        "source", "file:a.txt",
        "raw", raw,
        "ingested_at", "2026-06-15T11:59:00Z",
        "schema_version", 1));
  }
}
