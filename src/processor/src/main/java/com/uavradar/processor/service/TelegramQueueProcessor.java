package com.uavradar.processor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uavradar.processor.batch.BatchProcessor;
import com.uavradar.processor.batch.BatchResult;
import com.uavradar.processor.batch.BatchStatistics;
import com.uavradar.processor.config.ProcessorProperties;
import com.uavradar.processor.geo.RegionInfo;
import com.uavradar.processor.geo.SpatialRegionLookup;
import com.uavradar.processor.model.Coordinates;
import com.uavradar.processor.model.ParsedRecord;
import com.uavradar.processor.sink.BatchStatusStore;
import com.uavradar.processor.sink.FlightDocument;
import com.uavradar.processor.sink.PersistenceSink;
import com.uavradar.processor.sink.SaveOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Main processing loop for Redis-backed telegram batches.
 *
 * <p>This component:
 * <ul>
 *   <li>consumes telegram envelopes from the Redis input list in FIFO order</li>
 *   <li>groups consecutive envelopes of the same ingest batch and runs the batch pipeline</li>
 *   <li>geocodes and stores each accepted record, one at a time</li>
 *   <li>emits low-cardinality operational metrics</li>
 * </ul>
 *
 * <p>A pending batch is flushed when the batch id changes, when it reaches
 * {@code processor.batch.max-size}, or when the queue is idle for one poll timeout. Chunks of
 * the same batch id share one fingerprint set, so deduplication spans the whole batch.
 * Envelopes still pending at shutdown are flushed once the loop has stopped.
 */
@Component
public class TelegramQueueProcessor {
  private static final Logger LOGGER = LoggerFactory.getLogger(TelegramQueueProcessor.class);
  static final String UNBATCHED = "unbatched";

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final ProcessorProperties properties;
  private final BatchProcessor batchProcessor;
  private final PersistenceSink sink;
  private final BatchStatusStore batchStatusStore;
  private final Optional<SpatialRegionLookup> regionLookup;
  private final Clock clock;
  private final ExecutorService executor;
  private final MeterRegistry meterRegistry;
  private final Counter receivedCounter;
  private final Counter payloadErrorCounter;
  private final Counter loopErrorCounter;
  private final Counter validCounter;
  private final Counter invalidCounter;
  private final Counter warningCounter;
  private final Counter duplicateCounter;
  private final Counter skippedCounter;
  private final Counter droppedCounter;
  private final ConcurrentHashMap<String, Counter> saveCounters;
  private final ConcurrentHashMap<String, Counter> geocodeCounters;
  private final AtomicLong lastBatchEpoch;
  private final AtomicLong queueDepth;
  private final List<TelegramEnvelope> pending = new ArrayList<>();
  private final Set<String> seenFingerprints = new HashSet<>();
  private String seenBatchId;

  public TelegramQueueProcessor(
    StringRedisTemplate redisTemplate,
    ObjectMapper objectMapper,
    ProcessorProperties properties,
    MeterRegistry meterRegistry,
    BatchProcessor batchProcessor,
    PersistenceSink sink,
    BatchStatusStore batchStatusStore,
    Optional<SpatialRegionLookup> regionLookup,
    Clock clock
  ) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.batchProcessor = batchProcessor;
    this.sink = sink;
    this.batchStatusStore = batchStatusStore;
    this.regionLookup = regionLookup;
    this.clock = clock;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "telegram-processor-loop");
      thread.setDaemon(true);
      return thread;
    });
    this.meterRegistry = meterRegistry;
    this.receivedCounter = meterRegistry.counter("processor.telegrams.received");
    this.payloadErrorCounter = meterRegistry.counter("processor.telegrams.payload_errors");
    this.loopErrorCounter = meterRegistry.counter("processor.loop.errors");
    this.validCounter = meterRegistry.counter("processor.telegrams.valid");
    this.invalidCounter = meterRegistry.counter("processor.telegrams.invalid");
    this.warningCounter = meterRegistry.counter("processor.telegrams.with_warnings");
    this.duplicateCounter = meterRegistry.counter("processor.telegrams.duplicates");
    this.skippedCounter = meterRegistry.counter("processor.telegrams.skipped");
    this.droppedCounter = meterRegistry.counter("processor.telegrams.dropped");
    this.saveCounters = new ConcurrentHashMap<>();
    this.geocodeCounters = new ConcurrentHashMap<>();
    this.lastBatchEpoch = meterRegistry.gauge("processor.last_batch_epoch", new AtomicLong(0));
    this.queueDepth = meterRegistry.gauge("processor.queue.depth", new AtomicLong(0));
    meterRegistry.gauge(
        "processor.geocoding.enabled",
        regionLookup,
        lookup -> lookup.isPresent() ? 1 : 0
    );
  }

  /** Starts the background processing loop after Spring context initialization. */
  @jakarta.annotation.PostConstruct
  public void start() {
    executor.submit(this::runLoop);
  }

  /**
   * Stops the processing loop, waits briefly for a clean shutdown, then flushes envelopes that
   * were already popped from Redis.
   */
  @jakarta.annotation.PreDestroy
  public void stop() {
    executor.shutdownNow();
    try {
      if (executor.awaitTermination(5, TimeUnit.SECONDS)) {
        drainPending();
      } else {
        droppedCounter.increment(pending.size());
        LOGGER.warn("Processor loop did not stop in time, {} pending telegrams dropped", pending.size());
      }
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private void drainPending() {
    int count = pending.size();
    if (count == 0) {
      return;
    }
    try {
      flushPending();
      LOGGER.info("Flushed {} pending telegrams on shutdown", count);
    } catch (RuntimeException ex) {
      droppedCounter.increment(count);
      LOGGER.warn("Failed to flush {} pending telegrams on shutdown", count, ex);
    }
  }

  private void runLoop() {
    Duration timeout = Duration.ofSeconds(properties.getPollTimeoutSeconds());
    while (!Thread.currentThread().isInterrupted()) {
      try {
        String payload = redisTemplate.opsForList().leftPop(
          properties.getRedis().getInputKey(),
          timeout
        );
        if (payload == null) {
          flushPending();
        } else {
          handlePayload(payload);
        }
        refreshQueueDepth();
      } catch (Exception ex) {
        if (isInterruptedShutdown(ex)) {
          Thread.currentThread().interrupt();
          LOGGER.debug("Processor loop interrupted during shutdown");
          return;
        }
        loopErrorCounter.increment();
        LOGGER.warn("Processor loop error", ex);
      }
    }
  }

  private static boolean isInterruptedShutdown(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof InterruptedException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  /**
   * Decodes one queue payload and adds it to the pending batch.
   *
   * @param payload JSON envelope
   */
  void handlePayload(String payload) {
    TelegramEnvelope envelope;
    try {
      envelope = objectMapper.readValue(payload, TelegramEnvelope.class);
    } catch (Exception ex) {
      payloadErrorCounter.increment();
      LOGGER.debug("Failed to parse payload", ex);
      return;
    }
    if (envelope.raw() == null) {
      payloadErrorCounter.increment();
      return;
    }

    receivedCounter.increment();
    if (!pending.isEmpty() && !Objects.equals(batchIdOf(pending.get(0)), batchIdOf(envelope))) {
      flushPending();
    }
    pending.add(envelope);
    if (pending.size() >= Math.max(1, properties.getBatch().getMaxSize())) {
      flushPending();
    }
  }

  /** Runs the batch pipeline over pending envelopes and dispatches accepted records. */
  void flushPending() {
    if (pending.isEmpty()) {
      return;
    }
    List<TelegramEnvelope> batch = List.copyOf(pending);
    pending.clear();

    String batchId = batchIdOf(batch.get(0));
    String source = batch.get(0).source();
    List<String> lines = batch.stream().map(TelegramEnvelope::raw).toList();

    if (!batchId.equals(seenBatchId)) {
      seenBatchId = batchId;
      seenFingerprints.clear();
    }

    BatchResult result = batchProcessor.process(
        lines,
        clock.instant(),
        properties.getBatch().getTimeBudget(),
        seenFingerprints);
    BatchStatistics stats = result.statistics();
    recordStatistics(stats);

    int stored = 0;
    for (ParsedRecord record : result.acceptedRecords()) {
      if (dispatch(record, batchId, source) == SaveOutcome.STORED) {
        stored++;
      }
    }

    batchStatusStore.record(batchId, source, stats, stored, stats.truncated() ? "truncated" : "processed");
    lastBatchEpoch.set(clock.instant().getEpochSecond());
    LOGGER.info(
        "Batch {} ({}): {} lines, {} valid, {} invalid, {} duplicates, {} accepted, {} stored",
        batchId,
        source,
        stats.originalCount(),
        stats.validCount(),
        stats.invalidCount(),
        stats.duplicatesRemoved(),
        stats.acceptedCount(),
        stored);
  }

  private void recordStatistics(BatchStatistics stats) {
    validCounter.increment(stats.validCount());
    invalidCounter.increment(stats.invalidCount());
    warningCounter.increment(stats.warningCount());
    duplicateCounter.increment(stats.duplicatesRemoved());
    if (stats.truncated()) {
      skippedCounter.increment(stats.originalCount() - stats.processedCount());
    }
    if (!stats.validationErrors().isEmpty()) {
      LOGGER.debug("Validation errors: {}", stats.validationErrors());
    }
    if (!stats.warnings().isEmpty()) {
      LOGGER.debug("Validation warnings: {}", stats.warnings());
    }
  }

  private SaveOutcome dispatch(ParsedRecord record, String batchId, String source) {
    Optional<RegionInfo> departureRegion = geocode(record.getDepartureCoordinates());
    Optional<RegionInfo> arrivalRegion = geocode(record.getArrivalCoordinates());
    FlightDocument document = FlightDocument.from(
        record, batchId, source, departureRegion, arrivalRegion, clock.instant());

    SaveOutcome outcome;
    try {
      outcome = sink.save(document);
    } catch (RuntimeException ex) {
      LOGGER.warn("Failed to store flight {}", record.getFlightId(), ex);
      outcome = SaveOutcome.FAILED;
    }
    countOutcome(saveCounters, "processor.flights.saved", outcome.name().toLowerCase());
    return outcome;
  }

  private Optional<RegionInfo> geocode(Coordinates point) {
    if (point == null || regionLookup.isEmpty()) {
      return Optional.empty();
    }
    try {
      Optional<RegionInfo> region = regionLookup.get().geocode(point.longitude(), point.latitude());
      countOutcome(geocodeCounters, "processor.geocoding.lookups", region.isPresent() ? "hit" : "miss");
      return region;
    } catch (RuntimeException ex) {
      countOutcome(geocodeCounters, "processor.geocoding.lookups", "error");
      LOGGER.debug("Region lookup failed for {}", point, ex);
      return Optional.empty();
    }
  }

  private void countOutcome(ConcurrentHashMap<String, Counter> counters, String name, String outcome) {
    counters.computeIfAbsent(
        outcome,
        o -> meterRegistry.counter(name, "outcome", o)
    ).increment();
  }

  private static String batchIdOf(TelegramEnvelope envelope) {
    String batchId = envelope.batchId();
    return batchId == null || batchId.isBlank() ? UNBATCHED : batchId;
  }

  private void refreshQueueDepth() {
    try {
      Long size = redisTemplate.opsForList().size(properties.getRedis().getInputKey());
      if (size != null) {
        queueDepth.set(size);
      }
    } catch (Exception ignored) {
      // ignore errors to avoid impacting the processing loop
    }
  }
}
