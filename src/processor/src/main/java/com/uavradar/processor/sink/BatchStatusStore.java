package com.uavradar.processor.sink;

import com.uavradar.processor.batch.BatchStatistics;
import com.uavradar.processor.config.ProcessorProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Maintains per-batch processing counters in Redis.
 *
 * <p>A batch may be flushed in several chunks, so counters are incremented rather than set.
 * Status writes are best-effort and never interrupt record processing.
 */
@Component
public class BatchStatusStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchStatusStore.class);

  private final StringRedisTemplate redisTemplate;
  private final ProcessorProperties properties;
  private final Clock clock;

  public BatchStatusStore(StringRedisTemplate redisTemplate, ProcessorProperties properties, Clock clock) {
    this.redisTemplate = redisTemplate;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Adds one processed chunk to the batch counters.
   *
   * @param batchId ingest batch identifier
   * @param source ingest source label
   * @param statistics statistics of the chunk
   * @param stored number of documents newly stored by the sink
   * @param status {@code processed}, or {@code truncated} when the time budget cut the chunk short
   */
  public void record(String batchId, String source, BatchStatistics statistics, int stored, String status) {
    String key = properties.getRedis().getBatchStatusKeyPrefix() + batchId;
    try {
      redisTemplate.opsForHash().increment(key, "total", statistics.originalCount());
      redisTemplate.opsForHash().increment(key, "processed", statistics.processedCount());
      redisTemplate.opsForHash().increment(key, "valid", statistics.validCount());
      redisTemplate.opsForHash().increment(key, "invalid", statistics.invalidCount());
      redisTemplate.opsForHash().increment(key, "with_warnings", statistics.warningCount());
      redisTemplate.opsForHash().increment(key, "duplicates", statistics.duplicatesRemoved());
      redisTemplate.opsForHash().increment(key, "accepted", statistics.acceptedCount());
      redisTemplate.opsForHash().increment(key, "stored", stored);
      redisTemplate.opsForHash().putAll(key, Map.of(
          "source", source == null ? "" : source,
          "status", status,
          "updated_at", clock.instant().toString()));
      long ttlSeconds = Math.max(1L, properties.getRedis().getBatchStatusTtlSeconds());
      redisTemplate.expire(key, Duration.ofSeconds(ttlSeconds));
    } catch (Exception ex) {
      LOGGER.debug("Failed to update batch status for {}", batchId, ex);
    }
  }
}
