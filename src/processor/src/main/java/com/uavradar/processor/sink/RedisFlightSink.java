package com.uavradar.processor.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uavradar.processor.config.ProcessorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Stores flight documents as JSON in a Redis hash keyed by idempotency key.
 *
 * <p>Writes use {@code HSETNX}, so a flight already stored by an earlier batch is left
 * untouched and reported as {@link SaveOutcome#ALREADY_STORED}.
 */
@Component
public class RedisFlightSink implements PersistenceSink {
  private static final Logger LOGGER = LoggerFactory.getLogger(RedisFlightSink.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final ProcessorProperties properties;

  public RedisFlightSink(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      ProcessorProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public SaveOutcome save(FlightDocument document) {
    try {
      String payload = objectMapper.writeValueAsString(document);
      Boolean stored = redisTemplate.opsForHash()
          .putIfAbsent(properties.getRedis().getFlightsKey(), document.idempotencyKey(), payload);
      return Boolean.TRUE.equals(stored) ? SaveOutcome.STORED : SaveOutcome.ALREADY_STORED;
    } catch (JsonProcessingException ex) {
      LOGGER.warn("Failed to serialize flight {}", document.flightId(), ex);
      return SaveOutcome.FAILED;
    } catch (DataAccessException ex) {
      LOGGER.warn("Failed to store flight {}", document.flightId(), ex);
      return SaveOutcome.FAILED;
    }
  }
}
