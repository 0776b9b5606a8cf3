package com.uavradar.ingester.redis;

import com.uavradar.ingester.config.IngesterProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisPublisher {
  private static final Logger log = LoggerFactory.getLogger(RedisPublisher.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final IngesterProperties properties;

  public RedisPublisher(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      IngesterProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  public int publish(String batchId, String source, List<String> messages) {
    int pushed = 0;
    for (String message : messages) {
      try {
        // One envelope per telegram, in file order, at the tail of the Redis List.
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("batch_id", batchId);
        payload.put("source", source);
        payload.put("raw", message);
        payload.put("ingested_at", Instant.now().toString());
        redisTemplate.opsForList().rightPush(properties.redis().key(), objectMapper.writeValueAsString(payload));
        pushed++;
      } catch (JsonProcessingException ex) {
        log.warn("Failed to serialize telegram envelope", ex);
      }
    }
    return pushed;
  }
}
