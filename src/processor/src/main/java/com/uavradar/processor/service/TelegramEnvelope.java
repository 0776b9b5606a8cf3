package com.uavradar.processor.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Telegram payload consumed by the processor from Redis.
 *
 * <p>Unknown JSON attributes are ignored to keep ingestion resilient to upstream schema drift.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramEnvelope(
  @JsonProperty("batch_id") String batchId,
  @JsonProperty("source") String source,
  @JsonProperty("raw") String raw,
  @JsonProperty("ingested_at") String ingestedAt
) {}
