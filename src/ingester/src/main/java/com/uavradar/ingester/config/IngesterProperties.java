package com.uavradar.ingester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingester")
public record IngesterProperties(long pollMs, Redis redis, Inbox inbox) {
  public record Redis(String key) {}

  public record Inbox(
      String directory,
      String processedDirectory,
      String failedDirectory,
      long maxFileBytes,
      int maxMessages) {}
}
