package com.uavradar.processor.config;

import com.uavradar.processor.model.Bbox;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the processor service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code processor.*} prefix.
 */
@ConfigurationProperties(prefix = "processor")
public class ProcessorProperties {
  private final Redis redis = new Redis();
  private final Territory territory = new Territory();
  private final Batch batch = new Batch();
  private final Validation validation = new Validation();
  private long pollTimeoutSeconds = 2;

  public Redis getRedis() {
    return redis;
  }

  public Territory getTerritory() {
    return territory;
  }

  public Batch getBatch() {
    return batch;
  }

  public Validation getValidation() {
    return validation;
  }

  public long getPollTimeoutSeconds() {
    return pollTimeoutSeconds;
  }

  public void setPollTimeoutSeconds(long pollTimeoutSeconds) {
    this.pollTimeoutSeconds = pollTimeoutSeconds;
  }

  /** Redis key names used by the processor read/write path. */
  public static class Redis {
    private String inputKey = "uavradar:telegrams:queue";
    private String flightsKey = "uavradar:flights";
    private String batchStatusKeyPrefix = "uavradar:batch:";
    private long batchStatusTtlSeconds = 604800;

    public String getInputKey() {
      return inputKey;
    }

    public void setInputKey(String inputKey) {
      this.inputKey = inputKey;
    }

    public String getFlightsKey() {
      return flightsKey;
    }

    public void setFlightsKey(String flightsKey) {
      this.flightsKey = flightsKey;
    }

    public String getBatchStatusKeyPrefix() {
      return batchStatusKeyPrefix;
    }

    public void setBatchStatusKeyPrefix(String batchStatusKeyPrefix) {
      this.batchStatusKeyPrefix = batchStatusKeyPrefix;
    }

    public long getBatchStatusTtlSeconds() {
      return batchStatusTtlSeconds;
    }

    public void setBatchStatusTtlSeconds(long batchStatusTtlSeconds) {
      this.batchStatusTtlSeconds = batchStatusTtlSeconds;
    }
  }

  /** Approximate territorial envelope used as a cheap plausibility filter for coordinates. */
  public static class Territory {
    private double latMin = 41.0;
    private double latMax = 82.0;
    private double lonMin = 19.0;
    private double lonMax = 180.0;

    public double getLatMin() {
      return latMin;
    }

    public void setLatMin(double latMin) {
      this.latMin = latMin;
    }

    public double getLatMax() {
      return latMax;
    }

    public void setLatMax(double latMax) {
      this.latMax = latMax;
    }

    public double getLonMin() {
      return lonMin;
    }

    public void setLonMin(double lonMin) {
      this.lonMin = lonMin;
    }

    public double getLonMax() {
      return lonMax;
    }

    public void setLonMax(double lonMax) {
      this.lonMax = lonMax;
    }

    public Bbox toBbox() {
      if (latMin >= latMax || lonMin >= lonMax) {
        throw new IllegalStateException(
            "Invalid processor.territory envelope: lat " + latMin + ".." + latMax
                + ", lon " + lonMin + ".." + lonMax);
      }
      return new Bbox(lonMin, latMin, lonMax, latMax);
    }
  }

  /** Batch assembly limits for the queue consumer. */
  public static class Batch {
    private int maxSize = 1000;
    private Duration timeBudget = Duration.ofMinutes(5);

    public int getMaxSize() {
      return maxSize;
    }

    public void setMaxSize(int maxSize) {
      this.maxSize = maxSize;
    }

    public Duration getTimeBudget() {
      return timeBudget;
    }

    public void setTimeBudget(Duration timeBudget) {
      this.timeBudget = timeBudget;
    }
  }

  /** Plausibility thresholds applied by the record validator. */
  public static class Validation {
    private Duration maxFlightDuration = Duration.ofHours(24);
    private Duration minFlightDuration = Duration.ofMinutes(1);
    private Duration maxDepartureAge = Duration.ofDays(365);
    private Duration maxDepartureLead = Duration.ofDays(30);
    private int maxAltitudeMeters = 10000;
    private double maxSpeedKmh = 500.0;

    public Duration getMaxFlightDuration() {
      return maxFlightDuration;
    }

    public void setMaxFlightDuration(Duration maxFlightDuration) {
      this.maxFlightDuration = maxFlightDuration;
    }

    public Duration getMinFlightDuration() {
      return minFlightDuration;
    }

    public void setMinFlightDuration(Duration minFlightDuration) {
      this.minFlightDuration = minFlightDuration;
    }

    public Duration getMaxDepartureAge() {
      return maxDepartureAge;
    }

    public void setMaxDepartureAge(Duration maxDepartureAge) {
      this.maxDepartureAge = maxDepartureAge;
    }

    public Duration getMaxDepartureLead() {
      return maxDepartureLead;
    }

    public void setMaxDepartureLead(Duration maxDepartureLead) {
      this.maxDepartureLead = maxDepartureLead;
    }

    public int getMaxAltitudeMeters() {
      return maxAltitudeMeters;
    }

    public void setMaxAltitudeMeters(int maxAltitudeMeters) {
      this.maxAltitudeMeters = maxAltitudeMeters;
    }

    public double getMaxSpeedKmh() {
      return maxSpeedKmh;
    }

    public void setMaxSpeedKmh(double maxSpeedKmh) {
      this.maxSpeedKmh = maxSpeedKmh;
    }
  }
}
