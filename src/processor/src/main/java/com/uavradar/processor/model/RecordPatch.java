package com.uavradar.processor.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Normalized field values produced by validation.
 *
 * <p>Each slot is optional; {@link ParsedRecord#apply(RecordPatch)} copies only the slots that
 * are set. Instances are immutable and created through {@link #builder()}.
 */
public final class RecordPatch {
  private static final RecordPatch EMPTY = builder().build();

  private final String flightId;
  private final String aircraftType;
  private final Instant departureTime;
  private final Instant arrivalTime;
  private final Long durationMinutes;
  private final Coordinates departureCoordinates;
  private final Coordinates arrivalCoordinates;
  private final Integer altitude;
  private final Double distanceKm;
  private final Double averageSpeedKmh;

  private RecordPatch(Builder builder) {
    this.flightId = builder.flightId;
    this.aircraftType = builder.aircraftType;
    this.departureTime = builder.departureTime;
    this.arrivalTime = builder.arrivalTime;
    this.durationMinutes = builder.durationMinutes;
    this.departureCoordinates = builder.departureCoordinates;
    this.arrivalCoordinates = builder.arrivalCoordinates;
    this.altitude = builder.altitude;
    this.distanceKm = builder.distanceKm;
    this.averageSpeedKmh = builder.averageSpeedKmh;
  }

  public static RecordPatch empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> flightId() {
    return Optional.ofNullable(flightId);
  }

  public Optional<String> aircraftType() {
    return Optional.ofNullable(aircraftType);
  }

  public Optional<Instant> departureTime() {
    return Optional.ofNullable(departureTime);
  }

  public Optional<Instant> arrivalTime() {
    return Optional.ofNullable(arrivalTime);
  }

  public Optional<Long> durationMinutes() {
    return Optional.ofNullable(durationMinutes);
  }

  public Optional<Coordinates> departureCoordinates() {
    return Optional.ofNullable(departureCoordinates);
  }

  public Optional<Coordinates> arrivalCoordinates() {
    return Optional.ofNullable(arrivalCoordinates);
  }

  public Optional<Integer> altitude() {
    return Optional.ofNullable(altitude);
  }

  public Optional<Double> distanceKm() {
    return Optional.ofNullable(distanceKm);
  }

  public Optional<Double> averageSpeedKmh() {
    return Optional.ofNullable(averageSpeedKmh);
  }

  /** Mutable builder; each sub-check of the validator fills its own slots. */
  public static final class Builder {
    private String flightId;
    private String aircraftType;
    private Instant departureTime;
    private Instant arrivalTime;
    private Long durationMinutes;
    private Coordinates departureCoordinates;
    private Coordinates arrivalCoordinates;
    private Integer altitude;
    private Double distanceKm;
    private Double averageSpeedKmh;

    private Builder() {}

    public Builder flightId(String flightId) {
      this.flightId = flightId;
      return this;
    }

    public Builder aircraftType(String aircraftType) {
      this.aircraftType = aircraftType;
      return this;
    }

    public Builder departureTime(Instant departureTime) {
      this.departureTime = departureTime;
      return this;
    }

    public Builder arrivalTime(Instant arrivalTime) {
      this.arrivalTime = arrivalTime;
      return this;
    }

    public Builder durationMinutes(Long durationMinutes) {
      this.durationMinutes = durationMinutes;
      return this;
    }

    public Builder departureCoordinates(Coordinates departureCoordinates) {
      this.departureCoordinates = departureCoordinates;
      return this;
    }

    public Builder arrivalCoordinates(Coordinates arrivalCoordinates) {
      this.arrivalCoordinates = arrivalCoordinates;
      return this;
    }

    public Builder altitude(Integer altitude) {
      this.altitude = altitude;
      return this;
    }

    public Builder distanceKm(Double distanceKm) {
      this.distanceKm = distanceKm;
      return this;
    }

    public Builder averageSpeedKmh(Double averageSpeedKmh) {
      this.averageSpeedKmh = averageSpeedKmh;
      return this;
    }

    public RecordPatch build() {
      return new RecordPatch(this);
    }
  }
}
