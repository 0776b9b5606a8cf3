package com.uavradar.processor.validation;

import com.uavradar.processor.config.ProcessorProperties;
import com.uavradar.processor.model.AircraftTypes;
import com.uavradar.processor.model.Bbox;
import com.uavradar.processor.model.Coordinates;
import com.uavradar.processor.model.ParsedRecord;
import com.uavradar.processor.model.RecordPatch;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Semantic checks and normalization for parsed flight records.
 *
 * <p>Validation does not modify the record. Sub-checks run in a fixed order (identifier,
 * aircraft type, time, coordinates, altitude, distance/speed), so error and warning lists are
 * reproducible, and each sub-check writes its own patch slots.
 */
public class FlightRecordValidator {
  static final double KM_PER_DEGREE = 111.0;

  private final ProcessorProperties.Validation limits;
  private final Bbox territory;
  private final Clock clock;

  public FlightRecordValidator(ProcessorProperties properties, Clock clock) {
    this.limits = properties.getValidation();
    this.territory = properties.getTerritory().toBbox();
    this.clock = clock;
  }

  /**
   * Validates a record against the current instant of the configured clock.
   *
   * @param record parsed record
   * @return validation outcome
   */
  public ValidationOutcome validate(ParsedRecord record) {
    return validate(record, clock.instant());
  }

  /**
   * Validates a record against an explicit reference instant.
   *
   * @param record parsed record
   * @param now instant used for the departure plausibility window
   * @return validation outcome
   */
  public ValidationOutcome validate(ParsedRecord record, Instant now) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    RecordPatch.Builder patch = RecordPatch.builder();

    checkFlightId(record.getFlightId(), errors, warnings, patch);
    checkAircraftType(record.getAircraftType(), warnings, patch);
    checkTimes(record.getDepartureTime(), record.getArrivalTime(), now, errors, warnings, patch);
    checkCoordinates(record.getDepartureCoordinates(), record.getArrivalCoordinates(),
        errors, warnings, patch);
    if (record.getAltitude() != null) {
      checkAltitude(record.getAltitude(), warnings, patch);
    }
    if (record.getDepartureCoordinates() != null && record.getArrivalCoordinates() != null) {
      checkDistance(record, warnings, patch);
    }

    return new ValidationOutcome(errors, warnings, patch.build());
  }

  private void checkFlightId(
      String flightId, List<String> errors, List<String> warnings, RecordPatch.Builder patch) {
    if (flightId == null || flightId.isBlank()) {
      errors.add("Flight identifier is missing");
      return;
    }
    String normalized = flightId.trim().toUpperCase(Locale.ROOT);
    if (normalized.length() < 3 || normalized.length() > 7) {
      warnings.add("Non-standard flight identifier length: " + normalized.length());
    }
    boolean allowed = normalized.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-');
    if (!allowed) {
      warnings.add("Flight identifier contains unsupported characters");
    }
    patch.flightId(normalized);
  }

  private void checkAircraftType(String aircraftType, List<String> warnings, RecordPatch.Builder patch) {
    if (aircraftType == null || aircraftType.isBlank()) {
      warnings.add("Aircraft type not specified, set to " + AircraftTypes.UNKN);
      patch.aircraftType(AircraftTypes.UNKN);
      return;
    }
    String normalized = aircraftType.trim().toUpperCase(Locale.ROOT);
    if (!AircraftTypes.isKnown(normalized)) {
      warnings.add("Unknown aircraft type: " + normalized);
      normalized = AircraftTypes.infer(normalized);
      warnings.add("Aircraft type inferred as: " + normalized);
    }
    patch.aircraftType(normalized);
  }

  private void checkTimes(
      Instant departure,
      Instant arrival,
      Instant now,
      List<String> errors,
      List<String> warnings,
      RecordPatch.Builder patch) {
    if (departure == null) {
      errors.add("Departure time is missing");
      return;
    }
    if (departure.isBefore(now.minus(limits.getMaxDepartureAge()))) {
      warnings.add("Departure time is more than " + limits.getMaxDepartureAge().toDays()
          + " days in the past");
    } else if (departure.isAfter(now.plus(limits.getMaxDepartureLead()))) {
      warnings.add("Departure time is more than " + limits.getMaxDepartureLead().toDays()
          + " days in the future");
    }
    patch.departureTime(departure);

    if (arrival == null) {
      return;
    }
    Duration duration = Duration.between(departure, arrival);
    if (!arrival.isAfter(departure)) {
      errors.add("Arrival time must be after departure time");
    } else if (duration.compareTo(limits.getMaxFlightDuration()) > 0) {
      warnings.add(String.format(Locale.ROOT, "Flight duration too long: %.1f hours",
          duration.getSeconds() / 3600.0));
    } else if (duration.compareTo(limits.getMinFlightDuration()) < 0) {
      warnings.add(String.format(Locale.ROOT, "Flight duration too short: %.1f minutes",
          duration.getSeconds() / 60.0));
    }
    patch.arrivalTime(arrival);
    patch.durationMinutes(Math.floorDiv(duration.getSeconds(), 60L));
  }

  private void checkCoordinates(
      Coordinates departure,
      Coordinates arrival,
      List<String> errors,
      List<String> warnings,
      RecordPatch.Builder patch) {
    if (departure == null) {
      errors.add("Departure coordinates are missing");
      return;
    }
    checkPoint("Departure", departure, errors, warnings);
    patch.departureCoordinates(departure);

    if (arrival != null) {
      checkPoint("Arrival", arrival, errors, warnings);
      patch.arrivalCoordinates(arrival);
    }
  }

  private void checkPoint(String label, Coordinates point, List<String> errors, List<String> warnings) {
    boolean lonValid = point.longitude() >= -180.0 && point.longitude() <= 180.0;
    boolean latValid = point.latitude() >= -90.0 && point.latitude() <= 90.0;
    if (!lonValid) {
      errors.add(label + " longitude out of range: " + point.longitude());
    }
    if (!latValid) {
      errors.add(label + " latitude out of range: " + point.latitude());
    }
    if (lonValid && latValid && !territory.contains(point)) {
      warnings.add(label + " coordinates may be outside the territory");
    }
  }

  private void checkAltitude(int altitude, List<String> warnings, RecordPatch.Builder patch) {
    if (altitude < 0) {
      warnings.add("Negative altitude: " + altitude + " m");
    } else if (altitude > limits.getMaxAltitudeMeters()) {
      warnings.add("Altitude above ceiling: " + altitude + " m");
    }
    patch.altitude(altitude);
  }

  private void checkDistance(ParsedRecord record, List<String> warnings, RecordPatch.Builder patch) {
    double distanceKm = record.getDepartureCoordinates()
        .planarDistanceDegrees(record.getArrivalCoordinates()) * KM_PER_DEGREE;
    patch.distanceKm(round2(distanceKm));

    Instant departure = record.getDepartureTime();
    Instant arrival = record.getArrivalTime();
    if (departure == null || arrival == null || distanceKm <= 0) {
      return;
    }
    double hours = Duration.between(departure, arrival).getSeconds() / 3600.0;
    if (hours <= 0) {
      return;
    }
    double speedKmh = distanceKm / hours;
    if (speedKmh > limits.getMaxSpeedKmh()) {
      warnings.add(String.format(Locale.ROOT, "Average speed too high: %.1f km/h", speedKmh));
    }
    patch.averageSpeedKmh(round2(speedKmh));
  }

  private static double round2(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
