package com.uavradar.processor.sink;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.uavradar.processor.geo.RegionInfo;
import com.uavradar.processor.model.Coordinates;
import com.uavradar.processor.model.ParsedRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Stored representation of an accepted flight, serialized with snake_case field names.
 *
 * <p>Parse errors and validation warnings travel with the document so advisory findings stay
 * auditable after acceptance. Unknown JSON attributes are ignored so older readers survive new
 * fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlightDocument(
    @JsonProperty("flight_id") String flightId,
    @JsonProperty("message_type") String messageType,
    @JsonProperty("aircraft_type") String aircraftType,
    @JsonProperty("aircraft_registration") String aircraftRegistration,
    @JsonProperty("departure_time") String departureTime,
    @JsonProperty("arrival_time") String arrivalTime,
    @JsonProperty("duration_minutes") Long durationMinutes,
    @JsonProperty("departure_lon") Double departureLon,
    @JsonProperty("departure_lat") Double departureLat,
    @JsonProperty("arrival_lon") Double arrivalLon,
    @JsonProperty("arrival_lat") Double arrivalLat,
    @JsonProperty("departure_aerodrome") String departureAerodrome,
    @JsonProperty("arrival_aerodrome") String arrivalAerodrome,
    @JsonProperty("altitude_m") Integer altitudeMeters,
    @JsonProperty("distance_km") Double distanceKm,
    @JsonProperty("average_speed_kmh") Double averageSpeedKmh,
    @JsonProperty("route") String route,
    @JsonProperty("operator") String operator,
    @JsonProperty("remarks") String remarks,
    @JsonProperty("region_departure_code") String regionDepartureCode,
    @JsonProperty("region_departure") String regionDeparture,
    @JsonProperty("region_arrival_code") String regionArrivalCode,
    @JsonProperty("region_arrival") String regionArrival,
    @JsonProperty("parse_errors") List<String> parseErrors,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("raw_message") String rawMessage,
    @JsonProperty("message_source") String messageSource,
    @JsonProperty("batch_id") String batchId,
    @JsonProperty("processed_at") String processedAt
) {

  /**
   * Builds a document from an accepted record and its geocoding results.
   *
   * @param record accepted, normalized record
   * @param batchId ingest batch identifier
   * @param source ingest source label
   * @param departureRegion region containing the departure point, if resolved
   * @param arrivalRegion region containing the arrival point, if resolved
   * @param processedAt processing instant
   * @return document ready for persistence
   */
  public static FlightDocument from(
      ParsedRecord record,
      String batchId,
      String source,
      Optional<RegionInfo> departureRegion,
      Optional<RegionInfo> arrivalRegion,
      Instant processedAt) {
    Coordinates departure = record.getDepartureCoordinates();
    Coordinates arrival = record.getArrivalCoordinates();
    return new FlightDocument(
        record.getFlightId(),
        record.getMessageType().name(),
        record.getAircraftType(),
        record.getAircraftRegistration(),
        isoOrNull(record.getDepartureTime()),
        isoOrNull(record.getArrivalTime()),
        record.getDurationMinutes(),
        departure == null ? null : departure.longitude(),
        departure == null ? null : departure.latitude(),
        arrival == null ? null : arrival.longitude(),
        arrival == null ? null : arrival.latitude(),
        record.getDepartureAerodrome(),
        record.getArrivalAerodrome(),
        record.getAltitude(),
        record.getDistanceKm(),
        record.getAverageSpeedKmh(),
        record.getRoute(),
        record.getOperatorInfo(),
        record.getRemarks(),
        departureRegion.map(RegionInfo::regionCode).orElse(null),
        departureRegion.map(RegionInfo::regionName).orElse(null),
        arrivalRegion.map(RegionInfo::regionCode).orElse(null),
        arrivalRegion.map(RegionInfo::regionName).orElse(null),
        List.copyOf(record.getParseErrors()),
        List.copyOf(record.getValidationWarnings()),
        record.getRawText(),
        source,
        batchId,
        processedAt.toString());
  }

  /**
   * Returns the cross-batch identity of this flight:
   * {@code flightId|departureTime|lat,lon}.
   */
  @JsonIgnore
  public String idempotencyKey() {
    String point = departureLon == null || departureLat == null
        ? ""
        : new Coordinates(departureLon, departureLat).toLatLonKey();
    return flightId + "|" + (departureTime == null ? "" : departureTime) + "|" + point;
  }

  private static String isoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
