package com.uavradar.processor.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured flight record extracted from one telegram line.
 *
 * <p>Every field except the raw text and the message type is nullable: extractors that do not
 * match leave their field unset. After parsing, the record is only changed through
 * {@link #apply(RecordPatch)} and by attaching the warnings of a successful validation.
 */
public class ParsedRecord {
  /** Identifier assigned to records whose parsing failed unexpectedly. */
  public static final String UNKNOWN_FLIGHT_ID = "UNKNOWN";

  private final String rawText;
  private final List<String> parseErrors = new ArrayList<>();
  private final List<String> validationWarnings = new ArrayList<>();
  private MessageType messageType = MessageType.FPL;
  private String flightId = "";
  private String aircraftType;
  private String aircraftRegistration;
  private Instant departureTime;
  private Instant arrivalTime;
  private Coordinates departureCoordinates;
  private Coordinates arrivalCoordinates;
  private String departureAerodrome;
  private String arrivalAerodrome;
  private Integer altitude;
  private String route;
  private String operatorInfo;
  private String remarks;
  private Long durationMinutes;
  private Double distanceKm;
  private Double averageSpeedKmh;

  public ParsedRecord(String rawText) {
    this.rawText = rawText == null ? "" : rawText;
  }

  /**
   * Creates the default-shaped record returned when parsing hits an unexpected fault.
   *
   * @param rawText original line
   * @param error single parse error describing the fault
   * @return record with identifier {@value #UNKNOWN_FLIGHT_ID}
   */
  public static ParsedRecord criticalFailure(String rawText, String error) {
    ParsedRecord record = new ParsedRecord(rawText);
    record.setFlightId(UNKNOWN_FLIGHT_ID);
    record.addParseError(error);
    return record;
  }

  /**
   * Copies every slot present in the patch onto this record.
   *
   * @param patch normalized values from validation
   */
  public void apply(RecordPatch patch) {
    patch.flightId().ifPresent(this::setFlightId);
    patch.aircraftType().ifPresent(this::setAircraftType);
    patch.departureTime().ifPresent(this::setDepartureTime);
    patch.arrivalTime().ifPresent(this::setArrivalTime);
    patch.durationMinutes().ifPresent(value -> this.durationMinutes = value);
    patch.departureCoordinates().ifPresent(this::setDepartureCoordinates);
    patch.arrivalCoordinates().ifPresent(this::setArrivalCoordinates);
    patch.altitude().ifPresent(this::setAltitude);
    patch.distanceKm().ifPresent(value -> this.distanceKm = value);
    patch.averageSpeedKmh().ifPresent(value -> this.averageSpeedKmh = value);
  }

  public String getRawText() {
    return rawText;
  }

  public List<String> getParseErrors() {
    return Collections.unmodifiableList(parseErrors);
  }

  public void addParseError(String error) {
    parseErrors.add(error);
  }

  public List<String> getValidationWarnings() {
    return Collections.unmodifiableList(validationWarnings);
  }

  public void addValidationWarnings(List<String> warnings) {
    validationWarnings.addAll(warnings);
  }

  public MessageType getMessageType() {
    return messageType;
  }

  public void setMessageType(MessageType messageType) {
    this.messageType = messageType == null ? MessageType.FPL : messageType;
  }

  public String getFlightId() {
    return flightId;
  }

  public void setFlightId(String flightId) {
    this.flightId = flightId == null ? "" : flightId;
  }

  public String getAircraftType() {
    return aircraftType;
  }

  public void setAircraftType(String aircraftType) {
    this.aircraftType = aircraftType;
  }

  public String getAircraftRegistration() {
    return aircraftRegistration;
  }

  public void setAircraftRegistration(String aircraftRegistration) {
    this.aircraftRegistration = aircraftRegistration;
  }

  public Instant getDepartureTime() {
    return departureTime;
  }

  public void setDepartureTime(Instant departureTime) {
    this.departureTime = departureTime;
  }

  public Instant getArrivalTime() {
    return arrivalTime;
  }

  public void setArrivalTime(Instant arrivalTime) {
    this.arrivalTime = arrivalTime;
  }

  public Coordinates getDepartureCoordinates() {
    return departureCoordinates;
  }

  public void setDepartureCoordinates(Coordinates departureCoordinates) {
    this.departureCoordinates = departureCoordinates;
  }

  public Coordinates getArrivalCoordinates() {
    return arrivalCoordinates;
  }

  public void setArrivalCoordinates(Coordinates arrivalCoordinates) {
    this.arrivalCoordinates = arrivalCoordinates;
  }

  public String getDepartureAerodrome() {
    return departureAerodrome;
  }

  public void setDepartureAerodrome(String departureAerodrome) {
    this.departureAerodrome = departureAerodrome;
  }

  public String getArrivalAerodrome() {
    return arrivalAerodrome;
  }

  public void setArrivalAerodrome(String arrivalAerodrome) {
    this.arrivalAerodrome = arrivalAerodrome;
  }

  public Integer getAltitude() {
    return altitude;
  }

  public void setAltitude(Integer altitude) {
    this.altitude = altitude;
  }

  public String getRoute() {
    return route;
  }

  public void setRoute(String route) {
    this.route = route;
  }

  public String getOperatorInfo() {
    return operatorInfo;
  }

  public void setOperatorInfo(String operatorInfo) {
    this.operatorInfo = operatorInfo;
  }

  public String getRemarks() {
    return remarks;
  }

  public void setRemarks(String remarks) {
    this.remarks = remarks;
  }

  public Long getDurationMinutes() {
    return durationMinutes;
  }

  public Double getDistanceKm() {
    return distanceKm;
  }

  public Double getAverageSpeedKmh() {
    return averageSpeedKmh;
  }

  @Override
  public String toString() {
    return "ParsedRecord{type=" + messageType
        + ", flightId=" + flightId
        + ", aircraftType=" + aircraftType
        + ", departureTime=" + departureTime
        + ", departureCoordinates=" + departureCoordinates
        + ", parseErrors=" + parseErrors.size()
        + ", warnings=" + validationWarnings.size()
        + "}";
  }
}
