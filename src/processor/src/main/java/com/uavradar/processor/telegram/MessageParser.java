package com.uavradar.processor.telegram;

import com.uavradar.processor.model.Bbox;
import com.uavradar.processor.model.Coordinates;
import com.uavradar.processor.model.MessageType;
import com.uavradar.processor.model.ParsedRecord;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one raw telegram line into a {@link ParsedRecord}.
 *
 * <p>Parsing never throws. Fields whose extractor does not match stay unset; record-level
 * problems are appended to the record's parse errors. An unexpected fault produces a record
 * with identifier {@value ParsedRecord#UNKNOWN_FLIGHT_ID} carrying a single parse error.
 */
public class MessageParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(MessageParser.class);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final Bbox territory;
  private final Clock clock;

  /**
   * Creates a parser.
   *
   * @param territory envelope used for advisory coordinate checks
   * @param clock source of the default reference instant
   */
  public MessageParser(Bbox territory, Clock clock) {
    this.territory = territory;
    this.clock = clock;
  }

  /**
   * Parses a line against the current instant of the configured clock.
   *
   * @param rawLine telegram text, may be {@code null}
   * @return parsed record, never {@code null}
   */
  public ParsedRecord parse(String rawLine) {
    return parse(rawLine, clock.instant());
  }

  /**
   * Parses a line against an explicit reference instant.
   *
   * @param rawLine telegram text, may be {@code null}
   * @param now reference instant used to resolve day/month-less times
   * @return parsed record, never {@code null}
   */
  public ParsedRecord parse(String rawLine, Instant now) {
    String raw = rawLine == null ? "" : rawLine;
    try {
      ParsedRecord record = new ParsedRecord(raw);
      populate(record, normalize(raw), now);
      checkRecord(record);
      return record;
    } catch (RuntimeException ex) {
      LOGGER.warn("Critical parse failure for telegram: {}", abbreviate(raw), ex);
      return ParsedRecord.criticalFailure(raw, "Critical parse error: " + ex.getMessage());
    }
  }

  /**
   * Collapses whitespace runs, trims and upper-cases the text.
   *
   * @param raw original line
   * @return normalized text
   */
  static String normalize(String raw) {
    return WHITESPACE.matcher(raw).replaceAll(" ").trim().toUpperCase(Locale.ROOT);
  }

  /**
   * Runs every field extractor over the normalized text.
   *
   * @param record record to fill
   * @param text normalized telegram text
   * @param now reference instant
   */
  protected void populate(ParsedRecord record, String text, Instant now) {
    record.setMessageType(FieldExtractors.messageType(text).orElse(MessageType.FPL));
    record.setFlightId(FieldExtractors.flightId(text).orElse(""));
    record.setAircraftType(FieldExtractors.aircraftType(text).orElse(null));
    record.setAircraftRegistration(FieldExtractors.aircraftRegistration(text).orElse(null));

    populateTimes(record, text, now);

    record.setDepartureCoordinates(coordinatesAt(text, 0).orElse(null));
    record.setArrivalCoordinates(coordinatesAt(text, 1).orElse(null));

    List<String> aerodromes = FieldExtractors.aerodromes(text);
    record.setDepartureAerodrome(aerodromes.size() > 0 ? aerodromes.get(0) : null);
    record.setArrivalAerodrome(aerodromes.size() > 1 ? aerodromes.get(1) : null);

    record.setAltitude(FieldExtractors.altitude(text).orElse(null));
    record.setRoute(FieldExtractors.route(text).orElse(null));
    record.setOperatorInfo(FieldExtractors.operator(text).orElse(null));
    record.setRemarks(FieldExtractors.remarks(text).orElse(null));
  }

  private void populateTimes(ParsedRecord record, String text, Instant now) {
    List<String> compound = FieldExtractors.compoundTimeTokens(text);
    Instant departure = compound.size() > 0
        ? TelegramTimeResolver.resolveCompound(compound.get(0), now).orElse(null)
        : null;
    Instant arrival = compound.size() > 1
        ? TelegramTimeResolver.resolveCompound(compound.get(1), now).orElse(null)
        : null;

    if (departure == null) {
      List<Instant> times = new ArrayList<>();
      for (String token : FieldExtractors.bareTimeTokens(text)) {
        TelegramTimeResolver.resolveTimeOfDay(token, now).ifPresent(times::add);
      }
      departure = times.size() > 0 ? times.get(0) : null;
      arrival = times.size() > 1 ? times.get(1) : null;
    }

    record.setDepartureTime(departure);
    record.setArrivalTime(arrival);
  }

  private static Optional<Coordinates> coordinatesAt(String text, int index) {
    List<FieldExtractors.DecimalPair> decimal = FieldExtractors.decimalPairs(text);
    if (decimal.size() > index) {
      Optional<Coordinates> point = decimal.get(index).normalize();
      if (point.isPresent()) {
        return point;
      }
    }
    List<Coordinates> degreeMinute = FieldExtractors.degreeMinuteCoordinates(text);
    if (degreeMinute.size() > index) {
      return Optional.ofNullable(degreeMinute.get(index));
    }
    return Optional.empty();
  }

  private void checkRecord(ParsedRecord record) {
    if (record.getFlightId().isEmpty()) {
      record.addParseError("Flight identifier not found");
    }
    if (record.getDepartureTime() == null && record.getDepartureCoordinates() == null) {
      record.addParseError("Departure data not found (neither time nor coordinates)");
    }
    Coordinates departure = record.getDepartureCoordinates();
    if (departure != null && !territory.contains(departure)) {
      record.addParseError("Departure coordinates outside territorial envelope: "
          + departure.latitude() + ", " + departure.longitude());
    }
    Coordinates arrival = record.getArrivalCoordinates();
    if (arrival != null && !territory.contains(arrival)) {
      record.addParseError("Arrival coordinates outside territorial envelope: "
          + arrival.latitude() + ", " + arrival.longitude());
    }
  }

  private static String abbreviate(String raw) {
    return raw.length() <= 100 ? raw : raw.substring(0, 100) + "...";
  }
}
