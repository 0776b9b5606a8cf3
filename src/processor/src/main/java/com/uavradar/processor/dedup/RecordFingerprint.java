package com.uavradar.processor.dedup;

import com.uavradar.processor.model.ParsedRecord;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Canonical fingerprint of a record, used to detect duplicates within a batch. */
public final class RecordFingerprint {
  private static final String SEPARATOR = "|";

  private RecordFingerprint() {}

  /**
   * Builds the canonical text {@code flightId|departureIso|lat,lon|aircraftType}, with empty
   * parts for absent values.
   *
   * @param record record to describe
   * @return canonical text
   */
  static String canonicalText(ParsedRecord record) {
    return nullToEmpty(record.getFlightId())
        + SEPARATOR + (record.getDepartureTime() == null ? "" : record.getDepartureTime().toString())
        + SEPARATOR + (record.getDepartureCoordinates() == null
            ? "" : record.getDepartureCoordinates().toLatLonKey())
        + SEPARATOR + nullToEmpty(record.getAircraftType());
  }

  /**
   * Computes the SHA-256 hex digest of the canonical text.
   *
   * @param record record to fingerprint
   * @return lowercase hex digest
   */
  public static String of(ParsedRecord record) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(canonicalText(record).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
