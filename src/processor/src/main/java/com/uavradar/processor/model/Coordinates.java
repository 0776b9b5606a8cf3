package com.uavradar.processor.model;

import java.util.Locale;

/**
 * Geographic point in decimal degrees, longitude first.
 *
 * @param longitude longitude in degrees
 * @param latitude latitude in degrees
 */
public record Coordinates(double longitude, double latitude) {

  /**
   * Checks the global WGS84 ranges.
   *
   * @return {@code true} when longitude is within [-180,180] and latitude within [-90,90]
   */
  public boolean isGloballyValid() {
    return longitude >= -180.0 && longitude <= 180.0 && latitude >= -90.0 && latitude <= 90.0;
  }

  /**
   * Planar distance to another point in degree space.
   *
   * @param other target point
   * @return Euclidean distance in degrees
   */
  public double planarDistanceDegrees(Coordinates other) {
    double dLon = other.longitude - longitude;
    double dLat = other.latitude - latitude;
    return Math.sqrt(dLon * dLon + dLat * dLat);
  }

  /** Canonical {@code lat,lon} text with six decimals, used in fingerprints and storage keys. */
  public String toLatLonKey() {
    return String.format(Locale.ROOT, "%.6f,%.6f", latitude, longitude);
  }
}
