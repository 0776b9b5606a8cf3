package com.uavradar.processor.geo;

/**
 * Administrative region containing a point.
 *
 * @param regionCode region code
 * @param regionName region display name
 * @param federalDistrict federal district the region belongs to
 * @param regionType region kind (republic, oblast, krai, ...)
 */
public record RegionInfo(String regionCode, String regionName, String federalDistrict, String regionType) {}
