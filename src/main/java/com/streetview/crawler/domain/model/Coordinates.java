package com.streetview.crawler.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object representing a geographic coordinate pair in degrees.
 * Equality is exact, so it is only suitable as a memoization key.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Coordinates {
    private final double lat;
    private final double lng;

    public Coordinates(double lat, double lng) {
        if (Double.isNaN(lat) || Double.isNaN(lng)) {
            throw new IllegalArgumentException("Latitude and longitude must be numbers");
        }
        if (lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90");
        }
        if (lng < -180.0 || lng > 180.0) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180");
        }
        this.lat = lat;
        this.lng = lng;
    }

    /**
     * Parses a {@code "lat,lng"} pair, e.g. {@code "50.45,30.52"}.
     *
     * @param value comma separated latitude and longitude
     * @return parsed coordinates
     * @throws IllegalArgumentException if the value is not a valid pair
     */
    public static Coordinates parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Coordinates must not be null");
        }
        String[] parts = value.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected 'lat,lng' but got: " + value);
        }
        try {
            return new Coordinates(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected 'lat,lng' but got: " + value, e);
        }
    }
}
