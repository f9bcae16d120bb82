package com.streetview.crawler.domain.service;

import com.streetview.crawler.domain.model.Coordinates;
import org.springframework.stereotype.Service;

/**
 * Great-circle calculations on a spherical earth.
 *
 * Bearings are compass degrees: 0 north, 90 east, 180 south, 270 west.
 */
@Service
public class GeodesicCalculator {

    public static final double EARTH_RADIUS_METERS = 6_371_008.8;

    /**
     * Point reached by travelling {@code distanceMeters} from {@code start} along
     * the initial {@code bearingDegrees}.
     *
     * @param start Starting point
     * @param bearingDegrees Initial bearing in degrees
     * @param distanceMeters Distance to travel in meters
     * @return Destination point
     */
    public Coordinates destination(Coordinates start, double bearingDegrees, double distanceMeters) {
        double angularDistance = distanceMeters / EARTH_RADIUS_METERS;
        double bearing = Math.toRadians(bearingDegrees);
        double lat1 = Math.toRadians(start.getLat());
        double lng1 = Math.toRadians(start.getLng());

        double sinLat2 = Math.sin(lat1) * Math.cos(angularDistance)
            + Math.cos(lat1) * Math.sin(angularDistance) * Math.cos(bearing);
        double lat2 = Math.asin(Math.max(-1.0, Math.min(1.0, sinLat2)));
        double lng2 = lng1 + Math.atan2(
            Math.sin(bearing) * Math.sin(angularDistance) * Math.cos(lat1),
            Math.cos(angularDistance) - Math.sin(lat1) * Math.sin(lat2));

        double latDegrees = Math.max(-90.0, Math.min(90.0, Math.toDegrees(lat2)));
        return new Coordinates(latDegrees, normalizeLongitude(Math.toDegrees(lng2)));
    }

    /**
     * Haversine distance between two points in meters.
     */
    public double distanceMeters(Coordinates from, Coordinates to) {
        double dLat = Math.toRadians(to.getLat() - from.getLat());
        double dLng = Math.toRadians(to.getLng() - from.getLng());
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(from.getLat())) * Math.cos(Math.toRadians(to.getLat()))
            * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    private static double normalizeLongitude(double lng) {
        double normalized = ((lng + 540.0) % 360.0) - 180.0;
        return normalized == -180.0 && lng > 0 ? 180.0 : normalized;
    }
}
