package com.streetview.crawler.domain.service;

import com.streetview.crawler.domain.model.Coordinates;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeodesicCalculatorTest {

    private final GeodesicCalculator geodesic = new GeodesicCalculator();
    private final Coordinates start = new Coordinates(50.0, 30.0);

    @Test
    void destination_North_IncreasesLatitudeOnly() {
        Coordinates north = geodesic.destination(start, 0, 1000);

        assertThat(north.getLat()).isGreaterThan(start.getLat());
        assertThat(north.getLng()).isCloseTo(start.getLng(), within(1e-9));
        assertThat(geodesic.distanceMeters(start, north)).isCloseTo(1000.0, within(1e-3));
    }

    @Test
    void destination_East_IncreasesLongitude() {
        Coordinates east = geodesic.destination(start, 90, 1000);

        assertThat(east.getLng()).isGreaterThan(start.getLng());
        assertThat(east.getLat()).isCloseTo(start.getLat(), within(1e-4));
        assertThat(geodesic.distanceMeters(start, east)).isCloseTo(1000.0, within(1e-3));
    }

    @Test
    void destination_SouthThenNorth_ReturnsToStart() {
        Coordinates back = geodesic.destination(geodesic.destination(start, 180, 500), 0, 500);

        assertThat(back.getLat()).isCloseTo(start.getLat(), within(1e-9));
        assertThat(back.getLng()).isCloseTo(start.getLng(), within(1e-9));
    }

    @Test
    void destination_AcrossAntimeridian_WrapsLongitude() {
        Coordinates nearDateLine = new Coordinates(0.0, 179.9999);

        Coordinates east = geodesic.destination(nearDateLine, 90, 1000);

        assertThat(east.getLng()).isBetween(-180.0, -179.9);
    }

    @Test
    void distanceMeters_SamePoint_IsZero() {
        assertThat(geodesic.distanceMeters(start, start)).isZero();
    }
}
