package com.streetview.crawler.domain.service;

import com.streetview.crawler.domain.model.Coordinates;
import com.streetview.crawler.domain.model.GridSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static com.streetview.crawler.module.test.support.TestFixtures.Locations;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GridSamplerTest {

    private final GeodesicCalculator geodesic = new GeodesicCalculator();
    private final GridSampler sampler = new GridSampler(geodesic, 30);

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 7})
    void sample_SideMultipleOfStride_YieldsSquaredCount(int k) {
        GridSpec spec = new GridSpec(Locations.KYIV_CENTER, k * 30, 10);

        assertThat(sampler.sample(spec).count()).isEqualTo((long) (k + 1) * (k + 1));
        assertThat(sampler.sampleCount(spec)).isEqualTo((long) (k + 1) * (k + 1));
    }

    @Test
    void sample_SideNotMultipleOfStride_IncludesOnlyFullSteps() {
        GridSpec spec = new GridSpec(Locations.KYIV_CENTER, 45, 10);

        assertThat(sampler.sample(spec).count()).isEqualTo(4);
    }

    @Test
    void sample_IgnoresRequestedStep() {
        GridSpec fine = new GridSpec(Locations.KYIV_CENTER, 60, 1);
        GridSpec coarse = new GridSpec(Locations.KYIV_CENTER, 60, 60);

        assertThat(sampler.sample(fine).collect(Collectors.toList()))
            .isEqualTo(sampler.sample(coarse).collect(Collectors.toList()));
    }

    @Test
    void sample_FirstPointIsUpperLeftCorner() {
        GridSpec spec = new GridSpec(Locations.GRID_CENTER, 30, 10);

        Coordinates first = sampler.sample(spec).findFirst().orElseThrow();
        Coordinates corner = sampler.upperLeftCorner(spec);

        assertThat(first.getLat()).isCloseTo(corner.getLat(), within(1e-9));
        assertThat(first.getLng()).isCloseTo(corner.getLng(), within(1e-9));
        assertThat(corner.getLat()).isGreaterThan(Locations.GRID_CENTER.getLat());
        assertThat(corner.getLng()).isLessThan(Locations.GRID_CENTER.getLng());
        assertThat(geodesic.distanceMeters(Locations.GRID_CENTER, corner)).isCloseTo(15 * Math.sqrt(2), within(0.05));
    }

    @Test
    void sample_RowMajorOrder_EastWithinRowSouthAcrossRows() {
        GridSpec spec = new GridSpec(Locations.GRID_CENTER, 30, 10);

        List<Coordinates> points = sampler.sample(spec).collect(Collectors.toList());

        assertThat(points).hasSize(4);
        Coordinates corner = points.get(0);
        Coordinates rowOneEast = points.get(1);
        Coordinates rowTwoWest = points.get(2);
        assertThat(rowOneEast.getLng()).isGreaterThan(corner.getLng());
        assertThat(rowTwoWest.getLat()).isLessThan(corner.getLat());
        assertThat(geodesic.distanceMeters(corner, rowOneEast)).isCloseTo(30.0, within(0.01));
        assertThat(geodesic.distanceMeters(corner, rowTwoWest)).isCloseTo(30.0, within(0.01));
    }

    @Test
    void sample_IsRestartable() {
        GridSpec spec = new GridSpec(Locations.KYIV_CENTER, 90, 10);

        assertThat(sampler.sample(spec).collect(Collectors.toList()))
            .isEqualTo(sampler.sample(spec).collect(Collectors.toList()));
    }

    @Test
    void sample_CustomStride_UsesIt() {
        GridSampler fineSampler = new GridSampler(geodesic, 10);

        assertThat(fineSampler.sample(new GridSpec(Locations.KYIV_CENTER, 30, 30)).count()).isEqualTo(16);
    }

    @Test
    void sample_SideNearIntegerLimit_StopsAtSide() {
        GridSampler wideSampler = new GridSampler(geodesic, Integer.MAX_VALUE - 5);
        GridSpec spec = new GridSpec(Locations.KYIV_CENTER, Integer.MAX_VALUE - 1, 10);

        assertThat(wideSampler.sample(spec).count()).isEqualTo(2);
        assertThat(wideSampler.sampleCount(spec)).isEqualTo(4);
    }

    @Test
    void constructor_NonPositiveStride_Throws() {
        assertThatThrownBy(() -> new GridSampler(geodesic, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void gridSpec_NegativeSide_Throws() {
        assertThatThrownBy(() -> new GridSpec(Locations.KYIV_CENTER, -1, 30))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
