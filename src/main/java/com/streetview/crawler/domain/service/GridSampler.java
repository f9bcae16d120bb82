package com.streetview.crawler.domain.service;

import com.streetview.crawler.domain.model.Coordinates;
import com.streetview.crawler.domain.model.GridSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Enumerates a regular lattice of points covering a square region.
 *
 * Sampling Rule:
 * - Upper-left corner: centre moved west by side/2, then north by side/2
 * - Each point: corner moved east by the column offset, then south by the row offset
 * - Offsets run from 0 to side inclusive, in increments of the configured stride
 * - Row-major order (rows outer, columns inner)
 */
@Service
public class GridSampler {

    private static final Logger logger = LoggerFactory.getLogger(GridSampler.class);

    private final GeodesicCalculator geodesic;
    private final int strideMeters;

    public GridSampler(
        GeodesicCalculator geodesic,
        @Value("${app.grid.stride-meters:30}") int strideMeters
    ) {
        if (strideMeters <= 0) {
            throw new IllegalArgumentException("Grid stride must be positive");
        }
        this.geodesic = geodesic;
        this.strideMeters = strideMeters;
    }

    /**
     * Lazily sample the square described by {@code spec}. Every call starts a fresh,
     * independent stream.
     *
     * @param spec Square to cover
     * @return Sample points in row-major order
     */
    public Stream<Coordinates> sample(GridSpec spec) {
        if (spec.getStepMeters() != strideMeters) {
            logger.debug("Ignoring requested step of {}m, sampling every {}m", spec.getStepMeters(), strideMeters);
        }
        Coordinates corner = upperLeftCorner(spec);
        int side = spec.getSideMeters();
        return offsets(side).boxed()
            .flatMap(south -> offsets(side).mapToObj(east ->
                geodesic.destination(geodesic.destination(corner, 90, east), 180, south)));
    }

    /**
     * Number of points {@link #sample(GridSpec)} yields for the given spec.
     */
    public long sampleCount(GridSpec spec) {
        long perAxis = spec.getSideMeters() / strideMeters + 1L;
        return perAxis * perAxis;
    }

    public Coordinates upperLeftCorner(GridSpec spec) {
        double half = spec.getSideMeters() / 2.0;
        Coordinates left = geodesic.destination(spec.getCenter(), 270, half);
        return geodesic.destination(left, 0, half);
    }

    public int getStrideMeters() {
        return strideMeters;
    }

    private LongStream offsets(int side) {
        return LongStream.rangeClosed(0, side / strideMeters).map(index -> index * strideMeters);
    }
}
