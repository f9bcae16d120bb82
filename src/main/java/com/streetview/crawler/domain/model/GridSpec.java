package com.streetview.crawler.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Square sampling region centred on a point.
 * <p>
 * {@code stepMeters} is what the caller asked for. The sampler walks the square
 * with its own configured stride instead.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GridSpec {
    private final Coordinates center;
    private final int sideMeters;
    private final int stepMeters;

    public GridSpec(Coordinates center, int sideMeters, int stepMeters) {
        if (center == null) {
            throw new IllegalArgumentException("Grid center must not be null");
        }
        if (sideMeters < 0) {
            throw new IllegalArgumentException("Square side must not be negative");
        }
        this.center = center;
        this.sideMeters = sideMeters;
        this.stepMeters = stepMeters;
    }
}
