package com.streetview.crawler.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A panorama known by its externally assigned id, together with the location
 * where it was actually captured.
 */
@Getter
@EqualsAndHashCode
@ToString
public class PanoramaRecord {
    private final String panoId;
    private final Coordinates location;

    public PanoramaRecord(String panoId, Coordinates location) {
        if (panoId == null || panoId.isBlank()) {
            throw new IllegalArgumentException("Panorama id must not be blank");
        }
        if (location == null) {
            throw new IllegalArgumentException("Panorama location must not be null");
        }
        this.panoId = panoId;
        this.location = location;
    }
}
