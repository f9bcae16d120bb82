package com.streetview.crawler.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One row of the catalogue index: a panorama that yielded at least one image.
 */
@Getter
@EqualsAndHashCode
@ToString
public class CatalogueIndexEntry {
    private final String panoId;
    private final double latitude;
    private final double longitude;

    public CatalogueIndexEntry(String panoId, double latitude, double longitude) {
        this.panoId = panoId;
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static CatalogueIndexEntry of(PanoramaRecord record) {
        return new CatalogueIndexEntry(
            record.getPanoId(),
            record.getLocation().getLat(),
            record.getLocation().getLng());
    }
}
