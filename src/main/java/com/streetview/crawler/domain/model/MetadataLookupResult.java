package com.streetview.crawler.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Raw answer of a panorama metadata lookup.
 * Only {@link #STATUS_OK} carries a panorama id and location.
 */
@Getter
@EqualsAndHashCode
@ToString
public class MetadataLookupResult {

    public static final String STATUS_OK = "OK";
    public static final String STATUS_ZERO_RESULTS = "ZERO_RESULTS";
    public static final String STATUS_REQUEST_FAILED = "REQUEST_FAILED";

    private final String status;
    private final String panoId;
    private final Coordinates location;

    public MetadataLookupResult(String status, String panoId, Coordinates location) {
        this.status = status == null ? STATUS_REQUEST_FAILED : status;
        this.panoId = panoId;
        this.location = location;
    }

    public static MetadataLookupResult ok(String panoId, Coordinates location) {
        return new MetadataLookupResult(STATUS_OK, panoId, location);
    }

    public static MetadataLookupResult zeroResults() {
        return new MetadataLookupResult(STATUS_ZERO_RESULTS, null, null);
    }

    public static MetadataLookupResult failed() {
        return new MetadataLookupResult(STATUS_REQUEST_FAILED, null, null);
    }

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }

    /**
     * Panorama described by this result, present only for a complete {@code OK} answer.
     */
    public Optional<PanoramaRecord> toRecord() {
        if (!isOk() || panoId == null || panoId.isBlank() || location == null) {
            return Optional.empty();
        }
        return Optional.of(new PanoramaRecord(panoId, location));
    }
}
