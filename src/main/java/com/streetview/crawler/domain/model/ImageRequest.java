package com.streetview.crawler.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One directional image of a panorama. Imagery is addressed by panorama id,
 * never by location.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ImageRequest {
    private final String panoId;
    private final int fov;
    private final int heading;
    private final int width;
    private final int height;

    public ImageRequest(String panoId, int fov, int heading, int width, int height) {
        if (panoId == null || panoId.isBlank()) {
            throw new IllegalArgumentException("Panorama id must not be blank");
        }
        if (heading < 0 || heading >= 360) {
            throw new IllegalArgumentException("Heading must be between 0 and 359");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image size must be positive");
        }
        this.panoId = panoId;
        this.fov = fov;
        this.heading = heading;
        this.width = width;
        this.height = height;
    }

    /**
     * File name fragment for this image, {@code "{fov}-{heading}"}.
     */
    public String label() {
        return fov + "-" + heading;
    }
}
