package com.streetview.crawler.domain.service;

import com.streetview.crawler.domain.model.ImageRequest;
import com.streetview.crawler.domain.model.PanoramaRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a full rotation around a panorama into directional image requests.
 */
@Service
public class ImageRequestPlanner {

    private final int width;
    private final int height;

    public ImageRequestPlanner(
        @Value("${app.streetview.image-width:600}") int width,
        @Value("${app.streetview.image-height:400}") int height
    ) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image size must be positive");
        }
        this.width = width;
        this.height = height;
    }

    /**
     * One request per heading 0, fov, 2*fov, ..., 360-fov.
     *
     * @param record Panorama to cover
     * @param fov Field of view of each image, must divide 360
     * @return Requests in ascending heading order
     * @throws InvalidFieldOfViewException if fov does not divide 360
     */
    public List<ImageRequest> requests(PanoramaRecord record, int fov) {
        validateFov(fov);
        List<ImageRequest> requests = new ArrayList<>(360 / fov);
        for (int heading = 0; heading < 360; heading += fov) {
            requests.add(new ImageRequest(record.getPanoId(), fov, heading, width, height));
        }
        return requests;
    }

    public static void validateFov(int fov) {
        if (fov <= 0 || fov > 360 || 360 % fov != 0) {
            throw new InvalidFieldOfViewException(fov);
        }
    }

    /**
     * Thrown when the configured field of view cannot tile a full rotation.
     */
    public static class InvalidFieldOfViewException extends IllegalArgumentException {
        public InvalidFieldOfViewException(int fov) {
            super("Field of view must evenly divide 360, got " + fov);
        }
    }
}
