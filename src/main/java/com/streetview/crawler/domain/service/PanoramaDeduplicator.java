package com.streetview.crawler.domain.service;

import com.streetview.crawler.domain.model.Coordinates;
import com.streetview.crawler.domain.model.PanoramaRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Folds sampled points into one record per panorama id.
 *
 * A later point resolving to an already seen id replaces the stored location.
 * Distinct ids are never merged, however close their locations are.
 */
@Service
public class PanoramaDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(PanoramaDeduplicator.class);

    /**
     * @param points Sample points, visited in order
     * @param resolve Lookup from a point to the panorama captured near it
     * @return Unique panoramas sorted by id
     */
    public List<PanoramaRecord> dedupe(Stream<Coordinates> points, Function<Coordinates, Optional<PanoramaRecord>> resolve) {
        Map<String, Coordinates> locationsById = new TreeMap<>();
        points.forEachOrdered(point -> {
            logger.info("Getting pano id for {},{}...", point.getLat(), point.getLng());
            Optional<PanoramaRecord> record = resolve.apply(point);
            if (record.isPresent()) {
                locationsById.put(record.get().getPanoId(), record.get().getLocation());
            } else {
                logger.info("Got no pano id for {},{}.", point.getLat(), point.getLng());
            }
        });

        List<PanoramaRecord> panoramas = new ArrayList<>(locationsById.size());
        locationsById.forEach((panoId, location) -> panoramas.add(new PanoramaRecord(panoId, location)));
        return panoramas;
    }
}
