package com.streetview.crawler.application.service;

import com.streetview.crawler.application.port.out.PanoramaMetadataLookup;
import com.streetview.crawler.domain.model.Coordinates;
import com.streetview.crawler.domain.model.MetadataLookupResult;
import com.streetview.crawler.domain.model.PanoramaRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.concurrent.ConcurrentMapCache;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Maps a sampled point to the panorama captured near it.
 *
 * Caching Strategy: one metadata lookup per distinct point
 * - Lookups are memoized by exact point in a cache owned by this resolver
 * - The cache is thread-safe and lives as long as the resolver
 * - Misses and failures are memoized too, they are never retried
 */
@Service
public class PanoramaResolver {

  private static final Logger logger = LoggerFactory.getLogger(PanoramaResolver.class);
  static final String CACHE_NAME = "panoramaMetadata";

  private final PanoramaMetadataLookup metadataLookup;
  private final ConcurrentMapCache lookups = new ConcurrentMapCache(CACHE_NAME, false);

  public PanoramaResolver(PanoramaMetadataLookup metadataLookup) {
    this.metadataLookup = metadataLookup;
  }

  /**
   * Resolve a point to a panorama.
   *
   * @param point Sampled point
   * @return Panorama id with its canonical location, or empty when the lookup
   *         found nothing or failed
   */
  public Optional<PanoramaRecord> resolve(Coordinates point) {
    MetadataLookupResult result = lookups.get(point, () -> lookup(point));

    Optional<PanoramaRecord> record = result.toRecord();
    if (record.isEmpty() && result.isOk()) {
      logger.warn("Metadata for {} reported OK without pano id or location: {}", point, result);
    } else if (record.isEmpty() && !MetadataLookupResult.STATUS_ZERO_RESULTS.equals(result.getStatus())) {
      logger.debug("Metadata lookup for {} returned status {}", point, result.getStatus());
    }
    return record;
  }

  public void clearCache() {
    lookups.clear();
  }

  public int cacheSize() {
    return lookups.getNativeCache().size();
  }

  private MetadataLookupResult lookup(Coordinates point) {
    MetadataLookupResult result = metadataLookup.lookup(point);
    return result != null ? result : MetadataLookupResult.failed();
  }
}
