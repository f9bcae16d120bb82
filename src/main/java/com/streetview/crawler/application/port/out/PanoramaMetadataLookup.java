package com.streetview.crawler.application.port.out;

import com.streetview.crawler.domain.model.Coordinates;
import com.streetview.crawler.domain.model.MetadataLookupResult;

/**
 * Output port for panorama metadata lookups.
 */
public interface PanoramaMetadataLookup {

  /**
   * Look up the panorama nearest to a point.
   * Transport failures are reported as a non-OK status, never thrown.
   */
  MetadataLookupResult lookup(Coordinates point);
}
