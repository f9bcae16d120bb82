package com.streetview.crawler.application.port.out;

import com.streetview.crawler.domain.model.ImageFetchResult;
import com.streetview.crawler.domain.model.ImageRequest;

/**
 * Output port for fetching directional panorama images.
 */
public interface PanoramaImageSource {

  /**
   * Fetch one image. A failed request yields a failure result instead of an exception.
   */
  ImageFetchResult fetch(ImageRequest request);
}
