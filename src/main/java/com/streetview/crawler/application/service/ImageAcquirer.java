package com.streetview.crawler.application.service;

import com.streetview.crawler.application.port.out.PanoramaImageSource;
import com.streetview.crawler.domain.model.AcquiredImage;
import com.streetview.crawler.domain.model.ImageFetchResult;
import com.streetview.crawler.domain.model.ImageRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Downloads directional images one request at a time.
 * A failed request is logged and left out, the remaining requests still run.
 */
@Service
public class ImageAcquirer {

  private static final Logger logger = LoggerFactory.getLogger(ImageAcquirer.class);

  private final PanoramaImageSource imageSource;

  public ImageAcquirer(PanoramaImageSource imageSource) {
    this.imageSource = imageSource;
  }

  /**
   * @param requests Requests to execute, in order
   * @return Images of the successful requests, in request order
   */
  public List<AcquiredImage> acquire(List<ImageRequest> requests) {
    List<AcquiredImage> images = new ArrayList<>(requests.size());
    for (ImageRequest request : requests) {
      logger.info("Downloading pano {} heading {} fov {} ...",
          request.getPanoId(), request.getHeading(), request.getFov());
      ImageFetchResult result = imageSource.fetch(request);
      result.toAcquiredImage(request).ifPresentOrElse(
          images::add,
          () -> logger.warn("Got error downloading pano {} heading {}: {}.",
              request.getPanoId(), request.getHeading(), result.getFailureReason()));
    }
    return images;
  }
}
