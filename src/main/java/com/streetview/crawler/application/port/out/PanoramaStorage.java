package com.streetview.crawler.application.port.out;

import com.streetview.crawler.domain.model.AcquiredImage;

import java.nio.file.Path;
import java.util.List;

/**
 * Output port for persisting the images of one panorama under
 * {@code <directory>/<panoId>/}.
 */
public interface PanoramaStorage {

  /**
   * Save the images of a single panorama.
   *
   * @param directory Catalogue root directory
   * @param images Non-empty list of images, all of the same panorama
   * @return Paths of the written files
   * @throws StorageException if a file cannot be written
   */
  List<Path> save(Path directory, List<AcquiredImage> images);

  /**
   * Thrown when panorama images cannot be persisted.
   */
  class StorageException extends RuntimeException {
    public StorageException(String message) {
      super(message);
    }

    public StorageException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
