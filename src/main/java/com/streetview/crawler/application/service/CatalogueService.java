package com.streetview.crawler.application.service;

import com.streetview.crawler.application.port.out.PanoramaStorage;
import com.streetview.crawler.domain.model.AcquiredImage;
import com.streetview.crawler.domain.model.CatalogueIndexEntry;
import com.streetview.crawler.domain.model.CatalogueSummary;
import com.streetview.crawler.domain.model.ImageRequest;
import com.streetview.crawler.domain.model.PanoramaRecord;
import com.streetview.crawler.domain.service.ImageRequestPlanner;
import com.streetview.crawler.infrastructure.storage.CsvCatalogueIndexWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * Downloads panoramas into a catalogue directory and indexes them.
 *
 * Layout:
 * - {@code <directory>/index.csv} with one row per panorama that yielded an image
 * - {@code <directory>/<panoId>/} with the stored images
 *
 * A catalogue is written once. An existing index aborts the run before anything is
 * touched, and rows are flushed per panorama so an interrupted run leaves a usable
 * partial index.
 */
@Service
public class CatalogueService {

  private static final Logger logger = LoggerFactory.getLogger(CatalogueService.class);
  public static final String INDEX_FILE_NAME = "index.csv";

  private final ImageRequestPlanner requestPlanner;
  private final ImageAcquirer imageAcquirer;
  private final PanoramaStorage panoramaStorage;
  private final int fov;

  public CatalogueService(
      ImageRequestPlanner requestPlanner,
      ImageAcquirer imageAcquirer,
      PanoramaStorage panoramaStorage,
      @Value("${app.catalogue.fov:90}") int fov) {
    ImageRequestPlanner.validateFov(fov);
    this.requestPlanner = requestPlanner;
    this.imageAcquirer = imageAcquirer;
    this.panoramaStorage = panoramaStorage;
    this.fov = fov;
  }

  /**
   * Download every panorama and index those that yielded at least one image.
   *
   * @param directory  Catalogue directory, created if absent
   * @param panoramas  Panoramas to download, only computed once the index is open
   * @return Counters of the run
   * @throws CatalogueAlreadyExistsException if the directory already holds an index
   * @throws CatalogueWriteException if the index cannot be written
   */
  public CatalogueSummary add(Path directory, Supplier<List<PanoramaRecord>> panoramas) {
    Path indexFile = directory.resolve(INDEX_FILE_NAME);
    if (Files.exists(indexFile)) {
      throw new CatalogueAlreadyExistsException(indexFile);
    }

    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new CatalogueWriteException("Cannot create catalogue directory " + directory, e);
    }

    try (CsvCatalogueIndexWriter index = new CsvCatalogueIndexWriter(indexFile)) {
      List<PanoramaRecord> panoramaList = panoramas.get();
      logger.info("Got {} panos to explore.", panoramaList.size());

      int catalogued = 0;
      int imagesStored = 0;
      int position = 0;
      for (PanoramaRecord panorama : panoramaList) {
        position++;
        logger.info("Getting pano {} of {}...", position, panoramaList.size());
        int stored = download(directory, panorama);
        if (stored > 0) {
          index.append(CatalogueIndexEntry.of(panorama));
          catalogued++;
          imagesStored += stored;
        } else {
          logger.warn("No image could be downloaded for pano {}, leaving it out of the index", panorama.getPanoId());
        }
      }

      CatalogueSummary summary = new CatalogueSummary(panoramaList.size(), catalogued, imagesStored);
      logger.info("Catalogue {} complete: {}", directory, summary);
      return summary;
    } catch (FileAlreadyExistsException e) {
      throw new CatalogueAlreadyExistsException(indexFile);
    } catch (IOException e) {
      throw new CatalogueWriteException("Failed to write catalogue index " + indexFile, e);
    }
  }

  /**
   * Acquire and store the images of one panorama.
   *
   * @return Number of images acquired, 0 when every request failed
   */
  int download(Path directory, PanoramaRecord panorama) {
    List<ImageRequest> requests = requestPlanner.requests(panorama, fov);
    List<AcquiredImage> images = imageAcquirer.acquire(requests);
    if (images.isEmpty()) {
      return 0;
    }
    panoramaStorage.save(directory, images);
    return images.size();
  }

  public int getFov() {
    return fov;
  }

  /**
   * Thrown when the target directory already contains an index from an earlier run.
   */
  public static class CatalogueAlreadyExistsException extends RuntimeException {
    public CatalogueAlreadyExistsException(Path indexFile) {
      super(indexFile.getFileName() + " already exists in " + indexFile.toAbsolutePath().getParent());
    }
  }

  /**
   * Thrown when the catalogue directory or index cannot be written.
   */
  public static class CatalogueWriteException extends RuntimeException {
    public CatalogueWriteException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
