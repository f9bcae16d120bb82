package com.streetview.crawler.infrastructure.storage;

import com.streetview.crawler.application.port.out.PanoramaStorage;
import com.streetview.crawler.domain.model.AcquiredImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores every image as its own file, {@code <panoId>/<fov>-<heading>.jpg}.
 */
public class SimplePanoramaStorage implements PanoramaStorage {

    private static final Logger logger = LoggerFactory.getLogger(SimplePanoramaStorage.class);

    @Override
    public List<Path> save(Path directory, List<AcquiredImage> images) {
        Path folder = PanoramaFolders.prepare(directory, images);
        List<Path> written = new ArrayList<>(images.size());
        for (AcquiredImage image : images) {
            Path target = folder.resolve(image.getRequest().label() + PanoramaFolders.EXTENSION);
            try {
                Files.write(target, image.getContent());
            } catch (IOException e) {
                throw new StorageException("Failed to write " + target, e);
            }
            logger.debug("Saved {}", target);
            written.add(target);
        }
        return written;
    }
}
