package com.streetview.crawler.infrastructure.storage;

import com.streetview.crawler.application.port.out.PanoramaStorage.StorageException;
import com.streetview.crawler.domain.model.AcquiredImage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Per-panorama output folders shared by the storage strategies.
 */
final class PanoramaFolders {

    static final String EXTENSION = ".jpg";

    private PanoramaFolders() {
    }

    /**
     * Check that all images belong to one panorama and create its folder.
     *
     * @return {@code <directory>/<panoId>}
     */
    static Path prepare(Path directory, List<AcquiredImage> images) {
        if (images == null || images.isEmpty()) {
            throw new IllegalArgumentException("At least one image is required");
        }
        String panoId = images.get(0).getRequest().getPanoId();
        for (AcquiredImage image : images) {
            if (!panoId.equals(image.getRequest().getPanoId())) {
                throw new IllegalArgumentException(
                    "Images of panoramas " + panoId + " and " + image.getRequest().getPanoId() + " cannot be stored together");
            }
        }

        Path folder = folderOf(directory, panoId);
        try {
            Files.createDirectories(folder);
        } catch (IOException e) {
            throw new StorageException("Cannot create panorama folder " + folder, e);
        }
        return folder;
    }

    /**
     * Resolve the folder of one panorama. It must be a direct child of {@code directory}.
     */
    static Path folderOf(Path directory, String panoId) {
        if (panoId.isEmpty() || panoId.indexOf('/') >= 0 || panoId.indexOf('\\') >= 0) {
            throw new StorageException("Panorama id '" + panoId + "' is not a valid folder name");
        }
        Path root = directory.toAbsolutePath().normalize();
        Path folder = root.resolve(panoId).normalize();
        if (!root.equals(folder.getParent())) {
            throw new StorageException("Panorama id '" + panoId + "' resolves outside " + directory);
        }
        return directory.resolve(panoId);
    }
}
