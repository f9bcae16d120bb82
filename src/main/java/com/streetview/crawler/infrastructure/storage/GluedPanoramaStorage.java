package com.streetview.crawler.infrastructure.storage;

import com.streetview.crawler.application.port.out.PanoramaStorage;
import com.streetview.crawler.domain.model.AcquiredImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stitches all images of a panorama side by side into one composite.
 *
 * Composition Rule:
 * - Images are ordered by field of view (stable, so acquisition order is kept)
 * - With seam duplication the last image is repeated at the left edge, so the
 *   360/0 degree wraparound appears at the start of the strip
 * - Canvas width is the sum of all widths, height the tallest image; shorter
 *   images are drawn at the top and the rest of their column stays blank
 * - File name joins the {@code fov-heading} labels with {@code --} in drawing order
 */
public class GluedPanoramaStorage implements PanoramaStorage {

    private static final Logger logger = LoggerFactory.getLogger(GluedPanoramaStorage.class);
    static final String LABEL_DELIMITER = "--";
    private static final String FORMAT = "jpg";

    private final boolean duplicateSeam;

    public GluedPanoramaStorage(boolean duplicateSeam) {
        this.duplicateSeam = duplicateSeam;
    }

    @Override
    public List<Path> save(Path directory, List<AcquiredImage> images) {
        Path folder = PanoramaFolders.prepare(directory, images);

        List<AcquiredImage> ordered = new ArrayList<>(images);
        ordered.sort(Comparator.comparingInt(image -> image.getRequest().getFov()));
        if (duplicateSeam) {
            ordered.add(0, ordered.get(ordered.size() - 1));
        }

        List<BufferedImage> tiles = new ArrayList<>(ordered.size());
        for (AcquiredImage image : ordered) {
            tiles.add(decode(image));
        }

        BufferedImage composite = glue(tiles);
        String name = ordered.stream()
            .map(image -> image.getRequest().label())
            .collect(Collectors.joining(LABEL_DELIMITER)) + PanoramaFolders.EXTENSION;
        Path target = folder.resolve(name);
        try {
            if (!ImageIO.write(composite, FORMAT, target.toFile())) {
                throw new StorageException("No image writer available for " + FORMAT);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write composite " + target, e);
        }
        logger.debug("Saved {}x{} composite {}", composite.getWidth(), composite.getHeight(), target);
        return List.of(target);
    }

    static BufferedImage glue(List<BufferedImage> tiles) {
        int width = tiles.stream().mapToInt(BufferedImage::getWidth).sum();
        int height = tiles.stream().mapToInt(BufferedImage::getHeight).max().orElse(0);
        BufferedImage composite = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = composite.createGraphics();
        try {
            int x = 0;
            for (BufferedImage tile : tiles) {
                graphics.drawImage(tile, x, 0, null);
                x += tile.getWidth();
            }
        } finally {
            graphics.dispose();
        }
        return composite;
    }

    private static BufferedImage decode(AcquiredImage image) {
        try {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image.getContent()));
            if (decoded == null) {
                throw new StorageException("Unsupported image format for " + image.getRequest());
            }
            return decoded;
        } catch (IOException e) {
            throw new StorageException("Failed to decode " + image.getRequest(), e);
        }
    }

    public boolean isDuplicateSeam() {
        return duplicateSeam;
    }
}
