package com.streetview.crawler.infrastructure.storage;

import com.streetview.crawler.domain.model.CatalogueIndexEntry;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes the catalogue index as a comma separated table.
 * The file is created exclusively and every row is flushed as soon as it is written.
 */
public class CsvCatalogueIndexWriter implements Closeable {

    public static final String HEADER = "pano_id,latitude,longitude";

    private final BufferedWriter writer;

    /**
     * Create the index file and write its header.
     *
     * @throws java.nio.file.FileAlreadyExistsException if the file already exists
     */
    public CsvCatalogueIndexWriter(Path file) throws IOException {
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        writeLine(HEADER);
    }

    public void append(CatalogueIndexEntry entry) throws IOException {
        writeLine(String.join(",",
            escape(entry.getPanoId()),
            formatDegrees(entry.getLatitude()),
            formatDegrees(entry.getLongitude())));
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    private void writeLine(String line) throws IOException {
        writer.write(line);
        writer.write("\r\n");
        writer.flush();
    }

    private static String formatDegrees(double degrees) {
        String text = Double.toString(degrees);
        if (text.indexOf('E') < 0) {
            return text;
        }
        return BigDecimal.valueOf(degrees).stripTrailingZeros().toPlainString();
    }

    private static String escape(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
