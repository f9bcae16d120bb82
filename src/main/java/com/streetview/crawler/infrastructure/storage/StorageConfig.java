package com.streetview.crawler.infrastructure.storage;

import com.streetview.crawler.application.port.out.PanoramaStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the configured storage strategy to the {@link PanoramaStorage} port.
 */
@Configuration
public class StorageConfig {

    private static final Logger logger = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public PanoramaStorage panoramaStorage(
        @Value("${app.catalogue.persistence:SIMPLE}") PersistenceMode mode,
        @Value("${app.catalogue.glued.duplicate-seam:true}") boolean duplicateSeam
    ) {
        logger.info("Storing panoramas in {} mode", mode);
        return switch (mode) {
            case SIMPLE -> new SimplePanoramaStorage();
            case GLUED -> new GluedPanoramaStorage(duplicateSeam);
        };
    }
}
