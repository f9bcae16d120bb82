package com.streetview.crawler;

import com.streetview.crawler.application.dto.HarvestRequest;
import com.streetview.crawler.application.port.in.HarvestPanoramasUseCase;
import com.streetview.crawler.domain.model.CatalogueSummary;
import com.streetview.crawler.domain.model.Coordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs one harvest at start-up.
 *
 * Run with:
 * mvn spring-boot:run -Dspring-boot.run.arguments="--app.harvest.center=50.45,30.52 --app.harvest.output-dir=out"
 */
@Component
@ConditionalOnProperty(name = "app.harvest.enabled", havingValue = "true", matchIfMissing = true)
public class HarvestRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(HarvestRunner.class);

    private final HarvestPanoramasUseCase harvestUseCase;
    private final String center;
    private final String outputDir;
    private final int squareSideMeters;
    private final int stepMeters;

    public HarvestRunner(
        HarvestPanoramasUseCase harvestUseCase,
        @Value("${app.harvest.center:}") String center,
        @Value("${app.harvest.output-dir:}") String outputDir,
        @Value("${app.harvest.square-side-meters:2000}") int squareSideMeters,
        @Value("${app.harvest.step-meters:10}") int stepMeters
    ) {
        this.harvestUseCase = harvestUseCase;
        this.center = center;
        this.outputDir = outputDir;
        this.squareSideMeters = squareSideMeters;
        this.stepMeters = stepMeters;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (center.isBlank() || outputDir.isBlank()) {
            logger.warn("app.harvest.center and app.harvest.output-dir must both be set, nothing to harvest");
            return;
        }

        HarvestRequest request = new HarvestRequest(
            Coordinates.parse(center),
            squareSideMeters,
            stepMeters,
            Path.of(outputDir));
        logger.info("Starting harvest: {}", request);

        CatalogueSummary summary = harvestUseCase.harvest(request);
        logger.info("Harvest finished: {} of {} panoramas catalogued, {} images stored",
            summary.getPanoramasCatalogued(), summary.getPanoramasOffered(), summary.getImagesStored());
    }
}
