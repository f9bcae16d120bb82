package com.streetview.crawler.application.service;

import com.streetview.crawler.application.dto.HarvestRequest;
import com.streetview.crawler.application.port.in.HarvestPanoramasUseCase;
import com.streetview.crawler.domain.model.CatalogueSummary;
import com.streetview.crawler.domain.model.GridSpec;
import com.streetview.crawler.domain.service.GridSampler;
import com.streetview.crawler.domain.service.PanoramaDeduplicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Application service wiring the harvest pipeline:
 * grid sampling, panorama resolution, deduplication, then cataloguing.
 *
 * Panorama discovery is handed to the catalogue lazily, so an existing index
 * stops the run before a single metadata lookup is made.
 */
@Service
public class HarvestService implements HarvestPanoramasUseCase {

  private static final Logger logger = LoggerFactory.getLogger(HarvestService.class);

  private final GridSampler gridSampler;
  private final PanoramaResolver panoramaResolver;
  private final PanoramaDeduplicator deduplicator;
  private final CatalogueService catalogueService;

  public HarvestService(
      GridSampler gridSampler,
      PanoramaResolver panoramaResolver,
      PanoramaDeduplicator deduplicator,
      CatalogueService catalogueService) {
    this.gridSampler = gridSampler;
    this.panoramaResolver = panoramaResolver;
    this.deduplicator = deduplicator;
    this.catalogueService = catalogueService;
  }

  @Override
  public CatalogueSummary harvest(HarvestRequest request) {
    GridSpec spec = new GridSpec(request.getCenter(), request.getSquareSideMeters(), request.getStepMeters());
    logger.info("Harvesting {}m square around {} into {} ({} sample points)",
        spec.getSideMeters(), spec.getCenter(), request.getOutputDirectory(), gridSampler.sampleCount(spec));

    return catalogueService.add(
        request.getOutputDirectory(),
        () -> deduplicator.dedupe(gridSampler.sample(spec), panoramaResolver::resolve));
  }
}
