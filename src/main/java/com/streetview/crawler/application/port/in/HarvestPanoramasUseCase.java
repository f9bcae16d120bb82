package com.streetview.crawler.application.port.in;

import com.streetview.crawler.application.dto.HarvestRequest;
import com.streetview.crawler.domain.model.CatalogueSummary;

/**
 * Input port for harvesting the panoramas of a square area into a catalogue.
 */
public interface HarvestPanoramasUseCase {

  /**
   * Sample the area, resolve and deduplicate panoramas, then download and
   * catalogue every panorama found.
   *
   * @param request Area and output directory
   * @return Counters of the run
   */
  CatalogueSummary harvest(HarvestRequest request);
}
