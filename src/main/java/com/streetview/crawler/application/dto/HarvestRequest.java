package com.streetview.crawler.application.dto;

import com.streetview.crawler.domain.model.Coordinates;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Parameters of one harvest run.
 */
@Getter
@AllArgsConstructor
@ToString
public class HarvestRequest {
    private final Coordinates center;
    private final int squareSideMeters;
    private final int stepMeters;
    private final Path outputDirectory;
}
