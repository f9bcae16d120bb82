package com.streetview.crawler.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Counters of one catalogue run.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class CatalogueSummary {
    private final int panoramasOffered;
    private final int panoramasCatalogued;
    private final int imagesStored;
}
