package com.streetview.crawler;

import com.streetview.crawler.application.port.in.HarvestPanoramasUseCase;
import com.streetview.crawler.application.port.out.PanoramaImageSource;
import com.streetview.crawler.application.port.out.PanoramaMetadataLookup;
import com.streetview.crawler.application.port.out.PanoramaStorage;
import com.streetview.crawler.application.service.CatalogueService;
import com.streetview.crawler.application.service.PanoramaResolver;
import com.streetview.crawler.domain.service.GridSampler;
import com.streetview.crawler.infrastructure.external.StreetViewClient;
import com.streetview.crawler.infrastructure.storage.SimplePanoramaStorage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class StreetViewCrawlerApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private PanoramaMetadataLookup metadataLookup;

    @Autowired
    private PanoramaImageSource imageSource;

    @Autowired
    private PanoramaStorage panoramaStorage;

    @Autowired
    private CatalogueService catalogueService;

    @Autowired
    private GridSampler gridSampler;

    @Test
    void contextLoads_WithDefaultPipeline() {
        assertThat(context.getBean(HarvestPanoramasUseCase.class)).isNotNull();
        assertThat(metadataLookup).isInstanceOf(StreetViewClient.class);
        assertThat(imageSource).isSameAs(metadataLookup);
        assertThat(panoramaStorage).isInstanceOf(SimplePanoramaStorage.class);
        assertThat(catalogueService.getFov()).isEqualTo(90);
        assertThat(gridSampler.getStrideMeters()).isEqualTo(30);
    }

    @Test
    void panoramaResolver_StartsWithEmptyCache() {
        PanoramaResolver resolver = context.getBean(PanoramaResolver.class);

        assertThat(resolver.cacheSize()).isZero();
    }

    @Test
    void harvestRunner_DisabledInTests() {
        assertThat(context.getBeansOfType(HarvestRunner.class)).isEmpty();
    }
}
