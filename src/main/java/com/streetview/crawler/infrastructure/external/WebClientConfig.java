package com.streetview.crawler.infrastructure.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration.
 *
 * Jackson codecs are auto-configured by Spring Boot. Only the in-memory buffer
 * limit is raised, since image bodies can exceed the 256KB default.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder(
        @Value("${app.streetview.max-image-bytes:4194304}") int maxImageBytes
    ) {
        return WebClient.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxImageBytes));
    }
}
