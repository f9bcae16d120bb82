package com.streetview.crawler.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streetview.crawler.application.port.out.PanoramaImageSource;
import com.streetview.crawler.application.port.out.PanoramaMetadataLookup;
import com.streetview.crawler.domain.model.Coordinates;
import com.streetview.crawler.domain.model.ImageFetchResult;
import com.streetview.crawler.domain.model.ImageRequest;
import com.streetview.crawler.domain.model.MetadataLookupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Client for the Street View metadata and static imagery endpoints.
 * Requests are issued one at a time and never retried.
 */
@Service
public class StreetViewClient implements PanoramaMetadataLookup, PanoramaImageSource {

    private static final Logger logger = LoggerFactory.getLogger(StreetViewClient.class);
    static final String METADATA_PATH = "/maps/api/streetview/metadata";
    static final String IMAGE_PATH = "/maps/api/streetview";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final int timeoutSeconds;

    public StreetViewClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        @Value("${app.streetview.api-url:https://maps.googleapis.com}") String apiUrl,
        @Value("${app.streetview.api-key:}") String apiKey,
        @Value("${app.streetview.timeout-seconds:30}") int timeoutSeconds
    ) {
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.timeoutSeconds = timeoutSeconds;
        this.webClient = webClientBuilder
            .baseUrl(apiUrl)
            .build();
        if (apiKey == null || apiKey.isBlank()) {
            logger.warn("No Street View API key configured, requests will be rejected");
        }
    }

    /**
     * Query the metadata endpoint for the panorama nearest to a point.
     *
     * @param point Point to look up
     * @return Parsed status, or {@code REQUEST_FAILED} if the call or parsing failed
     */
    @Override
    public MetadataLookupResult lookup(Coordinates point) {
        String location = point.getLat() + "," + point.getLng();
        try {
            String responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path(METADATA_PATH)
                    .queryParam("location", location)
                    .queryParam("key", apiKey)
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .block();

            return parseMetadata(responseBody);
        } catch (WebClientResponseException e) {
            logger.error("Metadata lookup for {} returned error: {}", location, e.getStatusCode());
        } catch (WebClientException e) {
            logger.error("Failed to connect to metadata endpoint for {}", location, e);
        } catch (Exception e) {
            logger.error("Unexpected error looking up metadata for {}", location, e);
        }
        return MetadataLookupResult.failed();
    }

    /**
     * Download one directional image. Non-2xx answers are requested explicitly with
     * {@code return_error_code=true}, so a missing image is reported as a failure
     * instead of a placeholder picture.
     */
    @Override
    public ImageFetchResult fetch(ImageRequest request) {
        try {
            ResponseEntity<byte[]> response = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path(IMAGE_PATH)
                    .queryParam("size", request.getWidth() + "x" + request.getHeight())
                    .queryParam("pano", request.getPanoId())
                    .queryParam("heading", request.getHeading())
                    .queryParam("fov", request.getFov())
                    .queryParam("key", apiKey)
                    .queryParam("return_error_code", true)
                    .build())
                .retrieve()
                .toEntity(byte[].class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .block();

            if (response == null || response.getBody() == null || response.getBody().length == 0) {
                return ImageFetchResult.failure("empty response body");
            }
            return ImageFetchResult.success(response.getBody());
        } catch (WebClientResponseException e) {
            return ImageFetchResult.failure("HTTP " + e.getStatusCode().value());
        } catch (WebClientException e) {
            logger.debug("Image request for {} failed", request, e);
            return ImageFetchResult.failure(e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error downloading {}", request, e);
            return ImageFetchResult.failure(e.getMessage());
        }
    }

    /**
     * Parse a metadata JSON answer:
     * {@code {"status": "OK", "pano_id": "...", "location": {"lat": .., "lng": ..}}}.
     */
    MetadataLookupResult parseMetadata(String responseBody) {
        try {
            JsonNode root = objectMapper.readTree(responseBody == null ? "" : responseBody);
            JsonNode status = root.get("status");
            if (status == null || status.isNull()) {
                logger.warn("Metadata response missing status: {}", responseBody);
                return MetadataLookupResult.failed();
            }
            if (!MetadataLookupResult.STATUS_OK.equals(status.asText())) {
                return new MetadataLookupResult(status.asText(), null, null);
            }

            String panoId = root.hasNonNull("pano_id") ? root.get("pano_id").asText() : null;
            Coordinates location = null;
            JsonNode locationNode = root.get("location");
            if (locationNode != null && locationNode.hasNonNull("lat") && locationNode.hasNonNull("lng")) {
                location = new Coordinates(locationNode.get("lat").asDouble(), locationNode.get("lng").asDouble());
            }
            return MetadataLookupResult.ok(panoId, location);
        } catch (Exception e) {
            logger.error("Failed to parse metadata response", e);
            return MetadataLookupResult.failed();
        }
    }
}
