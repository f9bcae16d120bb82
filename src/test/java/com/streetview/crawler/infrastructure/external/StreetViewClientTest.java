package com.streetview.crawler.infrastructure.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streetview.crawler.domain.model.Coordinates;
import com.streetview.crawler.domain.model.ImageFetchResult;
import com.streetview.crawler.domain.model.MetadataLookupResult;
import com.streetview.crawler.domain.model.PanoramaRecord;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;

import static com.streetview.crawler.module.test.support.TestFixtures.imageRequest;
import static org.assertj.core.api.Assertions.assertThat;

class StreetViewClientTest {

    private static final String BASE_URL = "http://streetview.test";

    private final List<ClientRequest> requests = new ArrayList<>();

    private StreetViewClient client(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        return new StreetViewClient(
            WebClient.builder().exchangeFunction(recording),
            new ObjectMapper(),
            BASE_URL,
            "test-key",
            5);
    }

    private static Mono<ClientResponse> json(String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }

    @Test
    void lookup_Ok_ParsesIdAndLocation() {
        StreetViewClient client = client(request -> json(
            "{\"status\":\"OK\",\"pano_id\":\"A\",\"location\":{\"lat\":50.45012,\"lng\":30.52338},\"date\":\"2021-07\"}"));

        MetadataLookupResult result = client.lookup(new Coordinates(50.4501, 30.5234));

        assertThat(result.toRecord()).contains(new PanoramaRecord("A", new Coordinates(50.45012, 30.52338)));
        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.GET);
        assertThat(sent.url().getPath()).isEqualTo(StreetViewClient.METADATA_PATH);
        assertThat(sent.url().getQuery()).contains("location=50.4501,30.5234").contains("key=test-key");
    }

    @Test
    void lookup_ZeroResults_KeepsStatus() {
        StreetViewClient client = client(request -> json("{\"status\":\"ZERO_RESULTS\"}"));

        MetadataLookupResult result = client.lookup(new Coordinates(0.0, 0.0));

        assertThat(result.getStatus()).isEqualTo(MetadataLookupResult.STATUS_ZERO_RESULTS);
        assertThat(result.toRecord()).isEmpty();
    }

    @Test
    void lookup_OtherStatus_KeepsStatus() {
        StreetViewClient client = client(request -> json("{\"status\":\"REQUEST_DENIED\",\"error_message\":\"bad key\"}"));

        assertThat(client.lookup(new Coordinates(0.0, 0.0)).getStatus()).isEqualTo("REQUEST_DENIED");
    }

    @Test
    void lookup_ServerError_ReportsRequestFailed() {
        StreetViewClient client = client(request -> Mono.just(
            ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).build()));

        assertThat(client.lookup(new Coordinates(0.0, 0.0)).getStatus())
            .isEqualTo(MetadataLookupResult.STATUS_REQUEST_FAILED);
    }

    @Test
    void lookup_MalformedBody_ReportsRequestFailed() {
        StreetViewClient client = client(request -> json("not json"));

        assertThat(client.lookup(new Coordinates(0.0, 0.0)).getStatus())
            .isEqualTo(MetadataLookupResult.STATUS_REQUEST_FAILED);
    }

    @Test
    void fetch_Ok_ReturnsBytesAndSendsImageParameters() {
        byte[] image = {(byte) 0xFF, (byte) 0xD8, 1, 2, 3};
        StreetViewClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.IMAGE_JPEG_VALUE)
            .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(image)))
            .build()));

        ImageFetchResult result = client.fetch(imageRequest("A", 90, 180));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getContent()).containsExactly(image);
        ClientRequest sent = requests.get(0);
        assertThat(sent.url().getPath()).isEqualTo(StreetViewClient.IMAGE_PATH);
        assertThat(sent.url().getQuery())
            .contains("size=600x400")
            .contains("pano=A")
            .contains("heading=180")
            .contains("fov=90")
            .contains("key=test-key")
            .contains("return_error_code=true");
    }

    @Test
    void fetch_NotFound_IsFailureWithStatus() {
        StreetViewClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build()));

        ImageFetchResult result = client.fetch(imageRequest("A", 90, 0));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo("HTTP 404");
    }

    @Test
    void fetch_ConnectionRefused_IsFailure() {
        StreetViewClient client = client(request -> Mono.error(new WebClientRequestException(
            new ConnectException("Connection refused"), request.method(), request.url(), new HttpHeaders())));

        ImageFetchResult result = client.fetch(imageRequest("A", 90, 0));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).contains("Connection refused");
    }

    @Test
    void fetch_EmptyBody_IsFailure() {
        StreetViewClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()));

        assertThat(client.fetch(imageRequest("A", 90, 0)).isSuccess()).isFalse();
    }
}
