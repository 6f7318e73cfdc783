package com.logvault.query;

import com.logvault.config.IngestionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WebClientLogSearchTransport")
class WebClientLogSearchTransportTest {

    private static final URI QUERY_URI =
        URI.create("https://eu.rest.logs.insight.rapid7.com/query/logs/abc?from=1&to=2&per_page=50");

    private final List<ClientRequest> requests = new ArrayList<>();
    private IngestionProperties properties;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        properties.getApi().setApiKey("secret-key");
        properties.getApi().setRequestsPerMinute(0);
        properties.getApi().setReadTimeout(Duration.ofMillis(200));
    }

    private WebClientLogSearchTransport transport(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        return new WebClientLogSearchTransport(WebClient.builder().exchangeFunction(recording).build(), properties);
    }

    private static Mono<ClientResponse> respond(HttpStatus status, String body, String headerName, String headerValue) {
        ClientResponse.Builder builder = ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (headerName != null) {
            builder.header(headerName, headerValue);
        }
        return Mono.just(builder.body(body).build());
    }

    @Test
    void sendsApiKeyAndReturnsBody() {
        LogSearchResponse response = transport(request -> respond(HttpStatus.OK, "{\"events\":[]}", null, null))
            .get(QUERY_URI);

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.isSuccessful()).isTrue();
        assertThat(response.getBody()).isEqualTo("{\"events\":[]}");
        assertThat(response.getUri()).isEqualTo(QUERY_URI);

        assertThat(requests).hasSize(1);
        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.GET);
        assertThat(sent.url()).isEqualTo(QUERY_URI);
        assertThat(sent.headers().getFirst("x-api-key")).isEqualTo("secret-key");
        assertThat(sent.headers().getAccept()).contains(MediaType.APPLICATION_JSON);
    }

    @Test
    void errorStatusesComeBackAsResponses() {
        LogSearchResponse throttled = transport(request -> respond(HttpStatus.TOO_MANY_REQUESTS, "{}", "Retry-After", "7"))
            .get(QUERY_URI);

        assertThat(throttled.getStatusCode()).isEqualTo(429);
        assertThat(throttled.getHeaders().getFirst("Retry-After")).isEqualTo("7");

        LogSearchResponse unauthorized = transport(request -> respond(HttpStatus.UNAUTHORIZED, "", null, null))
            .get(QUERY_URI);

        assertThat(unauthorized.isAuthFailure()).isTrue();

        LogSearchResponse unavailable = transport(request -> respond(HttpStatus.SERVICE_UNAVAILABLE, "down", null, null))
            .get(QUERY_URI);

        assertThat(unavailable.isServerError()).isTrue();
        assertThat(unavailable.getBody()).isEqualTo("down");
    }

    @Test
    void ioFailureIsTransient() {
        WebClientLogSearchTransport transport = transport(request -> Mono.error(new WebClientRequestException(
            new IOException("Connection reset"), HttpMethod.GET, request.url(), new HttpHeaders())));

        assertThatThrownBy(() -> transport.get(QUERY_URI))
            .isInstanceOf(TransientApiException.class)
            .hasMessageContaining("eu.rest.logs.insight.rapid7.com/query/logs/abc")
            .hasRootCauseInstanceOf(IOException.class);
    }

    @Test
    void noAnswerWithinReadTimeoutIsTransient() {
        WebClientLogSearchTransport transport = transport(request -> Mono.never());

        assertThatThrownBy(() -> transport.get(QUERY_URI))
            .isInstanceOf(TransientApiException.class)
            .hasMessageContaining("did not answer within 200ms");
    }

    @Test
    void bodyAboveBufferLimitIsATypedFailure() {
        properties.getApi().setMaxResponseBytes(1024);
        ExchangeStrategies smallBuffer = ExchangeStrategies.builder()
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(1024))
            .build();
        String body = "{\"events\":[\"" + "x".repeat(4096) + "\"]}";
        WebClientLogSearchTransport transport = transport(request -> Mono.just(
            ClientResponse.create(HttpStatus.OK, smallBuffer)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build()));

        assertThatThrownBy(() -> transport.get(QUERY_URI))
            .isInstanceOf(LogSearchApiException.class)
            .isNotInstanceOf(TransientApiException.class)
            .hasMessageContaining("logvault.api.max-response-bytes")
            .hasRootCauseInstanceOf(DataBufferLimitException.class);
    }
}
