package com.logvault.query;

import com.logvault.config.IngestionProperties;
import com.logvault.query.ratelimit.RequestPacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * WebClient implementation of {@link LogSearchTransport}.
 *
 * Features:
 * - x-api-key authentication on every request
 * - Client-side pacing of outbound requests (logvault.api.requests-per-minute)
 * - Every status comes back as a response; only I/O failures and timeouts raise,
 *   as {@link TransientApiException} so the engine can retry them
 * - A body above logvault.api.max-response-bytes raises {@link LogSearchApiException}
 */
@Component
public class WebClientLogSearchTransport implements LogSearchTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientLogSearchTransport.class);

    static final String API_KEY_HEADER = "x-api-key";
    static final String USER_AGENT = "logvault/1.0.0";

    private final WebClient webClient;
    private final RequestPacer pacer;
    private final String apiKey;
    private final Duration readTimeout;
    private final int maxResponseBytes;

    public WebClientLogSearchTransport(WebClient logSearchWebClient, IngestionProperties properties) {
        this.webClient = logSearchWebClient;
        this.apiKey = properties.getApi().getApiKey();
        this.readTimeout = properties.getApi().getReadTimeout();
        this.maxResponseBytes = properties.getApi().getMaxResponseBytes();
        this.pacer = new RequestPacer(properties.getApi().getRequestsPerMinute());
    }

    @Override
    public LogSearchResponse get(URI uri) {
        pacer.acquire();
        log.debug("GET {}", uri);

        ResponseEntity<String> response;
        try {
            response = webClient.get()
                .uri(uri)
                .header(API_KEY_HEADER, apiKey)
                .header(HttpHeaders.USER_AGENT, USER_AGENT)
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                .timeout(readTimeout)
                .block();
        } catch (WebClientRequestException e) {
            log.warn("I/O failure calling Log Search at {}: {}", uri.getPath(), e.getMessage());
            throw new TransientApiException("I/O failure calling Log Search at " + uri.getHost() + uri.getPath(), null, e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            DataBufferLimitException tooLarge = findCause(cause, DataBufferLimitException.class);
            if (tooLarge != null) {
                throw new LogSearchApiException(0, "Response from Log Search at " + uri.getHost() + uri.getPath()
                    + " is larger than " + maxResponseBytes + " bytes; raise logvault.api.max-response-bytes"
                    + " or lower logvault.api.per-page", null, tooLarge);
            }
            if (cause instanceof TimeoutException) {
                log.warn("No answer from Log Search at {} within {}", uri.getPath(), readTimeout);
                throw new TransientApiException("Log Search at " + uri.getHost() + uri.getPath()
                    + " did not answer within " + readTimeout.toMillis() + "ms", null, cause);
            }
            throw e;
        }

        if (response == null) {
            throw new TransientApiException("Empty exchange with Log Search at " + uri.getHost() + uri.getPath(), null, null);
        }
        log.debug("GET {} -> {}", uri.getPath(), response.getStatusCode().value());
        return new LogSearchResponse(uri, response.getStatusCode().value(), response.getHeaders(), response.getBody());
    }

    private static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }
}
