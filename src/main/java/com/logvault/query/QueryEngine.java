package com.logvault.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logvault.config.IngestionProperties;
import com.logvault.domain.CancellationSignal;
import com.logvault.domain.IngestionCancelledException;
import com.logvault.domain.LogQuery;
import com.logvault.observability.IngestionEventListener;
import com.logvault.query.ratelimit.RateLimitPolicy;
import com.logvault.query.ratelimit.RateLimitSignal;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * Runs one Log Search query: submit, poll to completion, then hand out result pages lazily.
 *
 * The engine is synchronous and owned by a single run. Its only blocking points are
 * poll backoff sleeps and rate-limit waits, both going through the {@link Sleeper}.
 * Throttled and 5xx / I/O answers are retried locally by re-issuing the identical request;
 * every other failure moves the query to {@link QueryState#FAILED} and propagates.
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private static final String EVENTS_FIELD = "events";
    private static final String LINKS_FIELD = "links";
    private static final String REL_SELF = "Self";
    private static final String REL_NEXT = "Next";
    private static final int BODY_SNIPPET_LENGTH = 200;

    private final LogSearchTransport transport;
    private final LogSearchEndpoints endpoints;
    private final IngestionProperties properties;
    private final RateLimitPolicy rateLimitPolicy;
    private final EventsDecoder eventsDecoder;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final Clock clock;
    private final IngestionEventListener listener;
    private final CancellationSignal cancellation;
    private final Retry transientRetry;

    private QueryExecution activeExecution;

    public QueryEngine(LogSearchTransport transport,
                       IngestionProperties properties,
                       ObjectMapper objectMapper,
                       Sleeper sleeper,
                       Clock clock,
                       IngestionEventListener listener,
                       CancellationSignal cancellation) {
        this.transport = transport;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.clock = clock;
        this.listener = listener;
        this.cancellation = cancellation;
        this.endpoints = new LogSearchEndpoints(properties.getApi().getBaseUrlTemplate());
        this.rateLimitPolicy = new RateLimitPolicy(properties.getRateLimit(), clock);
        this.eventsDecoder = new EventsDecoder(objectMapper);
        this.transientRetry = buildTransientRetry(properties.getRetry());
    }

    private Retry buildTransientRetry(IngestionProperties.Retry settings) {
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(settings.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                settings.getInitialBackoff().toMillis(), settings.getMultiplier()))
            .retryOnException(e -> e instanceof TransientApiException && !cancellation.isCancelled())
            .build();
        Retry retry = Retry.of("log-search", config);
        retry.getEventPublisher().onRetry(event -> {
            if (activeExecution != null) {
                listener.onTransientRetry(activeExecution.getQuery(), event.getNumberOfRetryAttempts(),
                    event.getWaitInterval(), event.getLastThrowable());
            }
        });
        return retry;
    }

    /**
     * Issue the initial query request.
     *
     * @return a handle to poll, already complete if results came back immediately
     * @throws LogSearchAuthException on 401/403
     * @throws InvalidQueryException  on 400/404 or a body that is neither results nor an in-progress link
     */
    public QueryHandle submit(LogQuery query) {
        QueryExecution execution = new QueryExecution(query, clock.instant(),
            properties.getPolling().getInitialDelay(), properties.getPolling().getMaxDelay());
        try {
            cancellation.throwIfCancelled("submit");
            URI uri = endpoints.submitUri(query, properties.getApi().getPerPage());
            listener.onSubmit(query);

            execution.markVisited(uri);
            LogSearchResponse response = exchange(execution, uri, "submit");
            if (!response.isSuccessful()) {
                throw submitFailure(query, response);
            }
            JsonNode body = parseBody(response, query,
                message -> new InvalidQueryException(message, query.getLogKey()));
            execution.advance(QueryState.SUBMITTED);

            if (isResultPayload(body)) {
                logger.info("Query {} for log {} answered with results immediately", execution.getId(), query.getLogKey());
                return new QueryHandle(execution, null, body);
            }
            URI selfLink = findLink(body, REL_SELF, message -> new InvalidQueryException(message, query.getLogKey()));
            if (selfLink == null) {
                throw new InvalidQueryException(
                    "Submit response has neither an events payload nor a links[rel=Self] polling link", query.getLogKey());
            }
            logger.info("Query {} for log {} in progress", execution.getId(), query.getLogKey());
            return new QueryHandle(execution, selfLink, null);
        } catch (RuntimeException e) {
            execution.fail(e.getMessage());
            throw e;
        }
    }

    /**
     * Poll a submitted query until the API returns its first result payload.
     * Backoff doubles from {@code polling.initial-delay} up to {@code polling.max-delay}.
     *
     * @throws QueryTimeoutException when {@code polling.max-elapsed} or {@code polling.max-attempts} is exceeded
     */
    public CompletionToken pollToCompletion(QueryHandle handle) {
        QueryExecution execution = handle.getExecution();
        try {
            JsonNode payload = handle.isComplete()
                ? handle.getImmediateResult()
                : awaitResult(execution, handle.getSelfLink());
            execution.advance(QueryState.COMPLETE);
            return new CompletionToken(execution, payload);
        } catch (RuntimeException e) {
            execution.fail(e.getMessage());
            throw e;
        }
    }

    /**
     * Open the forward-only page sequence of a completed query. Can be called once per token.
     */
    public PageSequence pages(CompletionToken token) {
        token.claim();
        return new PageSequence(this, token.getExecution(), token.getFirstPayload(),
            properties.getPagination().getMaxPages());
    }

    /**
     * Fetch the page behind a Next link, polling it if the API answers in progress.
     */
    JsonNode fetchPage(QueryExecution execution, URI link) {
        LogQuery query = execution.getQuery();
        cancellation.throwIfCancelled("page fetch");
        execution.markVisited(link);
        LogSearchResponse response = exchange(execution, link, "page fetch");
        requireSuccess(response, query, "page fetch");
        JsonNode body = parseBody(response, query, message -> new ProtocolException(message, query.getLogKey()));
        if (isResultPayload(body)) {
            return body;
        }
        URI selfLink = findLink(body, REL_SELF, message -> new ProtocolException(message, query.getLogKey()));
        if (selfLink == null) {
            throw new ProtocolException("Page response has neither events nor a links[rel=Self] polling link",
                query.getLogKey());
        }
        logger.debug("Page {} of query {} still in progress", link, execution.getId());
        return awaitResult(execution, selfLink);
    }

    List<ObjectNode> decodeEvents(QueryExecution execution, JsonNode payload) {
        return eventsDecoder.decode(payload.get(EVENTS_FIELD), execution.getQuery().getLogKey());
    }

    URI findNextLink(QueryExecution execution, JsonNode payload) {
        String logKey = execution.getQuery().getLogKey();
        return findLink(payload, REL_NEXT, message -> new ProtocolException(message, logKey));
    }

    void pageFetched(QueryExecution execution, int pageIndex, int recordCount) {
        listener.onPageFetched(execution.getQuery(), pageIndex, recordCount,
            Duration.between(execution.getStartedAt(), clock.instant()));
    }

    private JsonNode awaitResult(QueryExecution execution, URI selfLink) {
        LogQuery query = execution.getQuery();
        IngestionProperties.Polling polling = properties.getPolling();
        Instant waitStarted = clock.instant();
        int attempts = 0;
        URI link = selfLink;

        while (true) {
            cancellation.throwIfCancelled("poll");
            if (polling.getMaxAttempts() > 0 && attempts >= polling.getMaxAttempts()) {
                throw new QueryTimeoutException(query.getLogKey(), Duration.between(waitStarted, clock.instant()), attempts);
            }

            Duration delay = execution.getBackoff().nextDelay();
            sleep(delay, "poll");
            Duration elapsed = Duration.between(waitStarted, clock.instant());
            if (elapsed.compareTo(polling.getMaxElapsed()) > 0) {
                throw new QueryTimeoutException(query.getLogKey(), elapsed, attempts);
            }
            cancellation.throwIfCancelled("poll");

            attempts++;
            int attempt = execution.recordPollAttempt();
            if (execution.getState() == QueryState.SUBMITTED || execution.getState() == QueryState.POLLING) {
                execution.advance(QueryState.POLLING);
            }
            listener.onPollAttempt(query, attempt, delay, Duration.between(execution.getStartedAt(), clock.instant()));

            execution.markVisited(link);
            LogSearchResponse response = exchange(execution, link, "poll");
            requireSuccess(response, query, "poll");
            JsonNode body = parseBody(response, query, message -> new ProtocolException(message, query.getLogKey()));
            if (isResultPayload(body)) {
                logger.debug("Query {} completed after {} poll attempts", execution.getId(), attempt);
                return body;
            }
            URI next = findLink(body, REL_SELF, message -> new ProtocolException(message, query.getLogKey()));
            if (next == null) {
                throw new ProtocolException("In-progress response carries no links[rel=Self] to poll", query.getLogKey());
            }
            link = next;
        }
    }

    /**
     * Send one request, re-issuing the identical request while it is throttled or fails transiently.
     */
    private LogSearchResponse exchange(QueryExecution execution, URI uri, String purpose) {
        LogQuery query = execution.getQuery();
        int throttled = 0;

        while (true) {
            cancellation.throwIfCancelled(purpose);
            activeExecution = execution;
            LogSearchResponse response;
            try {
                response = transientRetry.executeSupplier(() -> {
                    cancellation.throwIfCancelled(purpose);
                    LogSearchResponse candidate = transport.get(uri);
                    if (candidate.isServerError()) {
                        throw new TransientApiException(candidate.getStatusCode(),
                            "Log Search answered HTTP " + candidate.getStatusCode() + " to " + purpose, query.getLogKey());
                    }
                    return candidate;
                });
            } catch (TransientApiException e) {
                // a cancel that stopped the retry loop wins over the last failure
                cancellation.throwIfCancelled(purpose);
                throw e;
            }

            if (response.isAuthFailure()) {
                throw new LogSearchAuthException(response.getStatusCode(), query.getLogKey());
            }
            if (rateLimitPolicy.isThrottled(response.getStatusCode())) {
                throttled++;
                RateLimitSignal signal = rateLimitPolicy.evaluate(response.getStatusCode(), response.getHeaders());
                rateLimitPolicy.enforceCaps(signal, throttled, query.getLogKey());
                listener.onRateLimited(query, signal, throttled);
                sleep(signal.getWait(), purpose);
                continue;
            }
            return response;
        }
    }

    private RuntimeException submitFailure(LogQuery query, LogSearchResponse response) {
        int status = response.getStatusCode();
        if (status == 400) {
            return new InvalidQueryException("Log Search rejected the query (HTTP 400): " + snippet(response.getBody()),
                query.getLogKey());
        }
        if (status == 404) {
            return new InvalidQueryException("Log key not found at " + endpoints.describeBase(query)
                + " (HTTP 404); check that the data storage region '" + query.getRegion().getCode()
                + "' is the one hosting this log", query.getLogKey());
        }
        return new LogSearchApiException(status, "Unexpected HTTP " + status + " submitting query: "
            + snippet(response.getBody()), query.getLogKey());
    }

    private void requireSuccess(LogSearchResponse response, LogQuery query, String purpose) {
        if (!response.isSuccessful()) {
            throw new LogSearchApiException(response.getStatusCode(), "Unexpected HTTP " + response.getStatusCode()
                + " during " + purpose + ": " + snippet(response.getBody()), query.getLogKey());
        }
    }

    private JsonNode parseBody(LogSearchResponse response, LogQuery query,
                               Function<String, ? extends RuntimeException> failure) {
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw failure.apply("Empty response body from " + response.getUri().getPath());
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            RuntimeException error = failure.apply("Response body is not valid JSON: " + e.getOriginalMessage());
            error.initCause(e);
            throw error;
        }
        if (node == null || !node.isObject()) {
            throw failure.apply("Response body is not a JSON object: " + snippet(body));
        }
        return node;
    }

    private static boolean isResultPayload(JsonNode body) {
        return body.has(EVENTS_FIELD);
    }

    private static URI findLink(JsonNode body, String rel, Function<String, ? extends RuntimeException> malformed) {
        JsonNode links = body.path(LINKS_FIELD);
        if (!links.isArray()) {
            return null;
        }
        for (JsonNode link : links) {
            if (!rel.equalsIgnoreCase(link.path("rel").asText(""))) {
                continue;
            }
            String href = link.path("href").asText(null);
            if (href == null || href.isBlank()) {
                throw malformed.apply("links[rel=" + rel + "] has no href");
            }
            try {
                URI uri = new URI(href.trim());
                if (!uri.isAbsolute()) {
                    throw malformed.apply("links[rel=" + rel + "] href is not absolute: " + href);
                }
                return uri;
            } catch (URISyntaxException e) {
                throw malformed.apply("links[rel=" + rel + "] href is not a valid URI: " + href);
            }
        }
        return null;
    }

    private void sleep(Duration duration, String checkpoint) {
        if (duration.isZero()) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionCancelledException(checkpoint, e);
        }
    }

    private static String snippet(String body) {
        if (body == null) {
            return "<empty>";
        }
        String trimmed = body.strip();
        return trimmed.length() > BODY_SNIPPET_LENGTH ? trimmed.substring(0, BODY_SNIPPET_LENGTH) + "..." : trimmed;
    }
}
