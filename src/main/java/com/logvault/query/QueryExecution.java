package com.logvault.query;

import com.logvault.domain.LogQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.net.URI;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Mutable run-scoped state of one query: its lifecycle state, poll backoff and counters.
 * Owned by a single run; not thread-safe.
 */
public class QueryExecution {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecution.class);

    private final String id;
    private final LogQuery query;
    private final Instant startedAt;
    private final PollBackoff backoff;
    private final Set<URI> visitedUris = new HashSet<>();
    private QueryState state = QueryState.INIT;
    private String failureReason;
    private int pollAttempts;
    private int pagesVisited;

    QueryExecution(LogQuery query, Instant startedAt, Duration initialPollDelay, Duration maxPollDelay) {
        this.id = UUID.randomUUID().toString();
        this.query = query;
        this.startedAt = startedAt;
        this.backoff = new PollBackoff(initialPollDelay, maxPollDelay);
    }

    public String getId() {
        return id;
    }

    public LogQuery getQuery() {
        return query;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public QueryState getState() {
        return state;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public int getPollAttempts() {
        return pollAttempts;
    }

    public int getPagesVisited() {
        return pagesVisited;
    }

    PollBackoff getBackoff() {
        return backoff;
    }

    void advance(QueryState next) {
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException("Query " + id + " cannot move from " + state + " to " + next);
        }
        logger.trace("Query {} state {} -> {}", id, state, next);
        state = next;
    }

    void fail(String reason) {
        if (state.isTerminal()) {
            return;
        }
        logger.debug("Query {} failed in state {}: {}", id, state, reason);
        state = QueryState.FAILED;
        failureReason = reason;
    }

    int recordPollAttempt() {
        return ++pollAttempts;
    }

    int recordPageVisited() {
        return ++pagesVisited;
    }

    /**
     * Remember a URI this query requested: the submit URI, every polled Self link and every page link.
     *
     * @return false if the URI was already requested
     */
    boolean markVisited(URI uri) {
        return visitedUris.add(uri);
    }
}
