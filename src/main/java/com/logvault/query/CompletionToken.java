package com.logvault.query;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Proof that a query completed, holding its first result payload.
 * Its page sequence can be opened exactly once.
 */
public final class CompletionToken {

    private final QueryExecution execution;
    private final JsonNode firstPayload;
    private boolean consumed;

    CompletionToken(QueryExecution execution, JsonNode firstPayload) {
        this.execution = execution;
        this.firstPayload = firstPayload;
    }

    public QueryExecution getExecution() {
        return execution;
    }

    JsonNode getFirstPayload() {
        return firstPayload;
    }

    void claim() {
        if (consumed) {
            throw new IllegalStateException(
                "Pages of query " + execution.getId() + " were already consumed; submit the query again to refetch");
        }
        consumed = true;
    }
}
