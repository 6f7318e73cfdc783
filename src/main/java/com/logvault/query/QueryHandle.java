package com.logvault.query;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;

/**
 * A submitted query. Either carries the link to poll, or the result payload when
 * the API answered the submit request with results straight away.
 */
public final class QueryHandle {

    private final QueryExecution execution;
    private final URI selfLink;
    private final JsonNode immediateResult;

    QueryHandle(QueryExecution execution, URI selfLink, JsonNode immediateResult) {
        this.execution = execution;
        this.selfLink = selfLink;
        this.immediateResult = immediateResult;
    }

    public String getId() {
        return execution.getId();
    }

    /**
     * @return the polling link, or null when the submit response was already complete
     */
    public URI getSelfLink() {
        return selfLink;
    }

    public boolean isComplete() {
        return immediateResult != null;
    }

    public QueryExecution getExecution() {
        return execution;
    }

    JsonNode getImmediateResult() {
        return immediateResult;
    }

    @Override
    public String toString() {
        return "QueryHandle{id=" + getId() + ", state=" + execution.getState() + "}";
    }
}
