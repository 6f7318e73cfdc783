package com.logvault.query;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * One page of query results, in the order the API returned them.
 */
public final class ResultPage {

    private final int index;
    private final List<ObjectNode> records;
    private final URI nextLink;

    public ResultPage(int index, List<ObjectNode> records, URI nextLink) {
        this.index = index;
        this.records = List.copyOf(records);
        this.nextLink = nextLink;
    }

    /**
     * @return zero-based position of this page among the pages handed out for the query
     */
    public int getIndex() {
        return index;
    }

    public List<ObjectNode> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public Optional<URI> getNextLink() {
        return Optional.ofNullable(nextLink);
    }

    public boolean isLast() {
        return nextLink == null;
    }

    @Override
    public String toString() {
        return "ResultPage{index=" + index + ", records=" + records.size() + ", last=" + isLast() + "}";
    }
}
