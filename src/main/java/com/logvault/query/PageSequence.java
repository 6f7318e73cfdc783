package com.logvault.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Forward-only, lazy sequence of the result pages of one completed query.
 *
 * A Next link is only followed when the caller asks for the following page. Pages without
 * events are followed through but never handed out. The sequence is finite: a Next link
 * pointing at any URI the query already requested (submit, Self polls, earlier pages), a Next
 * link without href, or more than {@code maxPages} payloads fail it with {@link ProtocolException}. After any failure the sequence is exhausted.
 */
public class PageSequence implements Iterator<ResultPage> {

    private final QueryEngine engine;
    private final QueryExecution execution;
    private final int maxPages;

    private JsonNode pendingPayload;
    private URI pendingLink;
    private ResultPage buffered;
    private int payloadsSeen;
    private int pagesYielded;
    private boolean exhausted;

    PageSequence(QueryEngine engine, QueryExecution execution, JsonNode firstPayload, int maxPages) {
        this.engine = engine;
        this.execution = execution;
        this.pendingPayload = firstPayload;
        this.maxPages = maxPages;
    }

    @Override
    public boolean hasNext() {
        if (buffered != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        buffered = advance();
        return buffered != null;
    }

    @Override
    public ResultPage next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more pages for query " + execution.getId());
        }
        ResultPage page = buffered;
        buffered = null;
        return page;
    }

    /**
     * @return number of non-empty pages handed out so far
     */
    public int getPagesYielded() {
        return pagesYielded;
    }

    public QueryExecution getExecution() {
        return execution;
    }

    private ResultPage advance() {
        String logKey = execution.getQuery().getLogKey();
        try {
            while (true) {
                JsonNode payload;
                if (pendingPayload != null) {
                    payload = pendingPayload;
                    pendingPayload = null;
                } else if (pendingLink != null) {
                    if (payloadsSeen >= maxPages) {
                        throw new ProtocolException("Pagination exceeded " + maxPages + " pages", logKey);
                    }
                    URI link = pendingLink;
                    pendingLink = null;
                    payload = engine.fetchPage(execution, link);
                } else {
                    finish();
                    return null;
                }

                payloadsSeen++;
                execution.recordPageVisited();
                if (execution.getState() == QueryState.COMPLETE) {
                    execution.advance(QueryState.PAGINATING);
                }

                List<ObjectNode> records = engine.decodeEvents(execution, payload);
                URI next = engine.findNextLink(execution, payload);
                if (next != null && !execution.markVisited(next)) {
                    throw new ProtocolException("Next link repeats an already visited page: " + next, logKey);
                }
                pendingLink = next;

                if (records.isEmpty()) {
                    continue;
                }
                ResultPage page = new ResultPage(pagesYielded++, records, next);
                engine.pageFetched(execution, page.getIndex(), page.size());
                return page;
            }
        } catch (RuntimeException e) {
            exhausted = true;
            pendingLink = null;
            execution.fail(e.getMessage());
            throw e;
        }
    }

    private void finish() {
        exhausted = true;
        if (execution.getState() == QueryState.COMPLETE || execution.getState() == QueryState.PAGINATING) {
            execution.advance(QueryState.DONE);
        }
    }
}
