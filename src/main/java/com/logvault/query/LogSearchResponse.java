package com.logvault.query;

import org.springframework.http.HttpHeaders;

import java.net.URI;

/**
 * Raw answer of one Log Search request: status, headers and the unparsed body.
 */
public final class LogSearchResponse {

    private final URI uri;
    private final int statusCode;
    private final HttpHeaders headers;
    private final String body;

    public LogSearchResponse(URI uri, int statusCode, HttpHeaders headers, String body) {
        this.uri = uri;
        this.statusCode = statusCode;
        this.headers = headers != null ? headers : new HttpHeaders();
        this.body = body;
    }

    public URI getUri() {
        return uri;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public HttpHeaders getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }

    public boolean isAuthFailure() {
        return statusCode == 401 || statusCode == 403;
    }

    @Override
    public String toString() {
        return "LogSearchResponse{status=" + statusCode + ", uri=" + uri + "}";
    }
}
