package com.logvault.query;

import java.net.URI;

/**
 * Issues authenticated GET requests against the Log Search REST API.
 *
 * Implementations return every HTTP answer, including 4xx and 5xx, as a
 * {@link LogSearchResponse}; interpreting the status is the engine's job.
 */
public interface LogSearchTransport {

    /**
     * @param uri absolute request URI, already encoded
     * @return the response, whatever its status
     * @throws TransientApiException if no response was received (connect / read failure)
     */
    LogSearchResponse get(URI uri);
}
