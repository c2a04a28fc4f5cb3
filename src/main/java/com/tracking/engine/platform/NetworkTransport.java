package com.tracking.engine.platform;

import com.tracking.engine.exception.SyncException;

import java.time.Duration;
import java.util.Map;

/**
 * Outbound HTTP used by the sync pipeline.
 */
public interface NetworkTransport {

    /**
     * Sends one request and returns whatever status the server answered with.
     *
     * @throws SyncException when no HTTP status was obtained (network failure or timeout)
     */
    TransportResponse send(String method, String url, Map<String, String> headers, String body, Duration timeout);

    /**
     * Status code and raw response body.
     */
    record TransportResponse(int status, String body) {

        public boolean successful() {
            return status >= 200 && status < 300;
        }

        public boolean clientError() {
            return status >= 400 && status < 500;
        }
    }
}
