package com.tracking.engine.event;

/**
 * Result of one upload request.
 *
 * @param success      2xx answer
 * @param status       HTTP status, 0 when no answer was received
 * @param responseText response body or failure message
 * @param recordCount  records carried by the request
 * @param attempt      1-based attempt number for this batch
 */
public record HttpEvent(boolean success, int status, String responseText, int recordCount, int attempt) {
}
