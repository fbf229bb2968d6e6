package com.questrail.netconn.observability;

import java.time.Instant;

/**
 * Record representing an error observed on a connection or listener.
 */
public record ConnectionErrorEvent(
    Instant timestamp,
    String source,
    String message,
    Throwable cause
) {
    public static ConnectionErrorEvent of(String source, String message, Throwable cause) {
        return new ConnectionErrorEvent(Instant.now(), source, message, cause);
    }
}
