package com.questrail.netconn.observability;

import java.time.Instant;

/**
 * Record representing a lifecycle change of a connection or listener.
 */
public record ConnectionLifecycleEvent(
    Instant timestamp,
    String source,
    Kind kind,
    String detail
) {
    public enum Kind {
        CONNECTION_OPENED,
        CONNECTION_ENDED,
        CONNECTION_CLOSED,
        LISTENER_BOUND,
        CONNECTION_ACCEPTED,
        LISTENER_CLOSED
    }

    public static ConnectionLifecycleEvent of(String source, Kind kind, String detail) {
        return new ConnectionLifecycleEvent(Instant.now(), source, kind, detail);
    }
}
