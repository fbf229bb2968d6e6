package com.questrail.netconn.observability;

/**
 * Receives traffic, lifecycle and error events from connections and
 * listeners. Implementations can provide logging, bandwidth accounting or
 * metrics.
 *
 * <p>Callbacks arrive on Netty event loop threads and must not block.</p>
 */
public interface ConnectionObservabilitySink {
    /**
     * Called whenever a connection delivers bytes to a reader or accepts bytes
     * from a writer.
     */
    void onTraffic(ConnectionTrafficEvent event);

    /**
     * Called when a connection or listener changes lifecycle state.
     */
    void onLifecycle(ConnectionLifecycleEvent event);

    /**
     * Called when a transport error, decompression failure or similar fault is
     * observed.
     */
    void onError(ConnectionErrorEvent event);
}
