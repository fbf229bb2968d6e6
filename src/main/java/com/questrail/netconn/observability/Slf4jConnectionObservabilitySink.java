package com.questrail.netconn.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Default sink: emits events through SLF4J. Traffic is logged at trace,
 * lifecycle at debug and errors at warn.
 */
public final class Slf4jConnectionObservabilitySink implements ConnectionObservabilitySink {
    private static final Slf4jConnectionObservabilitySink DEFAULT =
        new Slf4jConnectionObservabilitySink(LoggerFactory.getLogger(Slf4jConnectionObservabilitySink.class));

    private final Logger log;

    public Slf4jConnectionObservabilitySink(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public static Slf4jConnectionObservabilitySink defaultSink() {
        return DEFAULT;
    }

    @Override
    public void onTraffic(ConnectionTrafficEvent event) {
        if (log.isTraceEnabled()) {
            log.trace("{}: {} {} bytes (total {})",
                event.source(), event.direction(), event.bytes(), event.total());
        }
    }

    @Override
    public void onLifecycle(ConnectionLifecycleEvent event) {
        log.debug("{}: {} {}", event.source(), event.kind(), event.detail());
    }

    @Override
    public void onError(ConnectionErrorEvent event) {
        log.warn("{}: {}", event.source(), event.message(), event.cause());
    }
}
