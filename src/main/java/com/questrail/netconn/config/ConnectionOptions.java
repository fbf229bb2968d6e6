package com.questrail.netconn.config;

import com.questrail.netconn.codec.JsonCodec;
import com.questrail.netconn.codec.StringFormat;
import com.questrail.netconn.codec.WireCodec;
import com.questrail.netconn.internal.time.MonotonicClock;
import com.questrail.netconn.internal.time.MonotonicScheduler;
import com.questrail.netconn.internal.time.SystemMonotonicClock;
import com.questrail.netconn.observability.ConnectionObservabilitySink;
import com.questrail.netconn.observability.Slf4jConnectionObservabilitySink;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Options bag handed to every connection constructor.
 *
 * <p>A listener forwards its options unopened to the connection factory. Caller
 * data that the library does not interpret travels in {@link #attributes()}.</p>
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>idleTimeout</b>: destroy the transport after this much inactivity;
 *       zero disables.</li>
 *   <li><b>readTimeout</b>: bound on each pending read; zero disables.</li>
 *   <li><b>stringFormat</b>: format used by the typed string and JSON helpers
 *       when none is given explicitly.</li>
 *   <li><b>compressInbound / compressOutbound</b>: enable the compression
 *       framer for a direction as soon as the connection is created.</li>
 *   <li><b>allowHalfOpen</b>: when false, a remote end makes the connection
 *       end its own side once pending writes are flushed.</li>
 *   <li><b>maxInboundFrameLength</b>: largest compression frame payload
 *       accepted before the connection is destroyed.</li>
 *   <li><b>logger</b>: per-connection logger; empty means the class logger.</li>
 *   <li><b>scheduler</b>: timer source for read timeouts; empty means the
 *       channel's event loop.</li>
 * </ul>
 */
public record ConnectionOptions(
    Duration idleTimeout,
    Duration readTimeout,
    StringFormat stringFormat,
    boolean compressInbound,
    boolean compressOutbound,
    boolean allowHalfOpen,
    int maxInboundFrameLength,
    JsonCodec jsonCodec,
    Optional<Logger> logger,
    ConnectionObservabilitySink observabilitySink,
    Optional<MonotonicScheduler> scheduler,
    MonotonicClock clock,
    Map<String, Object> attributes
) {
    public ConnectionOptions {
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(stringFormat, "stringFormat");
        Objects.requireNonNull(jsonCodec, "jsonCodec");
        Objects.requireNonNull(logger, "logger");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(attributes, "attributes");

        if (idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be non-negative");
        }
        if (readTimeout.isNegative()) {
            throw new IllegalArgumentException("readTimeout must be non-negative");
        }
        if (maxInboundFrameLength < 1 || maxInboundFrameLength > WireCodec.MAX_DECODABLE_LENGTH) {
            throw new IllegalArgumentException("maxInboundFrameLength must be in 1.." + WireCodec.MAX_DECODABLE_LENGTH);
        }
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ConnectionOptions defaults() {
        return builder().build();
    }

    /**
     * Caller-supplied attribute, if present and of the requested type.
     */
    public <T> Optional<T> attribute(String key, Class<T> type) {
        Object value = attributes.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.idleTimeout = idleTimeout;
        b.readTimeout = readTimeout;
        b.stringFormat = stringFormat;
        b.compressInbound = compressInbound;
        b.compressOutbound = compressOutbound;
        b.allowHalfOpen = allowHalfOpen;
        b.maxInboundFrameLength = maxInboundFrameLength;
        b.jsonCodec = jsonCodec;
        b.logger = logger.orElse(null);
        b.observabilitySink = observabilitySink;
        b.scheduler = scheduler.orElse(null);
        b.clock = clock;
        b.attributes.putAll(attributes);
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration idleTimeout = Duration.ZERO;
        private Duration readTimeout = Duration.ZERO;
        private StringFormat stringFormat = StringFormat.CURRENT;
        private boolean compressInbound;
        private boolean compressOutbound;
        private boolean allowHalfOpen;
        private int maxInboundFrameLength = WireCodec.MAX_DECODABLE_LENGTH;
        private JsonCodec jsonCodec = JsonCodec.defaultCodec();
        private Logger logger;
        private ConnectionObservabilitySink observabilitySink = Slf4jConnectionObservabilitySink.defaultSink();
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder withIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withStringFormat(StringFormat stringFormat) {
            this.stringFormat = stringFormat;
            return this;
        }

        public Builder withCompression(boolean inbound, boolean outbound) {
            this.compressInbound = inbound;
            this.compressOutbound = outbound;
            return this;
        }

        public Builder withAllowHalfOpen(boolean allowHalfOpen) {
            this.allowHalfOpen = allowHalfOpen;
            return this;
        }

        public Builder withMaxInboundFrameLength(int maxInboundFrameLength) {
            this.maxInboundFrameLength = maxInboundFrameLength;
            return this;
        }

        public Builder withJsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public Builder withLogger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public Builder withObservabilitySink(ConnectionObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler, MonotonicClock clock) {
            this.scheduler = scheduler;
            this.clock = clock;
            return this;
        }

        public Builder withAttribute(String key, Object value) {
            attributes.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public ConnectionOptions build() {
            return new ConnectionOptions(
                idleTimeout,
                readTimeout,
                stringFormat,
                compressInbound,
                compressOutbound,
                allowHalfOpen,
                maxInboundFrameLength,
                jsonCodec,
                Optional.ofNullable(logger),
                observabilitySink,
                Optional.ofNullable(scheduler),
                clock,
                attributes
            );
        }
    }
}
