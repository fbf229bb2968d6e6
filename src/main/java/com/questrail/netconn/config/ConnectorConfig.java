package com.questrail.netconn.config;

import io.netty.channel.EventLoopGroup;
import io.netty.handler.ssl.SslContext;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for outbound connections made by a {@code Connector}.
 */
public record ConnectorConfig(
    Optional<SslContext> sslContext,
    Duration connectTimeout,
    ConnectionOptions connectionOptions,
    Optional<EventLoopGroup> eventLoopGroup
) {
    public ConnectorConfig {
        Objects.requireNonNull(sslContext, "sslContext");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(connectionOptions, "connectionOptions");
        Objects.requireNonNull(eventLoopGroup, "eventLoopGroup");

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (connectTimeout.toMillis() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("connectTimeout too large");
        }
        if (sslContext.isPresent() && !sslContext.get().isClient()) {
            throw new IllegalArgumentException("sslContext must be a client context");
        }
    }

    public static ConnectorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SslContext sslContext;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private ConnectionOptions connectionOptions = ConnectionOptions.defaults();
        private EventLoopGroup eventLoopGroup;

        public Builder withSslContext(SslContext sslContext) {
            this.sslContext = sslContext;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withConnectionOptions(ConnectionOptions connectionOptions) {
            this.connectionOptions = connectionOptions;
            return this;
        }

        public Builder withEventLoopGroup(EventLoopGroup eventLoopGroup) {
            this.eventLoopGroup = eventLoopGroup;
            return this;
        }

        public ConnectorConfig build() {
            return new ConnectorConfig(
                Optional.ofNullable(sslContext),
                connectTimeout,
                connectionOptions,
                Optional.ofNullable(eventLoopGroup)
            );
        }
    }
}
