package com.questrail.netconn.config;

import com.questrail.netconn.Connection;
import com.questrail.netconn.ConnectionFactory;
import com.questrail.netconn.ConnectionHandler;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.ssl.SslContext;
import org.slf4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Construction-time configuration of a {@code ServiceListener}.
 *
 * <ul>
 *   <li><b>port</b>: port to bind; {@code 0} requests an ephemeral port.</li>
 *   <li><b>bindHost</b>: local address to bind; empty binds all interfaces.</li>
 *   <li><b>sslContext</b>: server TLS material, passed through to Netty's
 *       {@code SslHandler}; empty means plain TCP.</li>
 *   <li><b>factory</b>: builds the connection object for each accepted
 *       channel.</li>
 *   <li><b>handler</b>: started for every accepted connection that no
 *       {@code accept()} caller is waiting for; empty means such connections are
 *       queued for later {@code accept()} calls.</li>
 *   <li><b>connectionOptions</b>: forwarded unopened to the factory.</li>
 *   <li><b>eventLoopGroup</b>: shared group to run on; empty makes the listener
 *       create and own one.</li>
 * </ul>
 */
public record ServiceListenerConfig<C extends Connection>(
    int port,
    Optional<String> bindHost,
    Optional<SslContext> sslContext,
    ConnectionFactory<C> factory,
    Optional<ConnectionHandler<? super C>> handler,
    ConnectionOptions connectionOptions,
    Optional<Logger> logger,
    Optional<EventLoopGroup> eventLoopGroup
) {
    public ServiceListenerConfig {
        Objects.requireNonNull(bindHost, "bindHost");
        Objects.requireNonNull(sslContext, "sslContext");
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(connectionOptions, "connectionOptions");
        Objects.requireNonNull(logger, "logger");
        Objects.requireNonNull(eventLoopGroup, "eventLoopGroup");

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0-65535");
        }
        if (sslContext.isPresent() && !sslContext.get().isServer()) {
            throw new IllegalArgumentException("sslContext must be a server context");
        }
    }

    /**
     * Builder for listeners that hand out plain {@link Connection}s.
     */
    public static Builder<Connection> builder(int port) {
        return new Builder<>(port, Connection::new);
    }

    /**
     * Builder for listeners that construct connections through {@code factory}.
     */
    public static <C extends Connection> Builder<C> builder(int port, ConnectionFactory<C> factory) {
        return new Builder<>(port, factory);
    }

    public static final class Builder<C extends Connection> {
        private final int port;
        private final ConnectionFactory<C> factory;
        private String bindHost;
        private SslContext sslContext;
        private ConnectionHandler<? super C> handler;
        private ConnectionOptions connectionOptions = ConnectionOptions.defaults();
        private Logger logger;
        private EventLoopGroup eventLoopGroup;

        private Builder(int port, ConnectionFactory<C> factory) {
            this.port = port;
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public Builder<C> withBindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder<C> withSslContext(SslContext sslContext) {
            this.sslContext = sslContext;
            return this;
        }

        public Builder<C> withHandler(ConnectionHandler<? super C> handler) {
            this.handler = handler;
            return this;
        }

        public Builder<C> withConnectionOptions(ConnectionOptions connectionOptions) {
            this.connectionOptions = connectionOptions;
            return this;
        }

        public Builder<C> withLogger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public Builder<C> withEventLoopGroup(EventLoopGroup eventLoopGroup) {
            this.eventLoopGroup = eventLoopGroup;
            return this;
        }

        public ServiceListenerConfig<C> build() {
            return new ServiceListenerConfig<>(
                port,
                Optional.ofNullable(bindHost),
                Optional.ofNullable(sslContext),
                factory,
                Optional.ofNullable(handler),
                connectionOptions,
                Optional.ofNullable(logger),
                Optional.ofNullable(eventLoopGroup)
            );
        }
    }
}
