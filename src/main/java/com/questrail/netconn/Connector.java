package com.questrail.netconn;

import com.questrail.netconn.config.ConnectorConfig;
import com.questrail.netconn.error.TransportException;
import com.questrail.netconn.transport.netty.TlsHandshakeGate;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Connector
 * =============================================================================
 * Opens outbound TCP (optionally TLS) connections.
 *
 * <p>The returned connection is fully set up: with TLS the future completes only
 * after the handshake. Closing a connector that owns its event loop group shuts
 * the group down, which destroys every connection it made.</p>
 */
public final class Connector implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(Connector.class);

    private final ConnectorConfig config;
    private final EventLoopGroup group;
    private final boolean ownsGroup;

    public Connector()
    {
        this(ConnectorConfig.defaults());
    }

    public Connector(ConnectorConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.ownsGroup = config.eventLoopGroup().isEmpty();
        this.group = config.eventLoopGroup().orElseGet(() -> new NioEventLoopGroup(1));
    }

    public CompletableFuture<Connection> connect(String host, int port)
    {
        return connect(host, port, Connection::new);
    }

    public <C extends Connection> CompletableFuture<C> connect(String host, int port, ConnectionFactory<C> factory)
    {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(factory, "factory");

        SslContext ssl = config.sslContext().orElse(null);
        CompletableFuture<C> result = new CompletableFuture<>();

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        if (ssl == null) {
                            return;
                        }
                        ch.pipeline().addLast(ssl.newHandler(ch.alloc(), host, port));
                        ch.pipeline().addLast(new TlsHandshakeGate(
                                channel -> complete(channel, factory, result),
                                (channel, cause) -> result.completeExceptionally(
                                        new TransportException("TLS handshake with " + host + ":" + port + " failed", cause))));
                    }
                });

        bootstrap.connect(host, port).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                log.debug("Connect to {}:{} failed: {}", host, port, String.valueOf(f.cause()));
                result.completeExceptionally(
                        new TransportException("Connect to " + host + ":" + port + " failed", f.cause()));
                return;
            }
            if (ssl == null) {
                complete(f.channel(), factory, result);
            }
        });
        return result;
    }

    private <C extends Connection> void complete(Channel channel, ConnectionFactory<C> factory, CompletableFuture<C> result)
    {
        C connection;
        try {
            connection = factory.create(channel, null, config.connectionOptions());
        }
        catch (RuntimeException e) {
            channel.close();
            result.completeExceptionally(e);
            return;
        }
        log.debug("Connected {}", connection.tag());
        result.complete(connection);
    }

    @Override
    public void close()
    {
        if (ownsGroup) {
            group.shutdownGracefully();
        }
    }
}
