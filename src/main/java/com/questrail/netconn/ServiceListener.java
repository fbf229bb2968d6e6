package com.questrail.netconn;

import com.questrail.netconn.config.ServiceListenerConfig;
import com.questrail.netconn.error.ListenerClosedException;
import com.questrail.netconn.error.TransportException;
import com.questrail.netconn.internal.op.PendingOperation;
import com.questrail.netconn.observability.ConnectionErrorEvent;
import com.questrail.netconn.observability.ConnectionLifecycleEvent;
import com.questrail.netconn.observability.ConnectionObservabilitySink;
import com.questrail.netconn.transport.netty.TlsHandshakeGate;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.ssl.SslContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * ServiceListener
 * =============================================================================
 * Accepts inbound TCP (optionally TLS) connections and hands them out as
 * {@link Connection}s built by the configured {@link ConnectionFactory}.
 *
 * <h2>Dispatch</h2>
 * Every accepted connection goes to exactly one place, checked in order:
 * <ol>
 *   <li>the oldest pending {@link #accept()} caller;</li>
 *   <li>the configured {@link ConnectionHandler}, if any;</li>
 *   <li>the back of the waiting queue, for a later {@code accept()}.</li>
 * </ol>
 * With TLS, a connection is dispatched only after its handshake completes.
 *
 * <h2>Lifecycle</h2>
 * {@link #listen()} completes once the port is bound and fails if binding
 * fails. {@link #close()} stops accepting and fails any pending {@code listen()}
 * or {@code accept()} with {@link ListenerClosedException}. Connections already
 * queued are still handed out by later {@code accept()} calls.
 *
 * <p>A listener created without an external {@link EventLoopGroup} owns its
 * group and shuts it down once it is closed and its last connection is gone.</p>
 */
public final class ServiceListener<C extends Connection> implements AutoCloseable
{
    private final ServiceListenerConfig<C> config;
    private final Logger log;
    private final ConnectionObservabilitySink sink;
    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final ServerBootstrap bootstrap;

    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private volatile int port;

    // Guarded by this.
    private Channel serverChannel;
    private PendingOperation<Void> listenWaiter;
    private boolean listenCalled;
    private boolean closed;
    private boolean groupShutdown;
    private int liveConnections;
    private final Deque<PendingOperation<C>> acceptWaiters = new ArrayDeque<>();
    private final Deque<C> waitingList = new ArrayDeque<>();

    public ServiceListener(ServiceListenerConfig<C> config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.log = config.logger().orElseGet(() -> LoggerFactory.getLogger(ServiceListener.class));
        this.sink = config.connectionOptions().observabilitySink();
        this.port = config.port();

        this.ownsGroup = config.eventLoopGroup().isEmpty();
        this.group = config.eventLoopGroup().orElseGet(NioEventLoopGroup::new);

        this.bootstrap = new ServerBootstrap();
        bootstrap.group(group)
                .channel(NioServerSocketChannel.class)
                .handler(new ServerChannelHandler())
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        onChildChannel(ch);
                    }
                });
    }

    /**
     * Listener on {@code port} handing out plain {@link Connection}s.
     */
    public static ServiceListener<Connection> create(int port)
    {
        return new ServiceListener<>(ServiceListenerConfig.builder(port).build());
    }

    /**
     * Bind the configured port. Completes once bound; fails with
     * {@link TransportException} if the bind fails, or with
     * {@link ListenerClosedException} if the listener is closed first.
     */
    public CompletableFuture<Void> listen()
    {
        PendingOperation<Void> op;
        synchronized (this) {
            if (closed) {
                return CompletableFuture.failedFuture(new ListenerClosedException());
            }
            if (listenCalled) {
                return CompletableFuture.failedFuture(new IllegalStateException("listen() already called"));
            }
            listenCalled = true;
            op = new PendingOperation<>("listen");
            listenWaiter = op;
        }

        ChannelFuture bind = config.bindHost()
                .map(host -> bootstrap.bind(host, config.port()))
                .orElseGet(() -> bootstrap.bind(config.port()));
        bind.addListener((ChannelFutureListener) this::onBindComplete);
        return op.future();
    }

    /**
     * Next accepted connection: the oldest queued one if any, otherwise the next
     * one to arrive. Concurrent callers are served in call order.
     */
    public CompletableFuture<C> accept()
    {
        synchronized (this) {
            C queued = waitingList.poll();
            if (queued != null) {
                return CompletableFuture.completedFuture(queued);
            }
            if (closed) {
                return CompletableFuture.failedFuture(new ListenerClosedException());
            }
            PendingOperation<C> op = new PendingOperation<>("accept");
            acceptWaiters.add(op);
            op.onSettle(() -> {
                synchronized (ServiceListener.this) {
                    acceptWaiters.remove(op);
                }
            });
            return op.future();
        }
    }

    /**
     * Stop accepting. Idempotent. Live connections are not touched.
     */
    @Override
    public void close()
    {
        Channel ch;
        List<PendingOperation<?>> waiters;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            ch = serverChannel;
            waiters = drainWaiters();
        }

        log.info("Closing listener on port {}", port);
        if (ch != null) {
            ch.close();
        }
        else if (!listenCalled()) {
            closeFuture.complete(null);
        }
        rejectAll(waiters);
        sink.onLifecycle(ConnectionLifecycleEvent.of(source(), ConnectionLifecycleEvent.Kind.LISTENER_CLOSED, null));
        maybeShutdownGroup();
    }

    /**
     * Bound port. Before {@link #listen()} completes this is the configured
     * port, which is {@code 0} for an ephemeral bind.
     */
    public int port()
    {
        return port;
    }

    /**
     * Completes once the listening socket is released, or immediately on
     * {@link #close()} if {@link #listen()} was never called.
     */
    public CompletableFuture<Void> closeFuture()
    {
        return closeFuture;
    }

    private synchronized boolean listenCalled()
    {
        return listenCalled;
    }

    public synchronized boolean isListening()
    {
        return serverChannel != null && serverChannel.isActive() && !closed;
    }

    public synchronized boolean isClosed()
    {
        return closed;
    }

    /** Accepted connections waiting for an {@code accept()} call. */
    public synchronized int queuedConnections()
    {
        return waitingList.size();
    }

    public ServiceListenerConfig<C> config()
    {
        return config;
    }

    // ---------------------------------------------------------------------
    // Bind and close
    // ---------------------------------------------------------------------

    private void onBindComplete(ChannelFuture f)
    {
        if (!f.isSuccess()) {
            onListenerError(f.cause());
            onBindFailed();
            closeFuture.complete(null);
            return;
        }

        Channel ch = f.channel();
        ch.closeFuture().addListener((ChannelFutureListener) cf -> onServerChannelClosed());
        PendingOperation<Void> waiter;
        synchronized (this) {
            serverChannel = ch;
            if (closed) {
                ch.close();
                return;
            }
            port = ((InetSocketAddress) ch.localAddress()).getPort();
            waiter = listenWaiter;
            listenWaiter = null;
        }

        log.info("Listening on port {}", port);
        sink.onLifecycle(ConnectionLifecycleEvent.of(source(), ConnectionLifecycleEvent.Kind.LISTENER_BOUND,
                String.valueOf(ch.localAddress())));
        if (waiter != null) {
            waiter.resolve(null);
        }
    }

    /**
     * A listener-level error fails a pending {@code listen()} only. Accept
     * waiters keep waiting.
     */
    private void onListenerError(Throwable cause)
    {
        PendingOperation<Void> waiter;
        synchronized (this) {
            waiter = listenWaiter;
            listenWaiter = null;
        }
        String message = "Listener error on port " + config.port();
        log.error(message, cause);
        sink.onError(ConnectionErrorEvent.of(source(), message, cause));
        if (waiter != null) {
            waiter.reject(new TransportException(message, cause));
        }
    }

    private void onServerChannelClosed()
    {
        List<PendingOperation<?>> waiters;
        synchronized (this) {
            closed = true;
            waiters = drainWaiters();
        }
        rejectAll(waiters);
        maybeShutdownGroup();
        closeFuture.complete(null);
    }

    /**
     * A listener that never bound is closed: accept waiters are rejected here
     * since no server channel close will follow.
     */
    private void onBindFailed()
    {
        List<PendingOperation<?>> waiters;
        synchronized (this) {
            closed = true;
            waiters = drainWaiters();
        }
        rejectAll(waiters);
        maybeShutdownGroup();
    }

    private List<PendingOperation<?>> drainWaiters()
    {
        List<PendingOperation<?>> waiters = new ArrayList<>(acceptWaiters);
        acceptWaiters.clear();
        if (listenWaiter != null) {
            waiters.add(listenWaiter);
            listenWaiter = null;
        }
        return waiters;
    }

    private static void rejectAll(List<PendingOperation<?>> waiters)
    {
        for (PendingOperation<?> w : waiters) {
            w.reject(new ListenerClosedException());
        }
    }

    private void maybeShutdownGroup()
    {
        synchronized (this) {
            if (!ownsGroup || groupShutdown || !closed || liveConnections > 0) {
                return;
            }
            if (serverChannel != null && serverChannel.isOpen()) {
                return;
            }
            groupShutdown = true;
        }
        log.debug("Shutting down event loop group of listener on port {}", port);
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    // ---------------------------------------------------------------------
    // Connections
    // ---------------------------------------------------------------------

    private void onChildChannel(SocketChannel ch)
    {
        synchronized (this) {
            liveConnections++;
        }
        ch.closeFuture().addListener((ChannelFutureListener) f -> {
            synchronized (ServiceListener.this) {
                liveConnections--;
            }
            maybeShutdownGroup();
        });

        Optional<SslContext> ssl = config.sslContext();
        if (ssl.isPresent()) {
            ch.pipeline().addLast(ssl.get().newHandler(ch.alloc()));
            ch.pipeline().addLast(new TlsHandshakeGate(
                    this::onConnectionReady,
                    (channel, cause) -> log.warn("TLS handshake with {} failed: {}",
                            channel.remoteAddress(), String.valueOf(cause))));
        }
        else {
            onConnectionReady(ch);
        }
    }

    private void onConnectionReady(Channel ch)
    {
        C connection;
        try {
            connection = config.factory().create(ch, this, config.connectionOptions());
        }
        catch (RuntimeException e) {
            log.error("Connection factory failed for {}", ch.remoteAddress(), e);
            ch.close();
            return;
        }

        connection.addListener(new ConnectionListener() {
            @Override
            public void onError(Connection c, Throwable cause)
            {
                log.debug("{}: error {}", c.tag(), cause.getMessage());
            }
        });
        sink.onLifecycle(ConnectionLifecycleEvent.of(source(), ConnectionLifecycleEvent.Kind.CONNECTION_ACCEPTED,
                String.valueOf(ch.remoteAddress())));
        dispatch(connection);
    }

    private void dispatch(C connection)
    {
        Optional<ConnectionHandler<? super C>> handler = config.handler();
        while (true) {
            PendingOperation<C> waiter;
            synchronized (this) {
                waiter = acceptWaiters.poll();
                if (waiter == null && handler.isEmpty()) {
                    waitingList.add(connection);
                    return;
                }
            }
            if (waiter == null) {
                break;
            }
            if (waiter.resolve(connection)) {
                return;
            }
            // Waiter was settled concurrently; try the next one.
        }

        try {
            handler.get().handle(connection);
        }
        catch (RuntimeException e) {
            log.error("{}: connection handler failed", connection.tag(), e);
            connection.destroy();
        }
    }

    private String source()
    {
        return "ServiceListener_" + port;
    }

    /**
     * ServerChannelHandler
     * -------------------------------------------------------------------------
     * Surfaces errors raised on the listening channel itself.
     */
    private final class ServerChannelHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            onListenerError(cause);
            ctx.fireExceptionCaught(cause);
        }
    }
}
