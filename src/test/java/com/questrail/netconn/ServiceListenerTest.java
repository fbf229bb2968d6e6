package com.questrail.netconn;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.netconn.config.ConnectionOptions;
import com.questrail.netconn.config.ConnectorConfig;
import com.questrail.netconn.config.ServiceListenerConfig;
import com.questrail.netconn.error.ConnectionClosedException;
import com.questrail.netconn.error.ConnectionEndedException;
import com.questrail.netconn.error.ListenerClosedException;
import com.questrail.netconn.error.TransportException;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ServiceListenerTest
 * -----------------------------------------------------------------------------
 * Listener and connector over real loopback sockets.
 *
 * Note: These tests use real time and the network stack. Waits are bounded
 * generously to avoid false failures on loaded machines.
 */
final class ServiceListenerTest
{
    private static final long WAIT_SECONDS = 5;
    private static final String HOST = "127.0.0.1";

    private EventLoopGroup group;
    private Connector connector;
    private final List<ServiceListener<?>> listeners = new ArrayList<>();

    @BeforeEach
    void setUp()
    {
        group = new NioEventLoopGroup(2);
        connector = new Connector(ConnectorConfig.builder().withEventLoopGroup(group).build());
    }

    @AfterEach
    void tearDown()
    {
        listeners.forEach(ServiceListener::close);
        connector.close();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private ServiceListenerConfig.Builder<Connection> config()
    {
        return ServiceListenerConfig.builder(0).withEventLoopGroup(group);
    }

    private ServiceListener<Connection> listen(ServiceListenerConfig.Builder<Connection> builder) throws Exception
    {
        ServiceListener<Connection> listener = new ServiceListener<>(builder.build());
        listeners.add(listener);
        listener.listen().get(WAIT_SECONDS, TimeUnit.SECONDS);
        return listener;
    }

    private Connection connect(ServiceListener<?> listener) throws Exception
    {
        return connector.connect(HOST, listener.port()).get(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception
    {
        return future.get(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    private static Throwable failureOf(CompletableFuture<?> future) throws Exception
    {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> future.get(WAIT_SECONDS, TimeUnit.SECONDS));
        Throwable cause = e.getCause();
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(WAIT_SECONDS);
        while (!condition.getAsBoolean()) {
            assertTrue(System.nanoTime() < deadline, "condition not met in time");
            Thread.sleep(10);
        }
    }

    // ---------------------------------------------------------------------
    // Binding
    // ---------------------------------------------------------------------

    @Test
    void ephemeralPortIsReportedAfterListen() throws Exception
    {
        ServiceListener<Connection> listener = new ServiceListener<>(config().build());
        listeners.add(listener);
        assertEquals(0, listener.port());

        await(listener.listen());

        assertTrue(listener.port() > 0);
        assertTrue(listener.isListening());
    }

    @Test
    void bindFailureRejectsListen() throws Exception
    {
        ServiceListener<Connection> first = listen(config());
        ServiceListener<Connection> second = new ServiceListener<>(
                ServiceListenerConfig.builder(first.port()).withEventLoopGroup(group).build());
        listeners.add(second);

        assertInstanceOf(TransportException.class, failureOf(second.listen()));
        assertTrue(first.isListening());
    }

    @Test
    void bindFailureRejectsPendingAccept() throws Exception
    {
        ServiceListener<Connection> first = listen(config());
        ServiceListener<Connection> second = new ServiceListener<>(
                ServiceListenerConfig.builder(first.port()).withEventLoopGroup(group).build());
        listeners.add(second);

        CompletableFuture<Connection> pending = second.accept();
        assertInstanceOf(TransportException.class, failureOf(second.listen()));

        assertInstanceOf(ListenerClosedException.class, failureOf(pending));
        assertTrue(second.isClosed());
        await(second.closeFuture());

        second.close();
        assertInstanceOf(ListenerClosedException.class, failureOf(second.accept()));
    }

    @Test
    void listenTwiceIsRejected() throws Exception
    {
        ServiceListener<Connection> listener = listen(config());
        assertInstanceOf(IllegalStateException.class, failureOf(listener.listen()));
    }

    @Test
    void closeRejectsPendingListen() throws Exception
    {
        EventLoopGroup busy = new NioEventLoopGroup(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            busy.execute(() -> {
                try {
                    release.await();
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            ServiceListener<Connection> listener = new ServiceListener<>(
                    ServiceListenerConfig.builder(0).withEventLoopGroup(busy).build());
            CompletableFuture<Void> listening = listener.listen();
            listener.close();

            ListenerClosedException e = assertInstanceOf(ListenerClosedException.class, failureOf(listening));
            assertEquals("Server closed", e.getMessage());
        }
        finally {
            release.countDown();
            busy.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    @Test
    void listenerOwningItsGroupStartsAndCloses() throws Exception
    {
        ServiceListener<Connection> listener = ServiceListener.create(0);
        await(listener.listen());
        assertTrue(listener.port() > 0);

        listener.close();
        await(listener.closeFuture());
        assertTrue(listener.isClosed());
        assertInstanceOf(ListenerClosedException.class, failureOf(listener.accept()));
    }

    // ---------------------------------------------------------------------
    // Accept and dispatch
    // ---------------------------------------------------------------------

    @Test
    void acceptWaitersAreServedInCallOrder() throws Exception
    {
        ServiceListener<Connection> listener = listen(config());
        CompletableFuture<Connection> firstAccept = listener.accept();
        CompletableFuture<Connection> secondAccept = listener.accept();

        Connection firstClient = connect(listener);
        Connection firstServer = await(firstAccept);
        assertEquals(firstClient.localAddress(), firstServer.remoteAddress());
        assertFalse(secondAccept.isDone());

        Connection secondClient = connect(listener);
        Connection secondServer = await(secondAccept);
        assertEquals(secondClient.localAddress(), secondServer.remoteAddress());
        assertSame(listener, firstServer.listener().orElseThrow());
    }

    @Test
    void unclaimedConnectionsQueueForLaterAccept() throws Exception
    {
        ServiceListener<Connection> listener = listen(config());
        Connection client = connect(listener);

        waitUntil(() -> listener.queuedConnections() == 1);

        CompletableFuture<Connection> accepted = listener.accept();
        assertTrue(accepted.isDone());
        assertEquals(client.localAddress(), accepted.join().remoteAddress());
        assertEquals(0, listener.queuedConnections());
    }

    @Test
    void closeRejectsPendingAcceptButKeepsQueue() throws Exception
    {
        ServiceListener<Connection> listener = listen(config());
        Connection client = connect(listener);
        waitUntil(() -> listener.queuedConnections() == 1);

        listener.close();

        Connection queued = await(listener.accept());
        assertEquals(client.localAddress(), queued.remoteAddress());
        assertInstanceOf(ListenerClosedException.class, failureOf(listener.accept()));
    }

    @Test
    void closeRejectsAllPendingAccepts() throws Exception
    {
        ServiceListener<Connection> listener = listen(config());
        CompletableFuture<Connection> a = listener.accept();
        CompletableFuture<Connection> b = listener.accept();

        listener.close();

        assertInstanceOf(ListenerClosedException.class, failureOf(a));
        assertInstanceOf(ListenerClosedException.class, failureOf(b));
        assertFalse(listener.isListening());
    }

    @Test
    void handlerTakesConnectionsNoAcceptIsWaitingFor() throws Exception
    {
        BlockingQueue<Connection> handled = new LinkedBlockingQueue<>();
        ServiceListener<Connection> listener = listen(config().withHandler(handled::add));

        CompletableFuture<Connection> accepted = listener.accept();
        Connection first = connect(listener);
        assertEquals(first.localAddress(), await(accepted).remoteAddress());

        Connection second = connect(listener);
        Connection viaHandler = handled.poll(WAIT_SECONDS, TimeUnit.SECONDS);
        assertNotNull(viaHandler);
        assertEquals(second.localAddress(), viaHandler.remoteAddress());
        assertTrue(handled.isEmpty());
        assertEquals(0, listener.queuedConnections());
    }

    // ---------------------------------------------------------------------
    // End to end
    // ---------------------------------------------------------------------

    @Test
    void requestResponseWithTypedValues() throws Exception
    {
        CompletableFuture<String> serverSaw = new CompletableFuture<>();
        ServiceListener<Connection> listener = listen(config().withHandler(conn ->
                conn.readInt()
                        .thenCompose(n -> conn.readString().thenApply(s -> n + ":" + s))
                        .thenCompose(seen -> {
                            serverSaw.complete(seen);
                            Map<String, Object> reply = new LinkedHashMap<>();
                            reply.put("a", 1);
                            reply.put("b", "test");
                            reply.put("c", List.of(1, 2, 3));
                            return conn.writeInt(2).thenCompose(v -> conn.writeJson(reply));
                        })));

        Connection client = connect(listener);
        await(client.writeInt(1).thenCompose(v -> client.writeString("teststring")));

        assertEquals(2, await(client.readInt()));
        JsonNode reply = await(client.readJson());
        assertEquals("1:teststring", await(serverSaw));
        assertEquals(1, reply.get("a").asInt());
        assertEquals("test", reply.get("b").asText());
        assertEquals(List.of(1, 2, 3), List.of(
                reply.get("c").get(0).asInt(), reply.get("c").get(1).asInt(), reply.get("c").get(2).asInt()));
        assertEquals(4 + 5 + 10, client.outBytes());
    }

    @Test
    void compressedEchoOfLargePayload() throws Exception
    {
        ConnectionOptions compressed = ConnectionOptions.builder().withCompression(true, true).build();
        ServiceListener<Connection> listener = listen(config()
                .withConnectionOptions(compressed)
                .withHandler(conn -> conn.readByteArray()
                        .thenCompose(conn::writeByteArray)
                        .thenCompose(v -> conn.flush())));

        try (Connector compressing = new Connector(ConnectorConfig.builder()
                .withEventLoopGroup(group)
                .withConnectionOptions(compressed)
                .build())) {
            Connection client = await(compressing.connect(HOST, listener.port()));

            byte[] payload = new byte[200_000];
            for (int i = 0; i < payload.length; i++) {
                payload[i] = (byte) (i % 97);
            }
            await(client.writeByteArray(payload).thenCompose(v -> client.flush()));

            assertArrayEquals(payload, await(client.readByteArray()));
        }
    }

    @Test
    void remoteEndRejectsPendingReadsOnBothSides() throws Exception
    {
        ServiceListener<Connection> listener = listen(config());
        CompletableFuture<Connection> accepted = listener.accept();
        Connection client = connect(listener);
        Connection server = await(accepted);

        CompletableFuture<byte[]> serverRead = server.readRaw(1);
        CompletableFuture<byte[]> clientRead = client.readRaw(1);
        await(client.end());

        assertInstanceOf(ConnectionEndedException.class, failureOf(serverRead));
        assertInstanceOf(ConnectionEndedException.class, failureOf(clientRead));
        await(server.closeFuture());
        await(client.closeFuture());
    }

    @Test
    void dataSentBeforeEndIsStillReadable() throws Exception
    {
        ServiceListener<Connection> listener = listen(config()
                .withConnectionOptions(ConnectionOptions.builder().withAllowHalfOpen(true).build()));
        CompletableFuture<Connection> accepted = listener.accept();
        Connection client = connect(listener);
        Connection server = await(accepted);

        await(client.writeString("last words").thenCompose(v -> client.end()));

        assertEquals("last words", await(server.readString()));
        assertInstanceOf(ConnectionEndedException.class, failureOf(server.readRaw(1)));

        // Half-open: the server can still answer before ending its own side.
        CompletableFuture<String> clientRead = client.readString();
        await(server.writeString("ack").thenCompose(v -> server.end()));
        assertEquals("ack", await(clientRead));
    }

    @Test
    void idleTimeoutDestroysConnection() throws Exception
    {
        ServiceListener<Connection> listener = listen(config()
                .withConnectionOptions(ConnectionOptions.builder()
                        .withIdleTimeout(Duration.ofMillis(100))
                        .build()));
        CompletableFuture<Connection> accepted = listener.accept();
        Connection client = connect(listener);
        Connection server = await(accepted);

        CompletableFuture<byte[]> serverRead = server.readRaw(1);

        await(server.closeFuture());
        ConnectionClosedException e = assertInstanceOf(ConnectionClosedException.class, failureOf(serverRead));
        assertTrue(e.getMessage().contains("idle"));
        assertSame(e, server.latchedError().orElseThrow());
        assertSame(e, failureOf(server.readRaw(1)));
        assertSame(e, failureOf(server.writeInt(1)));

        await(client.closeFuture());
        assertFalse(client.isOpen());
    }

    @Test
    void connectToClosedPortFails() throws Exception
    {
        ServiceListener<Connection> listener = listen(config());
        int port = listener.port();
        listener.close();
        await(listener.closeFuture());

        Throwable cause = failureOf(connector.connect(HOST, port));
        assertInstanceOf(TransportException.class, cause);
    }
}
