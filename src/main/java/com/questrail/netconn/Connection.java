package com.questrail.netconn;

import com.questrail.netconn.codec.EncodedString;
import com.questrail.netconn.codec.JsonCodec;
import com.questrail.netconn.codec.StringFormat;
import com.questrail.netconn.codec.WireCodec;
import com.questrail.netconn.compression.CompressionFramer;
import com.questrail.netconn.config.ConnectionOptions;
import com.questrail.netconn.error.ConnectionClosedException;
import com.questrail.netconn.error.ConnectionEndedException;
import com.questrail.netconn.error.ConnectionException;
import com.questrail.netconn.error.ReadTimeoutException;
import com.questrail.netconn.error.TransportException;
import com.questrail.netconn.internal.op.PendingOperation;
import com.questrail.netconn.internal.time.MonotonicClock;
import com.questrail.netconn.internal.time.MonotonicScheduler;
import com.questrail.netconn.internal.time.ScheduledExecutorScheduler;
import com.questrail.netconn.observability.ConnectionErrorEvent;
import com.questrail.netconn.observability.ConnectionLifecycleEvent;
import com.questrail.netconn.observability.ConnectionObservabilitySink;
import com.questrail.netconn.observability.ConnectionTrafficEvent;
import com.fasterxml.jackson.databind.JsonNode;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoop;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.channel.socket.DuplexChannel;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Connection
 * =============================================================================
 * A bidirectional byte stream with awaitable reads and writes.
 *
 * <h2>Reads</h2>
 * Inbound bytes accumulate in a buffer owned by the connection. At most one read
 * is pending at a time; it completes as soon as the buffer can satisfy it.
 * {@link #readRaw(int)} completes with exactly the requested count, and
 * {@link #readRaw()} with whatever is buffered. A read that buffered data can
 * satisfy still succeeds after the remote has ended its side.
 *
 * <h2>Writes</h2>
 * {@link #writeRaw(byte[])} completes once the transport has flushed the bytes.
 * Typed writes are sequences of raw writes, each awaited before the next, so a
 * single typed value is never split by another write on the same connection.
 * Independent producers should go through {@link #writeQueue()}.
 *
 * <h2>Errors</h2>
 * The first transport error, decode failure, or idle expiry is latched. Every
 * later operation fails with that error. Without a latched error, operations on
 * a destroyed transport fail with {@link ConnectionClosedException}.
 *
 * <h2>Threading</h2>
 * All state is confined to the channel's event loop. Public methods may be
 * called from any thread; they hop onto the loop when needed, and every
 * returned future completes there.
 *
 * <h2>Subclassing</h2>
 * Protocol layers extend this class and are created through a
 * {@link ConnectionFactory}. The constructor installs the inbound handler, so a
 * connection is live as soon as it exists.
 */
public class Connection
{
    /** Pipeline name of the inbound handler installed by the constructor. */
    public static final String HANDLER_NAME = "netconn";

    private static final String IDLE_HANDLER_NAME = "netconn-idle";
    private static final int ANY = -1;

    private final Channel channel;
    private final EventLoop eventLoop;
    private final ServiceListener<?> listener;
    private final ConnectionOptions options;
    private final Logger log;
    private final String tag;
    private final ConnectionObservabilitySink sink;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WriteQueue writeQueue = new WriteQueue();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private final AtomicLong inBytes = new AtomicLong();
    private final AtomicLong outBytes = new AtomicLong();

    // Event loop confined.
    private final ByteBuf received = Unpooled.buffer();
    private final Set<PendingOperation<Void>> pendingWrites = new LinkedHashSet<>();
    private PendingRead pendingRead;
    private CompressionFramer framer;
    private boolean compressInbound;
    private boolean compressOutbound;
    private boolean inputShutdown;
    private boolean ended;
    private boolean outputEnded;
    private Duration idleTimeout = Duration.ZERO;

    private volatile Duration readTimeout;
    private volatile ConnectionException latchedError;
    private volatile boolean closed;

    /**
     * Wrap an established channel.
     *
     * @param channel  channel to own; it should have {@code ALLOW_HALF_CLOSURE}
     *                 enabled for {@link #end()} to leave the read side open
     * @param listener the listener that accepted the channel, or {@code null}
     * @param options  connection options
     */
    public Connection(Channel channel, ServiceListener<?> listener, ConnectionOptions options)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.options = Objects.requireNonNull(options, "options");
        this.listener = listener;
        this.eventLoop = channel.eventLoop();
        this.log = options.logger().orElseGet(() -> LoggerFactory.getLogger(getClass()));
        this.tag = getClass().getSimpleName() + "_" + channel.remoteAddress();
        this.sink = options.observabilitySink();
        this.clock = options.clock();
        this.scheduler = options.scheduler()
                .orElseGet(() -> new ScheduledExecutorScheduler(eventLoop, clock));
        this.readTimeout = options.readTimeout();

        channel.pipeline().addLast(HANDLER_NAME, new InboundHandler());
        if (!channel.isOpen()) {
            runOnLoop(this::onClosed);
        }

        if (!options.idleTimeout().isZero()) {
            setTimeout(options.idleTimeout());
        }
        if (options.compressInbound() || options.compressOutbound()) {
            setCompression(options.compressInbound(), options.compressOutbound());
        }

        sink.onLifecycle(ConnectionLifecycleEvent.of(tag, ConnectionLifecycleEvent.Kind.CONNECTION_OPENED,
                String.valueOf(channel.localAddress())));
    }

    // ---------------------------------------------------------------------
    // Raw I/O
    // ---------------------------------------------------------------------

    /**
     * Read exactly {@code n} bytes. {@code n == 0} completes immediately with an
     * empty array.
     */
    public CompletableFuture<byte[]> readRaw(int n)
    {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0");
        }
        return onLoop(() -> startRead(n));
    }

    /**
     * Read whatever is buffered, waiting for at least one byte.
     */
    public CompletableFuture<byte[]> readRaw()
    {
        return onLoop(() -> startRead(ANY));
    }

    public CompletableFuture<Void> writeRaw(byte[] data)
    {
        return writeRaw(data, false);
    }

    /**
     * Write {@code data}. With outbound compression enabled and
     * {@code uncompressed} set, the bytes bypass the deflate buffer and travel
     * as a raw frame, after anything already buffered.
     */
    public CompletableFuture<Void> writeRaw(byte[] data, boolean uncompressed)
    {
        Objects.requireNonNull(data, "data");
        return onLoop(() -> {
            ConnectionException blocked = writeBlocker();
            if (blocked != null) {
                return CompletableFuture.failedFuture(blocked);
            }
            long total = outBytes.addAndGet(data.length);
            sink.onTraffic(new ConnectionTrafficEvent(tag, ConnectionTrafficEvent.Direction.OUT, data.length, total));

            if (compressOutbound) {
                return framer.write(data, uncompressed);
            }
            return writeToTransport(Unpooled.wrappedBuffer(data));
        });
    }

    /**
     * Push out anything held in the outbound compression buffer.
     */
    public CompletableFuture<Void> flush()
    {
        return onLoop(() -> {
            if (!compressOutbound) {
                return CompletableFuture.completedFuture(null);
            }
            ConnectionException blocked = writeBlocker();
            if (blocked != null) {
                return CompletableFuture.failedFuture(blocked);
            }
            return framer.flush();
        });
    }

    /**
     * End the local side: flush, then half-close the output. The read side
     * stays open until the remote ends too.
     */
    public CompletableFuture<Void> end()
    {
        return onLoop(() -> {
            if (closed || outputEnded) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> flushed = compressOutbound && latchedError == null
                    ? framer.flush()
                    : CompletableFuture.completedFuture(null);
            return flushed.thenCompose(ignored -> shutdownOutput());
        });
    }

    /**
     * Tear the transport down immediately. Pending operations fail with
     * {@link ConnectionClosedException}.
     */
    public CompletableFuture<Void> destroy()
    {
        return destroy(null);
    }

    /**
     * Tear the transport down, latching {@code cause} when no error is latched
     * yet. Pending operations fail with the latched error.
     */
    public CompletableFuture<Void> destroy(ConnectionException cause)
    {
        runOnLoop(() -> {
            if (cause != null) {
                latch(cause);
            }
            channel.close();
        });
        return closeFuture;
    }

    // ---------------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------------

    /**
     * Destroy the connection after {@code timeout} without traffic in either
     * direction. {@link Duration#ZERO} disables.
     */
    public void setTimeout(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        runOnLoop(() -> {
            if (closed) {
                return;
            }
            ChannelPipeline p = channel.pipeline();
            if (p.get(IDLE_HANDLER_NAME) != null) {
                p.remove(IDLE_HANDLER_NAME);
            }
            idleTimeout = timeout;
            if (!timeout.isZero()) {
                p.addBefore(HANDLER_NAME, IDLE_HANDLER_NAME,
                        new IdleStateHandler(0, 0, timeout.toNanos(), TimeUnit.NANOSECONDS));
            }
        });
    }

    /**
     * Bound each read to {@code timeout}; {@link Duration#ZERO} disables. Applies
     * to reads started afterwards and to a pending read that has no bound yet.
     * Bytes already buffered stay buffered when a read times out.
     *
     * <p>Typed reads are made of several raw reads. If one times out after an
     * earlier part (a null flag or a length prefix) was consumed, the stream is
     * left at an undefined position and later typed reads will misparse.</p>
     */
    public void setReadTimeout(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        readTimeout = timeout;
        runOnLoop(() -> {
            PendingRead r = pendingRead;
            if (r != null && !r.timed && !timeout.isZero()) {
                armReadTimer(r, timeout);
            }
        });
    }

    /**
     * Enable the compression framer per direction. Enabling is permanent; a
     * {@code false} argument leaves that direction as it is. Bytes received but
     * not yet read when inbound compression is enabled are decoded as frames.
     */
    public void setCompression(boolean inbound, boolean outbound)
    {
        runOnLoop(() -> {
            if (closed) {
                return;
            }
            if ((inbound || outbound) && framer == null) {
                framer = new CompressionFramer(this::writeToTransport, options.maxInboundFrameLength(), log);
            }
            if (outbound) {
                compressOutbound = true;
            }
            if (inbound && !compressInbound) {
                compressInbound = true;
                if (received.isReadable()) {
                    ByteBuf leftover = received.readBytes(received.readableBytes());
                    received.clear();
                    try {
                        onData(leftover);
                    }
                    finally {
                        leftover.release();
                    }
                }
            }
        });
    }

    // ---------------------------------------------------------------------
    // Typed helpers
    // ---------------------------------------------------------------------

    public CompletableFuture<Integer> readInt()
    {
        return readRaw(WireCodec.INT_BYTES).thenApply(WireCodec::decodeInt);
    }

    public CompletableFuture<Void> writeInt(int value)
    {
        return writeRaw(WireCodec.encodeInt(value));
    }

    public CompletableFuture<Byte> readByte()
    {
        return readRaw(WireCodec.BYTE_BYTES).thenApply(WireCodec::decodeByte);
    }

    public CompletableFuture<Void> writeByte(byte value)
    {
        return writeRaw(WireCodec.encodeByte(value));
    }

    public CompletableFuture<Boolean> readBoolean()
    {
        return readRaw(WireCodec.BOOLEAN_BYTES).thenApply(WireCodec::decodeBoolean);
    }

    public CompletableFuture<Void> writeBoolean(boolean value)
    {
        return writeRaw(WireCodec.encodeBoolean(value));
    }

    public CompletableFuture<Float> readFloat()
    {
        return readRaw(WireCodec.FLOAT_BYTES).thenApply(WireCodec::decodeFloat);
    }

    public CompletableFuture<Void> writeFloat(float value)
    {
        return writeRaw(WireCodec.encodeFloat(value));
    }

    public CompletableFuture<Long> readLong()
    {
        return readRaw(WireCodec.LONG_BYTES).thenApply(WireCodec::decodeLong);
    }

    public CompletableFuture<Void> writeLong(long value)
    {
        return writeRaw(WireCodec.encodeLong(value));
    }

    /**
     * Read a string in the connection's default format. Completes with
     * {@code null} when the peer sent a null string.
     */
    public CompletableFuture<String> readString()
    {
        return readString(options.stringFormat());
    }

    public CompletableFuture<String> readString(StringFormat format)
    {
        Objects.requireNonNull(format, "format");
        return readRaw(1).thenApply(WireCodec::decodeNullFlag).thenCompose(isNull -> {
            if (isNull) {
                return CompletableFuture.completedFuture(null);
            }
            return readRaw(format.lengthBytes()).thenCompose(lengthBytes -> {
                int length = WireCodec.decodeStringLength(lengthBytes, format);
                return readRaw(length).thenApply(WireCodec::decodeUtf8);
            });
        });
    }

    public CompletableFuture<Void> writeString(String value)
    {
        return writeString(value, options.stringFormat());
    }

    public CompletableFuture<Void> writeString(String value, StringFormat format)
    {
        Objects.requireNonNull(format, "format");
        EncodedString encoded;
        try {
            encoded = WireCodec.encodeString(value, format);
        }
        catch (ConnectionException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Void> header = writeRaw(encoded.header());
        if (encoded.body().length == 0) {
            return header;
        }
        return header.thenCompose(ignored -> writeRaw(encoded.body()));
    }

    public CompletableFuture<byte[]> readByteArray()
    {
        return readRaw(WireCodec.INT_BYTES).thenCompose(lengthBytes ->
                readRaw(WireCodec.decodeByteArrayLength(lengthBytes)));
    }

    public CompletableFuture<Void> writeByteArray(byte[] value)
    {
        byte[] length = WireCodec.encodeByteArrayLength(value);
        CompletableFuture<Void> header = writeRaw(length);
        if (value.length == 0) {
            return header;
        }
        return header.thenCompose(ignored -> writeRaw(value));
    }

    /**
     * Read a JSON document carried as a string. A null string, or the text
     * {@code null}, reads as {@code null}.
     */
    public CompletableFuture<JsonNode> readJson()
    {
        JsonCodec json = options.jsonCodec();
        return readString().thenApply(json::parse);
    }

    public <T> CompletableFuture<T> readJson(Class<T> type)
    {
        Objects.requireNonNull(type, "type");
        JsonCodec json = options.jsonCodec();
        return readString().thenApply(text -> json.parse(text, type));
    }

    /**
     * Write {@code value} as JSON text. {@code null} is sent as a null string.
     */
    public CompletableFuture<Void> writeJson(Object value)
    {
        String text;
        try {
            text = options.jsonCodec().toText(value);
        }
        catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return writeString(text);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public void addListener(ConnectionListener l)
    {
        listeners.add(Objects.requireNonNull(l, "listener"));
    }

    public void removeListener(ConnectionListener l)
    {
        listeners.remove(l);
    }

    public WriteQueue writeQueue()
    {
        return writeQueue;
    }

    /** Bytes delivered to readers so far. */
    public long inBytes()
    {
        return inBytes.get();
    }

    /** Bytes accepted from writers so far, before compression. */
    public long outBytes()
    {
        return outBytes.get();
    }

    public Optional<ConnectionException> latchedError()
    {
        return Optional.ofNullable(latchedError);
    }

    public boolean isOpen()
    {
        return !closed;
    }

    /** Completes once the transport is gone. */
    public CompletableFuture<Void> closeFuture()
    {
        return closeFuture;
    }

    public Optional<ServiceListener<?>> listener()
    {
        return Optional.ofNullable(listener);
    }

    public ConnectionOptions options()
    {
        return options;
    }

    public Duration idleTimeout()
    {
        return idleTimeout;
    }

    public Duration readTimeout()
    {
        return readTimeout;
    }

    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    public SocketAddress localAddress()
    {
        return channel.localAddress();
    }

    protected Channel channel()
    {
        return channel;
    }

    protected Logger log()
    {
        return log;
    }

    public String tag()
    {
        return tag;
    }

    @Override
    public String toString()
    {
        return tag;
    }

    // ---------------------------------------------------------------------
    // Read machinery
    // ---------------------------------------------------------------------

    private CompletableFuture<byte[]> startRead(int requested)
    {
        if (latchedError != null) {
            return CompletableFuture.failedFuture(latchedError);
        }
        if (closed) {
            return CompletableFuture.failedFuture(new ConnectionClosedException("Connection destroyed"));
        }
        if (pendingRead != null) {
            return CompletableFuture.failedFuture(new IllegalStateException("A read is already pending on " + tag));
        }
        if (requested == 0) {
            return CompletableFuture.completedFuture(new byte[0]);
        }
        if (available(requested)) {
            byte[] data = take(requested);
            checkEnded();
            return CompletableFuture.completedFuture(data);
        }
        if (inputShutdown) {
            return CompletableFuture.failedFuture(new ConnectionEndedException("Connection ended"));
        }

        PendingOperation<byte[]> op = new PendingOperation<>("read");
        PendingRead r = new PendingRead(op, requested);
        pendingRead = r;
        op.onSettle(() -> {
            if (pendingRead == r) {
                pendingRead = null;
            }
        });

        Duration timeout = readTimeout;
        if (!timeout.isZero()) {
            armReadTimer(r, timeout);
        }
        return op.future();
    }

    private void armReadTimer(PendingRead r, Duration timeout)
    {
        r.timed = true;
        r.op.armTimer(scheduler.scheduleAfter(timeout, clock,
                () -> runOnLoop(() -> {
                    if (r.op.timeOut(new ReadTimeoutException(timeout))) {
                        log.debug("{}: read of {} timed out after {}", tag, describe(r.requested), timeout);
                    }
                })));
    }

    private void serviceRead()
    {
        PendingRead r = pendingRead;
        if (r == null || !r.op.isWaiting()) {
            return;
        }
        if (available(r.requested)) {
            r.op.resolve(take(r.requested));
        }
    }

    private boolean available(int requested)
    {
        ByteBuf buf = received;
        return requested == ANY ? buf.isReadable() : buf.readableBytes() >= requested;
    }

    private byte[] take(int requested)
    {
        ByteBuf buf = received;
        int n = requested == ANY ? buf.readableBytes() : requested;
        byte[] out = new byte[n];
        buf.readBytes(out);
        buf.discardSomeReadBytes();

        long total = inBytes.addAndGet(n);
        sink.onTraffic(new ConnectionTrafficEvent(tag, ConnectionTrafficEvent.Direction.IN, n, total));
        return out;
    }

    private void onData(ByteBuf buf)
    {
        if (closed) {
            return;
        }
        if (compressInbound) {
            try {
                framer.decode(buf, received::writeBytes);
            }
            catch (ConnectionException e) {
                fail(e);
                return;
            }
        }
        else {
            received.writeBytes(buf);
        }
        serviceRead();
        checkEnded();
    }

    /**
     * The remote has ended once its FIN arrived and everything it sent has
     * been read.
     */
    private void checkEnded()
    {
        if (ended || !inputShutdown || closed) {
            return;
        }
        if (received.isReadable() || (framer != null && framer.isMidFrame())) {
            return;
        }
        ended = true;
        log.debug("{}: remote ended", tag);
        sink.onLifecycle(ConnectionLifecycleEvent.of(tag, ConnectionLifecycleEvent.Kind.CONNECTION_ENDED, null));

        PendingRead r = pendingRead;
        if (r != null) {
            r.op.reject(new ConnectionEndedException("Connection ended"));
        }

        if (outputEnded) {
            channel.close();
        }
        else if (!options.allowHalfOpen()) {
            end();
        }
    }

    private void onInputShutdown()
    {
        if (inputShutdown) {
            return;
        }
        inputShutdown = true;
        for (PendingOperation<Void> w : new ArrayList<>(pendingWrites)) {
            w.reject(new ConnectionEndedException("Connection ended"));
        }
        PendingRead r = pendingRead;
        if (r != null && !available(r.requested)) {
            r.op.reject(new ConnectionEndedException("Connection ended"));
        }
        checkEnded();
    }

    // ---------------------------------------------------------------------
    // Write machinery
    // ---------------------------------------------------------------------

    private CompletableFuture<Void> writeToTransport(ByteBuf buf)
    {
        ConnectionException blocked = writeBlocker();
        if (blocked != null) {
            buf.release();
            return CompletableFuture.failedFuture(blocked);
        }

        PendingOperation<Void> op = new PendingOperation<>("write");
        pendingWrites.add(op);
        op.onSettle(() -> pendingWrites.remove(op));

        channel.writeAndFlush(buf).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                op.resolve(null);
            }
            else {
                op.reject(writeFailure(f.cause()));
            }
        });
        return op.future();
    }

    private ConnectionException writeBlocker()
    {
        if (latchedError != null) {
            return latchedError;
        }
        if (closed) {
            return new ConnectionClosedException("Connection destroyed");
        }
        if (outputEnded) {
            return new ConnectionEndedException("Write after end");
        }
        return null;
    }

    private ConnectionException writeFailure(Throwable cause)
    {
        if (latchedError != null) {
            return latchedError;
        }
        if (closed || !channel.isActive()) {
            return new ConnectionClosedException("Connection closed");
        }
        return new TransportException("Write failed on " + tag, cause);
    }

    private CompletableFuture<Void> shutdownOutput()
    {
        if (closed || outputEnded) {
            return CompletableFuture.completedFuture(null);
        }
        outputEnded = true;

        CompletableFuture<Void> done = new CompletableFuture<>();
        // An empty write completes only after every earlier write.
        channel.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener((ChannelFutureListener) written -> {
            if (channel instanceof DuplexChannel duplex && channel.isActive()) {
                duplex.shutdownOutput().addListener((ChannelFutureListener) f -> {
                    if (!f.isSuccess() && channel.isActive()) {
                        done.completeExceptionally(writeFailure(f.cause()));
                        return;
                    }
                    log.debug("{}: local side ended", tag);
                    if (ended) {
                        channel.close();
                    }
                    done.complete(null);
                });
            }
            else {
                channel.close().addListener(f -> done.complete(null));
            }
        });
        return done;
    }

    // ---------------------------------------------------------------------
    // Failure and close
    // ---------------------------------------------------------------------

    private void latch(ConnectionException error)
    {
        if (latchedError == null) {
            latchedError = error;
        }
    }

    /**
     * Latch {@code error}, fail everything pending, and destroy the transport.
     */
    private void fail(ConnectionException error)
    {
        latch(error);
        log.warn("{}: {}", tag, error.getMessage());
        sink.onError(ConnectionErrorEvent.of(tag, error.getMessage(), error));
        for (ConnectionListener l : listeners) {
            l.onError(this, error);
        }
        rejectPending(latchedError);
        channel.close();
    }

    private void rejectPending(ConnectionException cause)
    {
        PendingRead r = pendingRead;
        if (r != null) {
            r.op.reject(cause);
        }
        for (PendingOperation<Void> w : new ArrayList<>(pendingWrites)) {
            w.reject(cause);
        }
    }

    private void onClosed()
    {
        if (closed) {
            return;
        }
        closed = true;

        ConnectionException cause = latchedError != null
                ? latchedError
                : new ConnectionClosedException("Connection closed");
        rejectPending(cause);

        received.release();
        if (framer != null) {
            framer.release();
        }

        log.debug("{}: closed (in={} out={})", tag, inBytes.get(), outBytes.get());
        sink.onLifecycle(ConnectionLifecycleEvent.of(tag, ConnectionLifecycleEvent.Kind.CONNECTION_CLOSED, null));
        for (ConnectionListener l : listeners) {
            l.onClose(this);
        }
        closeFuture.complete(null);
    }

    // ---------------------------------------------------------------------
    // Event loop plumbing
    // ---------------------------------------------------------------------

    private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> action)
    {
        if (eventLoop.inEventLoop()) {
            return invoke(action);
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            eventLoop.execute(() -> invoke(action).whenComplete((value, failure) -> {
                if (failure != null) {
                    result.completeExceptionally(failure);
                }
                else {
                    result.complete(value);
                }
            }));
        }
        catch (RejectedExecutionException e) {
            result.completeExceptionally(new ConnectionClosedException("Event loop has shut down"));
        }
        return result;
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> action)
    {
        try {
            return action.get();
        }
        catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void runOnLoop(Runnable task)
    {
        if (eventLoop.inEventLoop()) {
            task.run();
            return;
        }
        try {
            eventLoop.execute(task);
        }
        catch (RejectedExecutionException e) {
            log.debug("{}: event loop has shut down, dropping task", tag);
        }
    }

    private static String describe(int requested)
    {
        return requested == ANY ? "any bytes" : requested + " bytes";
    }

    private static final class PendingRead
    {
        final PendingOperation<byte[]> op;
        final int requested;
        boolean timed;

        PendingRead(PendingOperation<byte[]> op, int requested)
        {
            this.op = op;
            this.requested = requested;
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Feeds channel events into the connection. Buffers are copied into the
     * connection's own buffer and released here.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            onData(msg);
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt)
        {
            if (evt instanceof ChannelInputShutdownEvent) {
                onInputShutdown();
            }
            else if (evt instanceof IdleStateEvent) {
                log.info("{}: idle for {}, destroying", tag, idleTimeout);
                latch(new ConnectionClosedException("Connection destroyed: idle timeout of "
                        + idleTimeout.toMillis() + "ms"));
                ctx.close();
            }
            else {
                ctx.fireUserEventTriggered(evt);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            onClosed();
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof ConnectionException ce) {
                fail(ce);
            }
            else {
                fail(new TransportException("Transport error on " + tag, cause));
            }
        }
    }
}
