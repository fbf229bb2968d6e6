package com.questrail.netconn.compression;

import com.questrail.netconn.error.DecompressionException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.slf4j.Logger;

import java.io.ByteArrayOutputStream;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * CompressionFramer
 * =============================================================================
 * Length-prefixed, optionally deflated framing for one connection, in both
 * directions.
 *
 * <h2>Outbound</h2>
 * Ordinary writes are appended to a {@value #BUFFER_CAPACITY}-byte coalescing
 * buffer. When an append would overflow it, the buffer is first deflated and
 * sent as one tag-1 frame. Writes larger than the capacity are cut into
 * capacity-sized chunks, each deflated and framed on its own. A write marked
 * uncompressed first sends whatever is buffered, then goes out as a tag-0
 * frame without buffering. {@link #flush()} sends a non-empty buffer.
 *
 * <p>Buffered writes complete as soon as the bytes are copied; only writes that
 * cause a frame to be sent wait for the transport.</p>
 *
 * <h2>Inbound</h2>
 * Bytes from the transport go through a {@link FrameDecoder}. Tag-1 payloads
 * are inflated, tag-0 payloads passed through. Any malformed frame raises
 * {@link DecompressionException}; the owning connection treats that as fatal.
 *
 * <h2>Threading</h2>
 * All methods must be called from the owning connection's event loop.
 */
public final class CompressionFramer
{
    public static final int BUFFER_CAPACITY = 64000;

    /**
     * Destination for complete outbound frames. The returned future completes
     * when the transport has flushed the frame.
     */
    @FunctionalInterface
    public interface FrameSink
    {
        CompletableFuture<Void> writeFrame(ByteBuf frame);
    }

    private static final int ZLIB_CHUNK = 16 * 1024;

    private final FrameSink sink;
    private final Logger log;
    private final FrameDecoder decoder;

    private final Deflater deflater = new Deflater();
    private final Inflater inflater = new Inflater();

    private byte[] buffer;
    private int bufferPos;

    public CompressionFramer(FrameSink sink, int maxInboundFrameLength, Logger log)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.log = Objects.requireNonNull(log, "log");
        this.decoder = new FrameDecoder(maxInboundFrameLength);
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Queue {@code data} for sending.
     *
     * @param uncompressed send as a raw frame, after flushing buffered data
     */
    public CompletableFuture<Void> write(byte[] data, boolean uncompressed)
    {
        Objects.requireNonNull(data, "data");
        // Frames are handed to the sink synchronously so that transport order
        // matches call order.
        if (uncompressed) {
            CompletableFuture<Void> flushed = flush();
            return CompletableFuture.allOf(flushed, sendFrame(FrameTag.RAW, data));
        }

        CompletableFuture<Void> flushed = bufferPos + data.length > BUFFER_CAPACITY
                ? flush()
                : CompletableFuture.completedFuture(null);

        if (data.length <= BUFFER_CAPACITY) {
            append(data);
            return flushed;
        }
        log.debug("Splitting {} byte write into {} byte frames", data.length, BUFFER_CAPACITY);
        CompletableFuture<Void> sent = flushed;
        for (int offset = 0; offset < data.length; offset += BUFFER_CAPACITY) {
            int len = Math.min(BUFFER_CAPACITY, data.length - offset);
            sent = CompletableFuture.allOf(sent, sendFrame(FrameTag.DEFLATED, deflate(data, offset, len)));
        }
        return sent;
    }

    /**
     * Deflate and send the buffered bytes, if any.
     */
    public CompletableFuture<Void> flush()
    {
        if (bufferPos == 0) {
            return CompletableFuture.completedFuture(null);
        }
        byte[] deflated = deflate(buffer, 0, bufferPos);
        log.debug("Flushing {} buffered bytes as {} deflated bytes", bufferPos, deflated.length);
        bufferPos = 0;
        return sendFrame(FrameTag.DEFLATED, deflated);
    }

    /** Bytes buffered and not yet sent. */
    public int pendingOutboundBytes()
    {
        return bufferPos;
    }

    private void append(byte[] data)
    {
        if (buffer == null) {
            buffer = new byte[BUFFER_CAPACITY];
        }
        System.arraycopy(data, 0, buffer, bufferPos, data.length);
        bufferPos += data.length;
    }

    private CompletableFuture<Void> sendFrame(FrameTag tag, byte[] payload)
    {
        ByteBuf header = Unpooled.buffer(FrameDecoder.HEADER_BYTES, FrameDecoder.HEADER_BYTES);
        header.writeByte(tag.wireValue());
        header.writeInt(payload.length);
        return sink.writeFrame(Unpooled.wrappedBuffer(header, Unpooled.wrappedBuffer(payload)));
    }

    private byte[] deflate(byte[] src, int offset, int length)
    {
        deflater.reset();
        deflater.setInput(src, offset, length);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, length / 2));
        byte[] chunk = new byte[Math.max(64, Math.min(length, ZLIB_CHUNK))];
        while (!deflater.finished()) {
            int n = deflater.deflate(chunk);
            out.write(chunk, 0, n);
        }
        return out.toByteArray();
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Consume transport bytes and deliver decoded payloads to {@code out} in
     * frame order. Incomplete frames are kept for the next call.
     *
     * @throws DecompressionException if a frame cannot be decoded
     * @throws com.questrail.netconn.error.ProtocolLimitException if a frame exceeds the inbound limit
     */
    public void decode(ByteBuf in, Consumer<byte[]> out)
    {
        decoder.decode(in, (tag, payload) -> {
            if (tag == FrameTag.DEFLATED) {
                byte[] inflated = inflate(payload);
                log.debug("Inflated {} bytes to {} bytes", payload.length, inflated.length);
                out.accept(inflated);
            }
            else {
                out.accept(payload);
            }
        });
    }

    /** True while a partially received frame is held. */
    public boolean isMidFrame()
    {
        return decoder.isMidFrame();
    }

    private byte[] inflate(byte[] payload)
    {
        inflater.reset();
        inflater.setInput(payload);
        ByteArrayOutputStream out = new ByteArrayOutputStream(payload.length * 2);
        byte[] chunk = new byte[ZLIB_CHUNK];
        try {
            while (!inflater.finished()) {
                int n = inflater.inflate(chunk);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DecompressionException("Truncated or unsupported deflate frame of " + payload.length + " bytes");
                }
                out.write(chunk, 0, n);
            }
        }
        catch (DataFormatException e) {
            throw new DecompressionException("Malformed deflate frame: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    /**
     * Free the native zlib state. The framer must not be used afterwards.
     */
    public void release()
    {
        deflater.end();
        inflater.end();
        buffer = null;
        bufferPos = 0;
    }
}
