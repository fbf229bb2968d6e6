package com.questrail.netconn.compression;

import com.questrail.netconn.error.ProtocolLimitException;
import io.netty.buffer.ByteBuf;

import java.util.function.BiConsumer;

/**
 * FrameDecoder
 * -----------------------------------------------------------------------------
 * Incremental parser for inbound compression frames:
 *
 * <pre>
 *   +-----+----------------+-------------------+
 *   | tag | length (u32 BE)| payload (length)  |
 *   +-----+----------------+-------------------+
 * </pre>
 *
 * <p>Input arrives in whatever pieces the transport delivers. Header bytes and
 * payload bytes consumed so far are kept across calls, so a frame split over
 * several reads resumes where it stopped instead of starting over.</p>
 *
 * <p>Not thread-safe; driven from the owning connection's event loop.</p>
 */
final class FrameDecoder
{
    static final int HEADER_BYTES = 5;

    private enum Phase { HEADER, PAYLOAD }

    private final int maxFrameLength;

    private final byte[] header = new byte[HEADER_BYTES];
    private int headerFill;

    private Phase phase = Phase.HEADER;
    private FrameTag tag;
    private byte[] payload;
    private int payloadFill;

    FrameDecoder(int maxFrameLength)
    {
        this.maxFrameLength = maxFrameLength;
    }

    /**
     * Consume every readable byte of {@code in}, reporting each completed frame
     * to {@code frameSink} in arrival order.
     *
     * @throws com.questrail.netconn.error.DecompressionException on an unknown tag
     * @throws ProtocolLimitException if a frame is longer than the configured limit
     */
    void decode(ByteBuf in, BiConsumer<FrameTag, byte[]> frameSink)
    {
        while (in.isReadable()) {
            if (phase == Phase.HEADER) {
                int n = Math.min(HEADER_BYTES - headerFill, in.readableBytes());
                in.readBytes(header, headerFill, n);
                headerFill += n;
                if (headerFill < HEADER_BYTES) {
                    return;
                }
                startPayload();
            }

            if (phase == Phase.PAYLOAD) {
                int n = Math.min(payload.length - payloadFill, in.readableBytes());
                in.readBytes(payload, payloadFill, n);
                payloadFill += n;
                if (payloadFill < payload.length) {
                    return;
                }
                completeFrame(frameSink);
            }
        }
    }

    /**
     * @return true if part of a frame has been consumed but not yet delivered
     */
    boolean isMidFrame()
    {
        return phase == Phase.PAYLOAD || headerFill > 0;
    }

    private void startPayload()
    {
        tag = FrameTag.fromWire(header[0] & 0xFF);
        long length = ((long) (header[1] & 0xFF) << 24)
                | ((header[2] & 0xFF) << 16)
                | ((header[3] & 0xFF) << 8)
                | (header[4] & 0xFF);
        if (length > maxFrameLength) {
            throw new ProtocolLimitException("Frame", length, maxFrameLength);
        }
        payload = new byte[(int) length];
        payloadFill = 0;
        headerFill = 0;
        phase = Phase.PAYLOAD;
    }

    private void completeFrame(BiConsumer<FrameTag, byte[]> frameSink)
    {
        FrameTag completedTag = tag;
        byte[] completed = payload;
        tag = null;
        payload = null;
        payloadFill = 0;
        phase = Phase.HEADER;
        frameSink.accept(completedTag, completed);
    }
}
