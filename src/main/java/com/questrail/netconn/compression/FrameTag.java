package com.questrail.netconn.compression;

import com.questrail.netconn.error.DecompressionException;

/**
 * First byte of a compression frame.
 */
public enum FrameTag
{
    /** Payload is passed through unchanged. */
    RAW(0),

    /** Payload is a zlib (RFC 1950) deflate stream. */
    DEFLATED(1);

    private final int wireValue;

    FrameTag(int wireValue)
    {
        this.wireValue = wireValue;
    }

    public int wireValue()
    {
        return wireValue;
    }

    /**
     * @throws DecompressionException for a tag that is neither raw nor deflated
     */
    public static FrameTag fromWire(int value)
    {
        for (FrameTag tag : values()) {
            if (tag.wireValue == value) {
                return tag;
            }
        }
        throw new DecompressionException("Unknown frame tag " + value);
    }
}
