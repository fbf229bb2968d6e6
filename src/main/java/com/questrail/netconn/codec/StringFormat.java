package com.questrail.netconn.codec;

/**
 * Wire layouts for nullable strings.
 *
 * <p>Both layouts start with a one-byte null flag ({@code 1} = null). A present
 * string follows with a length prefix and its UTF-8 bytes. The two formats are
 * not self-describing: peers agree on one out of band and there is no
 * auto-detection.</p>
 */
public enum StringFormat
{
    /** 4-byte unsigned big-endian length, up to 2^32-1 bytes. */
    CURRENT(4, 0xFFFF_FFFFL),

    /** 2-byte signed big-endian length, up to 32767 bytes. */
    LEGACY(2, Short.MAX_VALUE);

    private final int lengthBytes;
    private final long maxLength;

    StringFormat(int lengthBytes, long maxLength)
    {
        this.lengthBytes = lengthBytes;
        this.maxLength = maxLength;
    }

    /** Width of the length prefix in bytes. */
    public int lengthBytes()
    {
        return lengthBytes;
    }

    /** Largest UTF-8 byte length this format can carry. */
    public long maxLength()
    {
        return maxLength;
    }
}
