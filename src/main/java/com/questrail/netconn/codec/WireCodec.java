package com.questrail.netconn.codec;

import com.questrail.netconn.error.ProtocolLimitException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * WireCodec
 * =============================================================================
 * Byte layouts for the primitive values exchanged over a connection.
 *
 * <p>All multi-byte numbers are big-endian:</p>
 * <pre>
 *   int32    4 bytes, two's complement
 *   byte     1 byte, signed
 *   bool     1 byte, nonzero = true
 *   float32  4 bytes, IEEE-754
 *   int64    8 bytes, two's complement
 *   string   null flag, then length prefix + UTF-8 ({@link StringFormat})
 *   byte[]   int32 length + raw bytes, never null
 * </pre>
 *
 * <p>This class is stateless. Reading a composite value off a stream is done
 * by {@code Connection}, which asks for the fixed-size pieces in order and
 * hands them to the {@code decode*} methods here.</p>
 */
public final class WireCodec
{
    public static final int INT_BYTES = 4;
    public static final int BYTE_BYTES = 1;
    public static final int BOOLEAN_BYTES = 1;
    public static final int FLOAT_BYTES = 4;
    public static final int LONG_BYTES = 8;

    static final byte NULL_FLAG = 1;
    static final byte PRESENT_FLAG = 0;

    /** Largest length a Java array can hold; longer strings or arrays cannot be decoded. */
    public static final int MAX_DECODABLE_LENGTH = Integer.MAX_VALUE - 8;

    private static final byte[] NULL_HEADER = { NULL_FLAG };
    private static final byte[] EMPTY = new byte[0];

    private WireCodec() {}

    // -------------------------------------------------------------------------
    // Fixed-size values
    // -------------------------------------------------------------------------

    public static byte[] encodeInt(int value)
    {
        return ByteBuffer.allocate(INT_BYTES).putInt(value).array();
    }

    public static int decodeInt(byte[] bytes)
    {
        requireLength(bytes, INT_BYTES);
        return ByteBuffer.wrap(bytes).getInt();
    }

    public static byte[] encodeByte(byte value)
    {
        return new byte[] { value };
    }

    public static byte decodeByte(byte[] bytes)
    {
        requireLength(bytes, BYTE_BYTES);
        return bytes[0];
    }

    public static byte[] encodeBoolean(boolean value)
    {
        return new byte[] { (byte) (value ? 1 : 0) };
    }

    public static boolean decodeBoolean(byte[] bytes)
    {
        requireLength(bytes, BOOLEAN_BYTES);
        return bytes[0] != 0;
    }

    public static byte[] encodeFloat(float value)
    {
        return ByteBuffer.allocate(FLOAT_BYTES).putFloat(value).array();
    }

    public static float decodeFloat(byte[] bytes)
    {
        requireLength(bytes, FLOAT_BYTES);
        return ByteBuffer.wrap(bytes).getFloat();
    }

    public static byte[] encodeLong(long value)
    {
        return ByteBuffer.allocate(LONG_BYTES).putLong(value).array();
    }

    public static long decodeLong(byte[] bytes)
    {
        requireLength(bytes, LONG_BYTES);
        return ByteBuffer.wrap(bytes).getLong();
    }

    // -------------------------------------------------------------------------
    // Strings
    // -------------------------------------------------------------------------

    /**
     * Encode a nullable string.
     *
     * @throws ProtocolLimitException if the UTF-8 length exceeds
     *         {@link StringFormat#maxLength()}; nothing has been written yet when
     *         this is thrown
     */
    public static EncodedString encodeString(String value, StringFormat format)
    {
        Objects.requireNonNull(format, "format");
        if (value == null) {
            return new EncodedString(NULL_HEADER.clone(), EMPTY);
        }

        byte[] body = value.getBytes(StandardCharsets.UTF_8);
        if (body.length > format.maxLength()) {
            throw new ProtocolLimitException("String", body.length, format.maxLength());
        }

        ByteBuffer header = ByteBuffer.allocate(1 + format.lengthBytes());
        header.put(PRESENT_FLAG);
        if (format == StringFormat.LEGACY) {
            header.putShort((short) body.length);
        }
        else {
            header.putInt((int) body.length);
        }
        return new EncodedString(header.array(), body);
    }

    /**
     * Concatenated wire form of {@link #encodeString(String, StringFormat)}.
     */
    public static byte[] encodeStringBytes(String value, StringFormat format)
    {
        EncodedString encoded = encodeString(value, format);
        byte[] out = new byte[encoded.header().length + encoded.body().length];
        System.arraycopy(encoded.header(), 0, out, 0, encoded.header().length);
        System.arraycopy(encoded.body(), 0, out, encoded.header().length, encoded.body().length);
        return out;
    }

    /**
     * Decode the null flag that starts every string.
     *
     * @return {@code true} if the string is null and nothing follows
     */
    public static boolean decodeNullFlag(byte[] bytes)
    {
        return decodeBoolean(bytes);
    }

    /**
     * Decode a string length prefix.
     *
     * <p>A legacy prefix is signed; a non-positive value means the empty string.
     * A current prefix is unsigned; values a Java array cannot hold are
     * rejected.</p>
     *
     * @return number of UTF-8 bytes that follow
     */
    public static int decodeStringLength(byte[] bytes, StringFormat format)
    {
        Objects.requireNonNull(format, "format");
        requireLength(bytes, format.lengthBytes());
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        if (format == StringFormat.LEGACY) {
            return Math.max(0, buf.getShort());
        }
        long length = Integer.toUnsignedLong(buf.getInt());
        if (length > MAX_DECODABLE_LENGTH) {
            throw new ProtocolLimitException("String", length, MAX_DECODABLE_LENGTH);
        }
        return (int) length;
    }

    public static String decodeUtf8(byte[] bytes)
    {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Decode a complete string from a byte array holding exactly one encoded
     * value.
     */
    public static String decodeString(byte[] bytes, StringFormat format)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length < 1) {
            throw new IllegalArgumentException("Missing null flag");
        }
        if (bytes[0] != 0) {
            return null;
        }
        int prefix = format.lengthBytes();
        if (bytes.length < 1 + prefix) {
            throw new IllegalArgumentException("Truncated string length prefix");
        }
        byte[] lengthBytes = new byte[prefix];
        System.arraycopy(bytes, 1, lengthBytes, 0, prefix);
        int length = decodeStringLength(lengthBytes, format);
        if (bytes.length - 1 - prefix < length) {
            throw new IllegalArgumentException("Truncated string: need " + length + " bytes");
        }
        return new String(bytes, 1 + prefix, length, StandardCharsets.UTF_8);
    }

    // -------------------------------------------------------------------------
    // Byte arrays
    // -------------------------------------------------------------------------

    /**
     * Length prefix of a byte array. The array itself follows unchanged.
     */
    public static byte[] encodeByteArrayLength(byte[] value)
    {
        Objects.requireNonNull(value, "byte arrays are never null on the wire");
        return encodeInt(value.length);
    }

    public static int decodeByteArrayLength(byte[] bytes)
    {
        int length = decodeInt(bytes);
        if (length < 0) {
            throw new ProtocolLimitException("Byte array", Integer.toUnsignedLong(length), MAX_DECODABLE_LENGTH);
        }
        return length;
    }

    private static void requireLength(byte[] bytes, int expected)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " bytes, got " + bytes.length);
        }
    }
}
