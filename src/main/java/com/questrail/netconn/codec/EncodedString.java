package com.questrail.netconn.codec;

import java.util.Objects;

/**
 * A string split into the two parts that go on the wire one after the other:
 * the header (null flag, plus the length prefix when present) and the UTF-8
 * body. A null string has an empty body.
 */
public record EncodedString(byte[] header, byte[] body)
{
    public EncodedString {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");
    }

    public boolean isNull()
    {
        return header.length == 1 && header[0] == WireCodec.NULL_FLAG;
    }
}
