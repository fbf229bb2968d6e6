package com.questrail.netconn.error;

/**
 * A value does not fit the size limit of its wire format.
 *
 * <p>Thrown before any byte of the offending value is written.</p>
 */
public final class ProtocolLimitException extends ConnectionException
{
    private final long length;
    private final long limit;

    public ProtocolLimitException(String what, long length, long limit) {
        super(what + " length " + length + " exceeds limit " + limit);
        this.length = length;
        this.limit = limit;
    }

    public long length() {
        return length;
    }

    public long limit() {
        return limit;
    }
}
