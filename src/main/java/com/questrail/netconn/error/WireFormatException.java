package com.questrail.netconn.error;

/**
 * Bytes were received intact but do not form a valid value, e.g. a JSON string
 * that does not parse.
 */
public final class WireFormatException extends ConnectionException
{
    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
