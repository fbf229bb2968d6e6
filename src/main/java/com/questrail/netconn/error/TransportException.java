package com.questrail.netconn.error;

/**
 * The underlying stream reported an error.
 *
 * <p>A connection latches the first transport error it observes; every later
 * operation fails with that same instance.</p>
 */
public final class TransportException extends ConnectionException
{
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
