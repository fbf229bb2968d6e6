package com.questrail.netconn.error;

/**
 * An operation was attempted on, or was pending during the close of, a
 * connection whose transport is gone.
 */
public final class ConnectionClosedException extends ConnectionException
{
    public ConnectionClosedException(String message) {
        super(message);
    }
}
