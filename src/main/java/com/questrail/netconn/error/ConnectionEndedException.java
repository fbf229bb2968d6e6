package com.questrail.netconn.error;

/**
 * The remote peer half-closed its side before the operation could complete.
 */
public final class ConnectionEndedException extends ConnectionException
{
    public ConnectionEndedException(String message) {
        super(message);
    }
}
