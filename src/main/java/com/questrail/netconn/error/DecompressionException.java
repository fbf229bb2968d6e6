package com.questrail.netconn.error;

/**
 * An inbound compression frame was malformed. Always fatal for the connection.
 */
public final class DecompressionException extends ConnectionException
{
    public DecompressionException(String message) {
        super(message);
    }

    public DecompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
