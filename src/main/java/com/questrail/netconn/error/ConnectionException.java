package com.questrail.netconn.error;

/**
 * Root of the failures surfaced by connections and listeners.
 *
 * <p>All asynchronous operations complete their futures exceptionally with a
 * subtype of this class (possibly wrapped in a
 * {@link java.util.concurrent.CompletionException} by the caller's chain).</p>
 */
public class ConnectionException extends RuntimeException
{
    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
