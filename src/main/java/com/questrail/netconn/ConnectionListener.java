package com.questrail.netconn;

/**
 * Observer of a connection's error and close notifications.
 *
 * <p>Callbacks run on the connection's event loop.</p>
 */
public interface ConnectionListener
{
    /**
     * The transport reported an error, or inbound data could not be decoded.
     * A close notification always follows.
     */
    default void onError(Connection connection, Throwable cause) {}

    /**
     * The transport is gone. Called once.
     */
    default void onClose(Connection connection) {}
}
