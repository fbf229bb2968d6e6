package com.questrail.netconn.error;

/**
 * The service listener was closed while a {@code listen()} or {@code accept()}
 * call was pending, or {@code accept()} was called after close with nothing
 * left to deliver.
 */
public final class ListenerClosedException extends ConnectionException
{
    public ListenerClosedException() {
        super("Server closed");
    }
}
