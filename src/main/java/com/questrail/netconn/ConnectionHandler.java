package com.questrail.netconn;

/**
 * Per-connection processing started by a {@link ServiceListener} for accepted
 * connections that no {@code accept()} caller is waiting for.
 *
 * <p>Called on the connection's event loop. Implementations should start their
 * work by chaining on the connection's futures and return promptly; blocking
 * here stalls every connection sharing the loop.</p>
 */
@FunctionalInterface
public interface ConnectionHandler<C extends Connection>
{
    void handle(C connection);
}
