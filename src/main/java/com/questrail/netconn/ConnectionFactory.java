package com.questrail.netconn;

import com.questrail.netconn.config.ConnectionOptions;
import io.netty.channel.Channel;

/**
 * Builds the connection object for a freshly established channel.
 *
 * <p>Construction must only wire state. Behaviour that should start for every
 * accepted connection belongs in a {@link ConnectionHandler} registered on the
 * listener, which runs after construction.</p>
 *
 * @param <C> connection type produced
 */
@FunctionalInterface
public interface ConnectionFactory<C extends Connection>
{
    /**
     * @param channel  the established channel; the connection takes ownership
     * @param listener the accepting listener, or {@code null} for outbound
     *                 connections made by a {@link Connector}
     * @param options  options bag, forwarded unopened
     */
    C create(Channel channel, ServiceListener<C> listener, ConnectionOptions options);
}
