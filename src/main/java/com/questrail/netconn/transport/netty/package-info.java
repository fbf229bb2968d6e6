/**
 * Netty Transport Helpers
 * =============================================================================
 *
 * Pipeline pieces shared by {@code ServiceListener} and {@code Connector} that
 * sit between Netty's own handlers and a {@code Connection}.
 *
 * <p>Nothing in here interprets the byte stream. Handlers only decide
 * <em>when</em> a channel is handed to the connection layer.</p>
 */
package com.questrail.netconn.transport.netty;
