package com.questrail.netconn.observability;

/**
 * Bytes moved through a connection.
 *
 * @param source    connection tag
 * @param direction inbound (read by the application) or outbound (written by it)
 * @param bytes     size of this read or write
 * @param total     cumulative count for the direction, including this one
 */
public record ConnectionTrafficEvent(
    String source,
    Direction direction,
    int bytes,
    long total
) {
    public enum Direction { IN, OUT }
}
