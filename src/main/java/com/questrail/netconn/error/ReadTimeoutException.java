package com.questrail.netconn.error;

import java.time.Duration;

/**
 * A pending read did not complete within the connection's read timeout.
 *
 * <p>Unlike the idle timeout, this failure affects only the read that timed
 * out. The connection remains usable.</p>
 */
public final class ReadTimeoutException extends ConnectionException
{
    private final Duration timeout;

    public ReadTimeoutException(Duration timeout) {
        super("Read timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
