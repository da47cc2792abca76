package com.questrail.cot.transport;

import com.questrail.cot.CotClientException;

/**
 * Reading from or writing to an open channel failed, or the peer closed it.
 *
 * <p>Fatal for the worker that hits it. Nothing in this library reconnects.</p>
 */
public final class ChannelIOException extends CotClientException
{
    public ChannelIOException(String message) {
        super(message);
    }

    public ChannelIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
