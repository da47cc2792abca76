package com.questrail.cot.transport;

import com.questrail.cot.CotClientException;

/**
 * A destination could not be turned into a channel.
 */
public abstract class TransportException extends CotClientException
{
    protected TransportException(String message) {
        super(message);
    }

    protected TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
