package com.questrail.cot.transport;

/**
 * The host or port of a destination is malformed, cannot be resolved, or the peer
 * refused the connection.
 */
public final class AddressException extends TransportException
{
    public AddressException(String message) {
        super(message);
    }

    public AddressException(String message, Throwable cause) {
        super(message, cause);
    }
}
