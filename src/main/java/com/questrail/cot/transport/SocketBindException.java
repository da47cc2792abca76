package com.questrail.cot.transport;

/**
 * A local socket could not be bound or configured (port in use, no multicast
 * interface, group join refused).
 */
public final class SocketBindException extends TransportException
{
    public SocketBindException(String message) {
        super(message);
    }

    public SocketBindException(String message, Throwable cause) {
        super(message, cause);
    }
}
