package com.questrail.cot.transport;

/**
 * The destination scheme (or one of its {@code +modifiers}) is not recognized.
 */
public final class UnsupportedSchemeException extends TransportException
{
    public UnsupportedSchemeException(String message) {
        super(message);
    }
}
