package com.questrail.cot;

/**
 * Root of the client error taxonomy.
 *
 * <p>Every failure this library surfaces to a caller is a subclass of this type,
 * so callers can separate "the CoT client gave up" from programming errors
 * ({@link NullPointerException}, {@link IllegalArgumentException}) with a single
 * catch clause.</p>
 */
public class CotClientException extends RuntimeException
{
    public CotClientException(String message) {
        super(message);
    }

    public CotClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
