package com.questrail.cot.tls;

/**
 * The TLS handshake failed, including when the server certificate or hostname
 * could not be verified.
 */
public final class TlsHandshakeException extends TlsException
{
    public TlsHandshakeException(String message) {
        super(message);
    }

    public TlsHandshakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
