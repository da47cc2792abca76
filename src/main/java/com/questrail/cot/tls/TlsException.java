package com.questrail.cot.tls;

import com.questrail.cot.CotClientException;

/**
 * TLS setup or negotiation failed.
 */
public abstract class TlsException extends CotClientException
{
    protected TlsException(String message) {
        super(message);
    }

    protected TlsException(String message, Throwable cause) {
        super(message, cause);
    }
}
