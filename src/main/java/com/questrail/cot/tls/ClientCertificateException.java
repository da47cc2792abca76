package com.questrail.cot.tls;

/**
 * Certificate, key or trust material is missing, unreadable, malformed, or the
 * password or passphrase protecting it is wrong.
 */
public final class ClientCertificateException extends TlsException
{
    public ClientCertificateException(String message) {
        super(message);
    }

    public ClientCertificateException(String message, Throwable cause) {
        super(message, cause);
    }
}
