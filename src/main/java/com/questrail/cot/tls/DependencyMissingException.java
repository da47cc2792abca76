package com.questrail.cot.tls;

import com.questrail.cot.CotClientException;

/**
 * An optional runtime capability (the BouncyCastle PEM/PKCS toolkit) is not on the
 * class path.
 */
public final class DependencyMissingException extends CotClientException
{
    public DependencyMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
