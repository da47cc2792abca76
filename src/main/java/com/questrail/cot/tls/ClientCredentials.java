package com.questrail.cot.tls;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;

/**
 * Decoded client identity: private key, certificate chain (leaf first) and any
 * further certificates that came in the same bundle.
 */
public record ClientCredentials(
        PrivateKey privateKey,
        List<X509Certificate> chain,
        List<X509Certificate> extraCertificates)
{
    public ClientCredentials {
        Objects.requireNonNull(privateKey, "privateKey");
        chain = List.copyOf(chain);
        extraCertificates = List.copyOf(extraCertificates);
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("chain must contain the client certificate");
        }
    }

    public X509Certificate certificate() {
        return chain.get(0);
    }
}
