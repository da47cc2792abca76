package com.questrail.cot.tls;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.Provider;

/**
 * Access to the BouncyCastle provider used for PEM and key decoding.
 *
 * <p>BouncyCastle is a regular dependency, but deployments that trim the class path
 * can lose it. {@link #requireBouncyCastle()} turns that into a clear
 * {@link DependencyMissingException} instead of a {@link NoClassDefFoundError}
 * deep inside TLS setup.</p>
 */
public final class CryptoSupport
{
    private static final String[] REQUIRED_CLASSES = {
            "org.bouncycastle.jce.provider.BouncyCastleProvider",
            "org.bouncycastle.openssl.PEMParser",
            "org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo"
    };

    private CryptoSupport() {}

    /**
     * @throws DependencyMissingException if any BouncyCastle class needed for PEM
     *                                    decoding cannot be loaded
     */
    public static void requireBouncyCastle() {
        for (String name : REQUIRED_CLASSES) {
            try {
                Class.forName(name, false, CryptoSupport.class.getClassLoader());
            } catch (ClassNotFoundException | LinkageError e) {
                throw new DependencyMissingException(
                        "Certificate decoding needs BouncyCastle (bcprov and bcpkix); missing " + name, e);
            }
        }
    }

    static Provider provider() {
        requireBouncyCastle();
        return Holder.PROVIDER;
    }

    private static final class Holder {
        static final Provider PROVIDER = new BouncyCastleProvider();
    }
}
