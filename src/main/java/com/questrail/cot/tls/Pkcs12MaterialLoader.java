package com.questrail.cot.tls;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.UnrecoverableKeyException;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decodes PKCS#12 bundles into client credentials or trust material.
 *
 * <p>A wrong password is reported as {@link ClientCertificateException}, the same
 * as any other unusable bundle.</p>
 */
final class Pkcs12MaterialLoader
{
    private Pkcs12MaterialLoader() {}

    static boolean isPkcs12(Path file) {
        String name = file.getFileName().toString().toLowerCase(java.util.Locale.ROOT);
        return name.endsWith(".p12") || name.endsWith(".pfx");
    }

    static KeyStore load(Path file, char[] password) {
        try (InputStream in = Files.newInputStream(file)) {
            KeyStore store = KeyStore.getInstance("PKCS12");
            store.load(in, password);
            return store;
        } catch (NoSuchFileException e) {
            throw new ClientCertificateException("File not found: " + file, e);
        } catch (IOException e) {
            if (e.getCause() instanceof UnrecoverableKeyException) {
                throw new ClientCertificateException("Wrong password for PKCS#12 bundle " + file, e);
            }
            throw new ClientCertificateException("Cannot read PKCS#12 bundle " + file + " (wrong password or corrupt file)", e);
        } catch (GeneralSecurityException e) {
            throw new ClientCertificateException("Cannot decode PKCS#12 bundle " + file, e);
        }
    }

    /**
     * Returns the first key entry with its chain. Certificates beyond the leaf, and
     * trusted certificate entries, are returned as extra certificates.
     */
    static ClientCredentials credentials(Path file, char[] password) {
        KeyStore store = load(file, password);
        try {
            PrivateKey key = null;
            List<X509Certificate> chain = new ArrayList<>();
            List<X509Certificate> extras = new ArrayList<>();
            for (String alias : Collections.list(store.aliases())) {
                if (key == null && store.isKeyEntry(alias)) {
                    Key k = store.getKey(alias, password);
                    if (k instanceof PrivateKey pk) {
                        key = pk;
                        Certificate[] certs = store.getCertificateChain(alias);
                        for (int i = 0; certs != null && i < certs.length; i++) {
                            (i == 0 ? chain : extras).add((X509Certificate) certs[i]);
                        }
                    }
                } else if (store.isCertificateEntry(alias)) {
                    extras.add((X509Certificate) store.getCertificate(alias));
                }
            }
            if (key == null || chain.isEmpty()) {
                throw new ClientCertificateException("PKCS#12 bundle " + file + " holds no private key with certificate");
            }
            return new ClientCredentials(key, chain, extras);
        } catch (UnrecoverableKeyException e) {
            throw new ClientCertificateException("Wrong password for the key in PKCS#12 bundle " + file, e);
        } catch (GeneralSecurityException e) {
            throw new ClientCertificateException("Cannot decode PKCS#12 bundle " + file, e);
        }
    }

    /**
     * All certificates in the bundle, in alias order, for use as trust anchors.
     */
    static List<X509Certificate> certificates(Path file, char[] password) {
        KeyStore store = load(file, password);
        try {
            List<X509Certificate> out = new ArrayList<>();
            for (String alias : Collections.list(store.aliases())) {
                if (store.isCertificateEntry(alias)) {
                    out.add((X509Certificate) store.getCertificate(alias));
                } else {
                    Certificate[] chain = store.getCertificateChain(alias);
                    if (chain != null) {
                        for (Certificate c : chain) {
                            out.add((X509Certificate) c);
                        }
                    }
                }
            }
            if (out.isEmpty()) {
                throw new ClientCertificateException("PKCS#12 trust store " + file + " holds no certificates");
            }
            return out;
        } catch (GeneralSecurityException e) {
            throw new ClientCertificateException("Cannot decode PKCS#12 trust store " + file, e);
        }
    }
}
