package com.questrail.cot.tls;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.InputDecryptorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCSException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads certificates and private keys from PEM files with BouncyCastle.
 *
 * <p>Accepted blocks: {@code CERTIFICATE}, {@code RSA/EC PRIVATE KEY} (plain or
 * with OpenSSL {@code Proc-Type: 4,ENCRYPTED} headers), {@code PRIVATE KEY} and
 * {@code ENCRYPTED PRIVATE KEY}. Other blocks are ignored.</p>
 */
final class PemMaterialLoader
{
    private PemMaterialLoader() {}

    /**
     * Contents of one PEM file. At most the first key block is kept; an encrypted
     * key is left encrypted until {@link #decrypt} is called.
     */
    record PemContents(List<X509Certificate> certificates, PrivateKey plainKey, Object encryptedKey) {}

    static PemContents read(Path file) {
        CryptoSupport.requireBouncyCastle();
        JcaX509CertificateConverter certs = new JcaX509CertificateConverter().setProvider(CryptoSupport.provider());
        JcaPEMKeyConverter keys = new JcaPEMKeyConverter().setProvider(CryptoSupport.provider());

        List<X509Certificate> certificates = new ArrayList<>();
        PrivateKey plainKey = null;
        Object encryptedKey = null;

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.US_ASCII);
             PEMParser parser = new PEMParser(reader)) {
            Object o;
            while ((o = parser.readObject()) != null) {
                if (o instanceof X509CertificateHolder holder) {
                    certificates.add(certs.getCertificate(holder));
                } else if (plainKey != null || encryptedKey != null) {
                    continue;
                } else if (o instanceof PEMKeyPair pair) {
                    plainKey = keys.getKeyPair(pair).getPrivate();
                } else if (o instanceof PrivateKeyInfo info) {
                    plainKey = keys.getPrivateKey(info);
                } else if (o instanceof PEMEncryptedKeyPair || o instanceof PKCS8EncryptedPrivateKeyInfo) {
                    encryptedKey = o;
                }
            }
        } catch (NoSuchFileException e) {
            throw new ClientCertificateException("File not found: " + file, e);
        } catch (CertificateException e) {
            throw new ClientCertificateException("Malformed certificate in " + file, e);
        } catch (IOException e) {
            throw new ClientCertificateException("Cannot read PEM material from " + file, e);
        }
        return new PemContents(certificates, plainKey, encryptedKey);
    }

    /**
     * @throws ClientCertificateException if no passphrase is available or it is wrong
     */
    static PrivateKey decrypt(Object encryptedKey, String resource, PassphraseProvider passphrases) {
        char[] passphrase = passphrases.passphraseFor(resource)
                .orElseThrow(() -> new ClientCertificateException(
                        "Private key in " + resource + " is encrypted and no passphrase is available"));
        try {
            JcaPEMKeyConverter keys = new JcaPEMKeyConverter().setProvider(CryptoSupport.provider());
            if (encryptedKey instanceof PEMEncryptedKeyPair pair) {
                PEMKeyPair decrypted = pair.decryptKeyPair(
                        new JcePEMDecryptorProviderBuilder().setProvider(CryptoSupport.provider()).build(passphrase));
                return keys.getKeyPair(decrypted).getPrivate();
            }
            PKCS8EncryptedPrivateKeyInfo info = (PKCS8EncryptedPrivateKeyInfo) encryptedKey;
            InputDecryptorProvider decryptor =
                    new JceOpenSSLPKCS8DecryptorProviderBuilder().setProvider(CryptoSupport.provider()).build(passphrase);
            return keys.getPrivateKey(info.decryptPrivateKeyInfo(decryptor));
        } catch (PEMException | PKCSException e) {
            throw new ClientCertificateException("Cannot decrypt private key in " + resource + " (wrong passphrase?)", e);
        } catch (OperatorCreationException | IOException e) {
            throw new ClientCertificateException("Unsupported key encryption in " + resource, e);
        } finally {
            Arrays.fill(passphrase, '\0');
        }
    }

    static List<X509Certificate> certificates(Path file) {
        List<X509Certificate> certificates = read(file).certificates();
        if (certificates.isEmpty()) {
            throw new ClientCertificateException("No certificate found in " + file);
        }
        return certificates;
    }
}
