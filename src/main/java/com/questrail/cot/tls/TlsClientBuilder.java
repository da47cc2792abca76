package com.questrail.cot.tls;

import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotSecurityWarning;
import com.questrail.cot.transport.ChannelPair;
import com.questrail.cot.transport.TlsUpgradable;

import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * TlsClientBuilder
 * =============================================================================
 * Builds a client {@link SSLContext} from a {@link TlsIdentity} and upgrades a
 * connected stream to TLS with it.
 *
 * <h2>Client identity</h2>
 * PKCS#12 bundles are decoded with the client password. PEM certificates use the
 * key stored in the same file when it is unencrypted, otherwise the separate key
 * file, otherwise the encrypted key from the certificate file. Encrypted keys are
 * unlocked with the configured passphrase, falling back to the interactive
 * {@link PassphraseProvider} given to the constructor.
 *
 * <h2>Trust</h2>
 * <ul>
 *   <li>CA file (PEM or PKCS#12): only those certificates are trusted.</li>
 *   <li>No CA file: the JVM default trust store, plus any extra certificates that
 *       came in the client PKCS#12 bundle.</li>
 *   <li>Verification disabled: every server certificate is accepted.</li>
 * </ul>
 *
 * <p>Hostname checking uses HTTPS endpoint identification against the expected
 * hostname, or the connection host. Disabling verification or hostname checking is
 * always reported through {@link CotObservabilitySink#onSecurityWarning}.</p>
 *
 * <p>Only TLS 1.2 and 1.3 are enabled. A colon-separated cipher list (JSSE suite
 * names) restricts the negotiable suites; empty or {@code ALL} keeps the JSSE
 * defaults.</p>
 */
public final class TlsClientBuilder
{
    private static final Logger log = LoggerFactory.getLogger(TlsClientBuilder.class);

    private static final List<String> PROTOCOLS = List.of("TLSv1.3", "TLSv1.2");
    private static final char[] IN_MEMORY_STORE_PASSWORD = "cot-client".toCharArray();

    private final CotObservabilitySink sink;
    private final PassphraseProvider interactive;

    public TlsClientBuilder(CotObservabilitySink sink) {
        this(sink, new ConsolePassphraseProvider());
    }

    /**
     * @param interactive asked for a key passphrase when configuration has none
     */
    public TlsClientBuilder(CotObservabilitySink sink, PassphraseProvider interactive) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.interactive = Objects.requireNonNull(interactive, "interactive");
    }

    /**
     * Performs the TLS handshake over {@code tcp}.
     *
     * <p>On any failure the TCP connection is closed before the exception
     * propagates.</p>
     *
     * @param host name used for SNI and, unless overridden, the hostname check
     * @throws ClientCertificateException if the key or trust material is unusable
     * @throws TlsHandshakeException      if negotiation or server verification fails
     */
    public ChannelPair wrap(TlsUpgradable tcp, String host, TlsIdentity identity) {
        Objects.requireNonNull(tcp, "tcp");
        Objects.requireNonNull(identity, "identity");

        SSLEngine engine;
        try {
            SSLContext context = createContext(identity);
            engine = createEngine(context, host, tcp.remoteAddress().getPort(), identity);
        } catch (RuntimeException e) {
            tcp.close();
            throw e;
        }

        try {
            return tcp.startTls(engine, identity.handshakeTimeout());
        } catch (SSLException e) {
            String hint = identity.verifyServer()
                    ? " (set TLS_DONT_CHECK_HOSTNAME=1 or TLS_DONT_VERIFY=1 to bypass server checks)"
                    : "";
            throw new TlsHandshakeException("TLS handshake with " + host + " failed: " + e.getMessage() + hint, e);
        }
    }

    /**
     * @throws ClientCertificateException if the key or trust material is unusable
     */
    public SSLContext createContext(TlsIdentity identity) {
        ClientCredentials credentials = loadCredentials(identity);
        try {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, null);
            keyStore.setKeyEntry("client", credentials.privateKey(), IN_MEMORY_STORE_PASSWORD,
                    credentials.chain().toArray(new X509Certificate[0]));
            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(keyStore, IN_MEMORY_STORE_PASSWORD);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(kmf.getKeyManagers(), trustManagers(identity, credentials), new SecureRandom());
            return context;
        } catch (java.io.IOException | GeneralSecurityException e) {
            throw new ClientCertificateException("Cannot build TLS context for " + identity.clientCert(), e);
        }
    }

    SSLEngine createEngine(SSLContext context, String host, int port, TlsIdentity identity) {
        String peer = identity.peerName(host);
        SSLEngine engine = context.createSSLEngine(peer, port);
        engine.setUseClientMode(true);

        SSLParameters params = engine.getSSLParameters();
        Set<String> supportedProtocols = Set.of(engine.getSupportedProtocols());
        params.setProtocols(PROTOCOLS.stream().filter(supportedProtocols::contains).toArray(String[]::new));

        String[] ciphers = selectCiphers(identity.cipherSuites(), engine.getSupportedCipherSuites());
        if (ciphers != null) {
            params.setCipherSuites(ciphers);
        }

        if (identity.checkHostname()) {
            params.setEndpointIdentificationAlgorithm("HTTPS");
        } else {
            params.setEndpointIdentificationAlgorithm(null);
            warn("Disabled TLS server hostname verification for " + peer);
        }
        engine.setSSLParameters(params);
        return engine;
    }

    ClientCredentials loadCredentials(TlsIdentity identity) {
        Path certFile = identity.clientCert();
        if (identity.isPkcs12()) {
            char[] password = identity.clientPassword() == null ? new char[0] : identity.clientPassword().toCharArray();
            return Pkcs12MaterialLoader.credentials(certFile, password);
        }

        PemMaterialLoader.PemContents cert = PemMaterialLoader.read(certFile);
        if (cert.certificates().isEmpty()) {
            throw new ClientCertificateException("No certificate found in " + certFile);
        }

        PrivateKey key = cert.plainKey();
        if (key == null && identity.clientKey() != null) {
            PemMaterialLoader.PemContents keyFile = PemMaterialLoader.read(identity.clientKey());
            key = keyFile.plainKey() != null
                    ? keyFile.plainKey()
                    : keyFile.encryptedKey() != null
                            ? PemMaterialLoader.decrypt(keyFile.encryptedKey(), identity.clientKey().toString(), passphrases(identity))
                            : null;
            if (key == null) {
                throw new ClientCertificateException("No private key found in " + identity.clientKey());
            }
        }
        if (key == null && cert.encryptedKey() != null) {
            key = PemMaterialLoader.decrypt(cert.encryptedKey(), certFile.toString(), passphrases(identity));
        }
        if (key == null) {
            throw new ClientCertificateException(
                    "No private key in " + certFile + " and TLS_CLIENT_KEY is not set");
        }
        return new ClientCredentials(key, cert.certificates(), List.of());
    }

    private PassphraseProvider passphrases(TlsIdentity identity) {
        return new ConfiguredPassphraseProvider(identity.keyPassphrase()).orElse(interactive);
    }

    private TrustManager[] trustManagers(TlsIdentity identity, ClientCredentials credentials)
            throws GeneralSecurityException, java.io.IOException
    {
        if (!identity.verifyServer()) {
            warn("Disabled TLS server certificate verification");
            return InsecureTrustManagerFactory.INSTANCE.getTrustManagers();
        }

        List<X509Certificate> anchors = new ArrayList<>();
        if (identity.caFile() != null) {
            Path ca = identity.caFile();
            if (Pkcs12MaterialLoader.isPkcs12(ca)) {
                String pw = identity.caPassword() != null ? identity.caPassword() : identity.clientPassword();
                anchors.addAll(Pkcs12MaterialLoader.certificates(ca, pw == null ? new char[0] : pw.toCharArray()));
            } else {
                anchors.addAll(PemMaterialLoader.certificates(ca));
            }
        } else if (!credentials.extraCertificates().isEmpty()) {
            anchors.addAll(systemTrustAnchors());
            anchors.addAll(credentials.extraCertificates());
        } else {
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init((KeyStore) null);
            return tmf.getTrustManagers();
        }

        KeyStore trustStore = KeyStore.getInstance("PKCS12");
        trustStore.load(null, null);
        for (int i = 0; i < anchors.size(); i++) {
            trustStore.setCertificateEntry("ca-" + i, anchors.get(i));
        }
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);
        log.debug("Trusting {} CA certificate(s)", anchors.size());
        return tmf.getTrustManagers();
    }

    private static List<X509Certificate> systemTrustAnchors() throws GeneralSecurityException {
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init((KeyStore) null);
        List<X509Certificate> out = new ArrayList<>();
        for (TrustManager tm : tmf.getTrustManagers()) {
            if (tm instanceof X509TrustManager x509) {
                out.addAll(Arrays.asList(x509.getAcceptedIssuers()));
            }
        }
        return out;
    }

    /**
     * @return the configured suites that the engine supports, or {@code null} to keep
     *         the defaults
     * @throws TlsHandshakeException if a list is configured and none of it is supported
     */
    static String[] selectCiphers(String configured, String[] supported) {
        if (configured == null || configured.isBlank() || configured.trim().toUpperCase(Locale.ROOT).equals("ALL")) {
            return null;
        }
        Set<String> available = Set.of(supported);
        List<String> selected = new ArrayList<>();
        for (String name : configured.split(":")) {
            String suite = name.trim();
            if (suite.isEmpty()) {
                continue;
            }
            if (available.contains(suite)) {
                selected.add(suite);
            } else {
                log.warn("Ignoring unsupported cipher suite {}", suite);
            }
        }
        if (selected.isEmpty()) {
            throw new TlsHandshakeException("None of the configured cipher suites is supported: " + configured);
        }
        return selected.toArray(new String[0]);
    }

    private void warn(String message) {
        sink.onSecurityWarning(new CotSecurityWarning(Instant.now(), message));
    }
}
