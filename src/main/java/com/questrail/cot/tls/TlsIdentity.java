package com.questrail.cot.tls;

import com.questrail.cot.config.ConfigKeys;
import com.questrail.cot.config.CotClientConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * TlsIdentity
 * =============================================================================
 * Everything needed to open a TLS client connection: where the client
 * certificate and key live, how to unlock them, what to trust, and which checks
 * to run.
 *
 * <h2>Certificate forms</h2>
 * <ul>
 *   <li>{@code clientCert} ending in {@code .p12}/{@code .pfx}: a PKCS#12 bundle
 *       unlocked with {@code clientPassword}. {@code clientKey} must then be unset.</li>
 *   <li>Otherwise a PEM file holding the certificate and, optionally, the key. When
 *       the key is not in the same file, {@code clientKey} names it.</li>
 * </ul>
 *
 * <p>Disabling {@code verifyServer} also disables {@code checkHostname}.</p>
 */
public record TlsIdentity(
        Path clientCert,
        Path clientKey,
        String keyPassphrase,
        String clientPassword,
        Path caFile,
        String caPassword,
        String expectedHostname,
        String cipherSuites,
        boolean verifyServer,
        boolean checkHostname,
        Duration handshakeTimeout)
{
    public TlsIdentity {
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        if (clientCert == null) {
            throw new ClientCertificateException(ConfigKeys.TLS_CLIENT_CERT + " is not set");
        }
        if (clientKey != null && Pkcs12MaterialLoader.isPkcs12(clientCert)) {
            throw new ClientCertificateException(
                    ConfigKeys.TLS_CLIENT_KEY + " cannot be combined with a PKCS#12 " + ConfigKeys.TLS_CLIENT_CERT);
        }
        if (!verifyServer) {
            checkHostname = false;
        }
    }

    /**
     * Reads the {@code TLS_*} keys.
     *
     * @throws ClientCertificateException if {@code TLS_CLIENT_CERT} is unset or
     *                                    conflicts with {@code TLS_CLIENT_KEY}
     */
    public static TlsIdentity fromConfig(CotClientConfig config) {
        return new TlsIdentity(
                config.getPath(ConfigKeys.TLS_CLIENT_CERT).orElse(null),
                config.getPath(ConfigKeys.TLS_CLIENT_KEY).orElse(null),
                config.get(ConfigKeys.TLS_CLIENT_KEY_PASSPHRASE)
                        .or(() -> config.get(ConfigKeys.TLS_CLIENT_PASSWORD)).orElse(null),
                config.get(ConfigKeys.TLS_CLIENT_PASSWORD).orElse(null),
                config.getPath(ConfigKeys.TLS_CLIENT_CAFILE).orElse(null),
                config.get(ConfigKeys.TLS_CA_PASSWORD).orElse(null),
                config.get(ConfigKeys.TLS_SERVER_EXPECTED_HOSTNAME).orElse(null),
                config.get(ConfigKeys.TLS_CLIENT_CIPHERS).orElse(null),
                !config.getBoolean(ConfigKeys.TLS_DONT_VERIFY),
                !config.getBoolean(ConfigKeys.TLS_DONT_CHECK_HOSTNAME),
                config.tlsHandshakeTimeout());
    }

    public boolean isPkcs12() {
        return Pkcs12MaterialLoader.isPkcs12(clientCert);
    }

    public Optional<Path> clientKeyIfPresent() {
        return Optional.ofNullable(clientKey);
    }

    public Optional<Path> caFileIfPresent() {
        return Optional.ofNullable(caFile);
    }

    /** Name the server certificate is checked against: the expected hostname, else {@code host}. */
    public String peerName(String host) {
        return expectedHostname != null && !expectedHostname.isBlank() ? expectedHostname : host;
    }

    @Override
    public String toString() {
        return "TlsIdentity{clientCert=" + clientCert
                + ", clientKey=" + clientKey
                + ", caFile=" + caFile
                + ", expectedHostname=" + expectedHostname
                + ", verifyServer=" + verifyServer
                + ", checkHostname=" + checkHostname + "}";
    }
}
