package com.questrail.cot.tls;

import com.questrail.cot.config.ConfigKeys;
import com.questrail.cot.config.CotClientConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TlsIdentityTest
{
    @Test
    void missingClientCertificateIsRejected() {
        CotClientConfig config = CotClientConfig.builder().withCotUrl("tls://tak.example:8089").build();
        ClientCertificateException e = assertThrows(ClientCertificateException.class,
                () -> TlsIdentity.fromConfig(config));
        assertTrue(e.getMessage().contains(ConfigKeys.TLS_CLIENT_CERT));
    }

    @Test
    void separateKeyCannotAccompanyPkcs12() {
        CotClientConfig config = CotClientConfig.builder()
                .set(ConfigKeys.TLS_CLIENT_CERT, "/certs/client.P12")
                .set(ConfigKeys.TLS_CLIENT_KEY, "/certs/client.key")
                .build();
        assertThrows(ClientCertificateException.class, () -> TlsIdentity.fromConfig(config));
    }

    @Test
    void readsEveryTlsKey() {
        CotClientConfig config = CotClientConfig.builder()
                .set(ConfigKeys.TLS_CLIENT_CERT, "/certs/client.pem")
                .set(ConfigKeys.TLS_CLIENT_KEY, "/certs/client.key")
                .set(ConfigKeys.TLS_CLIENT_KEY_PASSPHRASE, "k")
                .set(ConfigKeys.TLS_CLIENT_PASSWORD, "p")
                .set(ConfigKeys.TLS_CLIENT_CAFILE, "/certs/ca.p12")
                .set(ConfigKeys.TLS_CA_PASSWORD, "c")
                .set(ConfigKeys.TLS_SERVER_EXPECTED_HOSTNAME, "tak.example")
                .set(ConfigKeys.TLS_CLIENT_CIPHERS, "TLS_AES_128_GCM_SHA256")
                .set(ConfigKeys.TLS_HANDSHAKE_TIMEOUT, "2.5")
                .build();

        TlsIdentity identity = TlsIdentity.fromConfig(config);

        assertEquals(Path.of("/certs/client.pem"), identity.clientCert());
        assertEquals(Path.of("/certs/client.key"), identity.clientKeyIfPresent().orElseThrow());
        assertEquals("k", identity.keyPassphrase());
        assertEquals("p", identity.clientPassword());
        assertEquals(Path.of("/certs/ca.p12"), identity.caFileIfPresent().orElseThrow());
        assertEquals("c", identity.caPassword());
        assertEquals("TLS_AES_128_GCM_SHA256", identity.cipherSuites());
        assertEquals(Duration.ofMillis(2500), identity.handshakeTimeout());
        assertFalse(identity.isPkcs12());
        assertTrue(identity.verifyServer());
        assertTrue(identity.checkHostname());
    }

    @Test
    void keyPassphraseFallsBackToClientPassword() {
        CotClientConfig config = CotClientConfig.builder()
                .set(ConfigKeys.TLS_CLIENT_CERT, "/certs/client.pem")
                .set(ConfigKeys.TLS_CLIENT_PASSWORD, "atakatak")
                .build();
        assertEquals("atakatak", TlsIdentity.fromConfig(config).keyPassphrase());
    }

    @Test
    void dontVerifyAlsoDisablesHostnameCheck() {
        CotClientConfig config = CotClientConfig.builder()
                .set(ConfigKeys.TLS_CLIENT_CERT, "/certs/client.p12")
                .set(ConfigKeys.TLS_DONT_VERIFY, "1")
                .build();
        TlsIdentity identity = TlsIdentity.fromConfig(config);
        assertFalse(identity.verifyServer());
        assertFalse(identity.checkHostname());
        assertTrue(identity.isPkcs12());
    }

    @Test
    void peerNamePrefersExpectedHostname() {
        TlsIdentity plain = new TlsIdentity(Path.of("c.pem"), null, null, null, null, null, null, null,
                true, true, Duration.ofSeconds(1));
        TlsIdentity pinned = new TlsIdentity(Path.of("c.pem"), null, null, null, null, null, "tak.example", null,
                true, true, Duration.ofSeconds(1));

        assertEquals("10.0.0.1", plain.peerName("10.0.0.1"));
        assertEquals("tak.example", pinned.peerName("10.0.0.1"));
    }

    @Test
    void toStringHidesSecrets() {
        TlsIdentity identity = new TlsIdentity(Path.of("c.pem"), null, "key-secret", "pw-secret", null, null, null, null,
                true, true, Duration.ofSeconds(1));
        assertFalse(identity.toString().contains("secret"));
    }
}
