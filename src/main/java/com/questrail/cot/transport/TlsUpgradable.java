package com.questrail.cot.transport;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * A connected stream that can be switched to TLS in place.
 *
 * <p>The TLS builder supplies a fully configured client-mode {@link SSLEngine};
 * the transport only installs it and drives the handshake.</p>
 */
public interface TlsUpgradable
{
    InetSocketAddress remoteAddress();

    /**
     * Installs {@code engine} and waits for the handshake.
     *
     * @return a pair whose reader and writer see plaintext
     * @throws SSLException if the handshake fails or does not finish within
     *                      {@code timeout}; the connection is closed
     */
    ChannelPair startTls(SSLEngine engine, Duration timeout) throws SSLException;

    /** Closes the plaintext connection without upgrading it. */
    void close();
}
