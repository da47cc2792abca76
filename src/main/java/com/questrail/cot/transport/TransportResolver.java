package com.questrail.cot.transport;

import com.questrail.cot.config.CotClientConfig;

/**
 * Turns a destination into an open channel.
 *
 * <p>Implementations must fail with one of {@link UnsupportedSchemeException},
 * {@link AddressException}, {@link SocketBindException} or, for {@code tls}, a
 * {@code TlsException}, never with an uncategorized exception.</p>
 */
public interface TransportResolver
{
    ChannelPair resolve(Destination destination, CotClientConfig config);
}
