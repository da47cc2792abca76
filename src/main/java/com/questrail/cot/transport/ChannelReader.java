package com.questrail.cot.transport;

import java.time.Duration;
import java.util.Optional;

/**
 * Receiving end of a channel.
 *
 * <p>Datagram readers return one datagram per call. Stream readers return whatever
 * bytes arrived, with no regard to frame boundaries.</p>
 */
public interface ChannelReader
{
    /**
     * Waits up to {@code timeout} for inbound bytes.
     *
     * @return the bytes, or empty if nothing arrived in time
     * @throws ChannelIOException if the channel was closed by either side or failed
     */
    Optional<byte[]> read(Duration timeout);
}
