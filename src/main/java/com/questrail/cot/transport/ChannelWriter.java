package com.questrail.cot.transport;

/**
 * Sending end of a channel. Returns once the bytes have been handed to the OS.
 */
public interface ChannelWriter
{
    /**
     * @throws ChannelIOException if the channel is closed or the write failed
     */
    void write(byte[] bytes);
}
