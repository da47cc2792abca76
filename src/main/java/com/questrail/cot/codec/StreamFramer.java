package com.questrail.cot.codec;

import java.util.List;

/**
 * Cuts complete frames out of a byte stream.
 *
 * <p>Stateful and single-threaded: bytes fed in one call may complete a frame
 * started by an earlier call.</p>
 */
public interface StreamFramer
{
    /**
     * Appends {@code bytes} to the internal buffer and returns every frame that is
     * now complete, in arrival order.
     *
     * @throws FrameTooLongException when the buffer exceeds the scan window without a
     *                               boundary; the buffer has been cleared
     */
    List<byte[]> feed(byte[] bytes);

    /** Number of bytes held waiting for a boundary. */
    int buffered();
}
