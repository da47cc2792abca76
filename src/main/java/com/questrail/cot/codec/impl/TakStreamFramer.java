package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.FrameTooLongException;

/**
 * Delimits version 1 stream frames using the length prefix.
 *
 * <p>Bytes before a {@code 0xBF} magic byte cannot start a frame and are skipped.
 * Frames are returned whole, header included.</p>
 */
public final class TakStreamFramer extends AbstractStreamFramer
{
    public TakStreamFramer(int maxFrameLength) {
        super(maxFrameLength);
    }

    @Override
    protected byte[] extract(FrameBuffer buffer) {
        return extractTak(buffer, maxFrameLength);
    }

    static byte[] extractTak(FrameBuffer buffer, int maxFrameLength) {
        long value;
        int headerLength;
        while (true) {
            int junk = 0;
            while (junk < buffer.size() && buffer.get(junk) != TakProtocolFraming.MAGIC) {
                junk++;
            }
            if (junk > 0) {
                buffer.skip(junk);
            }
            if (buffer.size() < 2) {
                return null;
            }

            value = 0;
            headerLength = -1;
            for (int i = 0; i < TakProtocolFraming.MAX_VARINT_BYTES && 1 + i < buffer.size(); i++) {
                int b = buffer.get(1 + i);
                value |= (long) (b & 0x7F) << (7 * i);
                if ((b & 0x80) == 0) {
                    headerLength = 2 + i;
                    break;
                }
            }
            if (headerLength >= 0) {
                break;
            }
            if (buffer.size() <= TakProtocolFraming.MAX_VARINT_BYTES) {
                return null;
            }
            // Not a length prefix; drop the magic byte and resynchronize.
            buffer.skip(1);
        }

        long total = headerLength + value;
        if (total > maxFrameLength) {
            int dropped = buffer.size();
            buffer.clear();
            throw new FrameTooLongException(dropped, maxFrameLength);
        }
        if (buffer.size() < total) {
            return null;
        }
        return buffer.take((int) total);
    }
}
