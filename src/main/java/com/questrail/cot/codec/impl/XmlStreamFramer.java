package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.FrameTooLongException;

import java.nio.charset.StandardCharsets;

/**
 * Delimits version 0 frames by scanning for the {@code </event>} end tag.
 *
 * <p>A frame runs from the first non-whitespace byte up to and including the end
 * tag, so an XML declaration and the newline after it stay with their event.</p>
 */
public final class XmlStreamFramer extends AbstractStreamFramer
{
    static final byte[] END_TAG = "</event>".getBytes(StandardCharsets.US_ASCII);

    public XmlStreamFramer(int maxFrameLength) {
        super(maxFrameLength);
    }

    @Override
    protected byte[] extract(FrameBuffer buffer) {
        return extractXml(buffer, maxFrameLength);
    }

    static byte[] extractXml(FrameBuffer buffer, int maxFrameLength) {
        skipWhitespace(buffer);
        if (buffer.isEmpty()) {
            return null;
        }
        int from = Math.max(0, buffer.scanMark - END_TAG.length + 1);
        int idx = buffer.indexOf(END_TAG, from);
        if (idx < 0) {
            buffer.scanMark = buffer.size();
            return null;
        }
        int length = idx + END_TAG.length;
        if (length > maxFrameLength) {
            buffer.skip(length);
            throw new FrameTooLongException(length, maxFrameLength);
        }
        return buffer.take(length);
    }
}
