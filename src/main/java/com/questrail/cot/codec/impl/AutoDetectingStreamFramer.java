package com.questrail.cot.codec.impl;

/**
 * Stream framer that decides per frame between the binary and XML framings.
 *
 * <p>A frame whose first non-whitespace byte is {@code 0xBF} is length-delimited;
 * anything else is scanned for the XML end tag. Peers that negotiate the binary
 * protocol part way through a connection are therefore handled without a reset.</p>
 */
public final class AutoDetectingStreamFramer extends AbstractStreamFramer
{
    public AutoDetectingStreamFramer(int maxFrameLength) {
        super(maxFrameLength);
    }

    @Override
    protected byte[] extract(FrameBuffer buffer) {
        skipWhitespace(buffer);
        if (buffer.isEmpty()) {
            return null;
        }
        if (buffer.get(0) == TakProtocolFraming.MAGIC) {
            return TakStreamFramer.extractTak(buffer, maxFrameLength);
        }
        return XmlStreamFramer.extractXml(buffer, maxFrameLength);
    }
}
