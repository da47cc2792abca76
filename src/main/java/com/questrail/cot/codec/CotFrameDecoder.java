package com.questrail.cot.codec;

import com.questrail.cot.model.CotPayload;

/**
 * Converts one complete wire frame into a payload.
 *
 * <p>The frame must already be delimited (see {@link StreamFramer}). The binary
 * header is detected per frame, so a decoder configured for
 * {@link ProtocolVersion#V0_XML} still accepts binary frames and vice versa.</p>
 */
public interface CotFrameDecoder
{
    /**
     * @return a {@code CotEvent} when the frame could be parsed, otherwise a
     *         {@code RawPayload} holding the frame bytes
     */
    CotPayload decode(byte[] frame, ProtocolVersion preferred);
}
