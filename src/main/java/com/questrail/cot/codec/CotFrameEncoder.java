package com.questrail.cot.codec;

import com.questrail.cot.model.CotPayload;

/**
 * Converts payloads into complete wire frames.
 *
 * <p>Output of {@link #encode} is ready to be written to a channel as-is: for
 * {@link ProtocolVersion#V0_XML} a full XML document, for
 * {@link ProtocolVersion#V1_TAK} a header plus payload.</p>
 */
public interface CotFrameEncoder
{
    /**
     * @param variant binary sub-framing; ignored for {@link ProtocolVersion#V0_XML}
     */
    byte[] encode(CotPayload payload, ProtocolVersion version, TakProtoVariant variant);
}
