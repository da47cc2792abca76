package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.CotFrameDecoder;
import com.questrail.cot.codec.ProtocolVersion;
import com.questrail.cot.codec.TakPayloadCodec;
import com.questrail.cot.model.CotPayload;
import com.questrail.cot.model.RawPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * DefaultCotFrameDecoder
 * -----------------------------------------------------------------------------
 * Reference {@link CotFrameDecoder}.
 *
 * <p>The framing is detected from the first byte of every frame: {@code 0xBF}
 * marks a binary frame, anything else is parsed as XML. The {@code preferred}
 * version passed by callers is only used to flag peers that answer in the other
 * framing.</p>
 *
 * <p>Frames that cannot be turned into an event are returned as {@link RawPayload}
 * rather than thrown, because one bad frame from a peer must not end the receive
 * loop.</p>
 */
public final class DefaultCotFrameDecoder implements CotFrameDecoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultCotFrameDecoder.class);

    private final TakPayloadCodec codec;

    public DefaultCotFrameDecoder() {
        this(null);
    }

    /**
     * @param codec binary payload codec, or {@code null} to pass binary frames through raw
     */
    public DefaultCotFrameDecoder(TakPayloadCodec codec) {
        this.codec = codec;
    }

    @Override
    public CotPayload decode(byte[] frame, ProtocolVersion preferred) {
        Objects.requireNonNull(frame, "frame");

        if (TakProtocolFraming.startsWithMagic(frame)) {
            if (preferred == ProtocolVersion.V0_XML) {
                log.debug("Binary frame received while expecting XML");
            }
            byte[] body = TakProtocolFraming.unwrap(frame);
            if (body == null || codec == null) {
                return new RawPayload(frame);
            }
            try {
                return codec.decode(body);
            } catch (IllegalArgumentException e) {
                log.debug("Binary frame could not be decoded: {}", e.getMessage());
                return new RawPayload(frame);
            }
        }

        try {
            return XmlEventParser.parse(frame);
        } catch (IllegalArgumentException e) {
            log.debug("XML frame could not be decoded: {}", e.getMessage());
            return new RawPayload(frame);
        }
    }
}
