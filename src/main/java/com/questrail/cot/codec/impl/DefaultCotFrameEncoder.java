package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.CotFrameEncoder;
import com.questrail.cot.codec.ProtocolVersion;
import com.questrail.cot.codec.TakPayloadCodec;
import com.questrail.cot.codec.TakProtoVariant;
import com.questrail.cot.model.CotEvent;
import com.questrail.cot.model.CotPayload;
import com.questrail.cot.model.RawPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DefaultCotFrameEncoder
 * -----------------------------------------------------------------------------
 * Reference {@link CotFrameEncoder}.
 *
 * <ul>
 *   <li>{@link RawPayload}s are passed through unchanged; the producer framed them.</li>
 *   <li>Version 0 renders XML with the standard declaration.</li>
 *   <li>Version 1 encodes the body with the installed {@link TakPayloadCodec} and
 *       adds the mesh or stream header. Without a codec the event is sent as
 *       version 0 and a warning is logged once.</li>
 * </ul>
 */
public final class DefaultCotFrameEncoder implements CotFrameEncoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultCotFrameEncoder.class);

    private final TakPayloadCodec codec;
    private final AtomicBoolean fallbackWarned = new AtomicBoolean();

    /** Encoder without a binary payload codec. */
    public DefaultCotFrameEncoder() {
        this(null);
    }

    /**
     * @param codec binary payload codec, or {@code null} to always fall back to XML
     */
    public DefaultCotFrameEncoder(TakPayloadCodec codec) {
        this.codec = codec;
    }

    @Override
    public byte[] encode(CotPayload payload, ProtocolVersion version, TakProtoVariant variant) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(version, "version");

        if (payload instanceof RawPayload raw) {
            return raw.bytes();
        }
        CotEvent event = (CotEvent) payload;

        if (version == ProtocolVersion.V1_TAK) {
            if (codec != null) {
                return TakProtocolFraming.wrap(codec.encode(event), Objects.requireNonNull(variant, "variant"));
            }
            if (fallbackWarned.compareAndSet(false, true)) {
                log.warn("TAK_PROTO=1 requested but no binary payload codec is installed; sending XML");
            }
        }
        return XmlEventWriter.toBytes(event);
    }
}
