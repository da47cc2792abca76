package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.TakPayloadCodec;
import com.questrail.cot.model.CotEvent;

/**
 * Test {@link TakPayloadCodec} that carries the XML document as the binary body.
 * Registered through {@code META-INF/services} so discovery can be exercised.
 */
public final class XmlBodyTakPayloadCodec implements TakPayloadCodec {

    @Override
    public byte[] encode(CotEvent event) {
        return XmlEventWriter.toBytes(event);
    }

    @Override
    public CotEvent decode(byte[] body) {
        return XmlEventParser.parse(body);
    }
}
