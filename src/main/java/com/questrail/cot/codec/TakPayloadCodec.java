package com.questrail.cot.codec;

import com.questrail.cot.model.CotEvent;

/**
 * Service-provider interface for the binary payload body.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}
 * ({@code META-INF/services/com.questrail.cot.codec.TakPayloadCodec}). The header
 * bytes are handled by the caller; a codec only sees the body.</p>
 */
public interface TakPayloadCodec
{
    byte[] encode(CotEvent event);

    /**
     * @throws IllegalArgumentException if the body is not a valid message
     */
    CotEvent decode(byte[] body);
}
