package com.questrail.cot.codec;

/**
 * Sub-framing of the binary protocol.
 *
 * <p>Mesh frames carry a version marker and rely on the datagram boundary; stream
 * frames carry a length prefix so they can be cut out of a byte stream.</p>
 */
public enum TakProtoVariant {
    MESH,
    STREAM;

    /**
     * Multicast destinations speak mesh, everything else speaks stream.
     */
    public static TakProtoVariant forDestination(boolean multicast) {
        return multicast ? MESH : STREAM;
    }
}
