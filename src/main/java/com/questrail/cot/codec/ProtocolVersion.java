package com.questrail.cot.codec;

/**
 * Wire protocol version negotiated for a destination.
 */
public enum ProtocolVersion {
    /** Self-delimited XML documents. */
    V0_XML(0),
    /** Binary header followed by an opaque payload. */
    V1_TAK(1);

    private final int number;

    ProtocolVersion(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    /**
     * @throws IllegalArgumentException for numbers other than 0 and 1
     */
    public static ProtocolVersion of(int number) {
        for (ProtocolVersion v : values()) {
            if (v.number == number) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unsupported protocol version: " + number);
    }
}
