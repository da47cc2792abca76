package com.questrail.cot.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Opaque frame bytes passed through the pipeline without interpretation.
 */
public record RawPayload(byte[] bytes) implements CotPayload {

    public RawPayload {
        Objects.requireNonNull(bytes, "bytes");
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RawPayload other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        int shown = Math.min(bytes.length, 16);
        return "RawPayload[" + bytes.length + " bytes: "
                + HexFormat.of().formatHex(bytes, 0, shown)
                + (shown < bytes.length ? "..." : "") + "]";
    }
}
