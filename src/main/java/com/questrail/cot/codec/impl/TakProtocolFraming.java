package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.TakProtoVariant;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * TakProtocolFraming
 * -----------------------------------------------------------------------------
 * Header rules of the version 1 binary protocol.
 *
 * <pre>
 *   mesh:   0xBF varint(version = 1) 0xBF body
 *   stream: 0xBF varint(body length)  body
 * </pre>
 *
 * <p>Varints are unsigned LEB128 (7 bits per byte, least significant group first,
 * high bit set on every byte but the last), limited here to 32-bit values.</p>
 *
 * <p>This class only adds and removes headers. The body is opaque.</p>
 */
final class TakProtocolFraming
{
    static final int MAGIC = 0xBF;
    static final int MESH_VERSION = 1;

    /** Five 7-bit groups cover an unsigned 32-bit value. */
    static final int MAX_VARINT_BYTES = 5;

    private TakProtocolFraming() {}

    static byte[] wrap(byte[] body, TakProtoVariant variant) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(body.length + 8);
        out.write(MAGIC);
        if (variant == TakProtoVariant.MESH) {
            writeVarint(out, MESH_VERSION);
            out.write(MAGIC);
        } else {
            writeVarint(out, body.length);
        }
        out.write(body, 0, body.length);
        return out.toByteArray();
    }

    /**
     * Strips either header form from a complete frame.
     *
     * <p>A stream header is recognized when the declared length matches the rest of
     * the frame exactly; otherwise a mesh header is expected.</p>
     *
     * @return the body, or {@code null} if {@code frame} carries neither header
     */
    static byte[] unwrap(byte[] frame) {
        if (frame.length < 2 || (frame[0] & 0xFF) != MAGIC) {
            return null;
        }
        long[] varint = readVarint(frame, 1);
        if (varint == null) {
            return null;
        }
        long value = varint[0];
        int headerLength = 1 + (int) varint[1];
        if (headerLength + value == frame.length) {
            return Arrays.copyOfRange(frame, headerLength, frame.length);
        }
        if (value == MESH_VERSION && frame.length > headerLength && (frame[headerLength] & 0xFF) == MAGIC) {
            return Arrays.copyOfRange(frame, headerLength + 1, frame.length);
        }
        return null;
    }

    static boolean startsWithMagic(byte[] frame) {
        return frame.length > 0 && (frame[0] & 0xFF) == MAGIC;
    }

    static void writeVarint(ByteArrayOutputStream out, long value) {
        if (value < 0) {
            throw new IllegalArgumentException("varint must be non-negative: " + value);
        }
        long v = value;
        while ((v & ~0x7FL) != 0) {
            out.write((int) ((v & 0x7F) | 0x80));
            v >>>= 7;
        }
        out.write((int) v);
    }

    /**
     * @return {@code {value, bytesRead}}, or {@code null} when the varint is
     *         incomplete or longer than {@link #MAX_VARINT_BYTES}
     */
    static long[] readVarint(byte[] data, int offset) {
        long value = 0;
        for (int i = 0; i < MAX_VARINT_BYTES && offset + i < data.length; i++) {
            int b = data[offset + i] & 0xFF;
            value |= (long) (b & 0x7F) << (7 * i);
            if ((b & 0x80) == 0) {
                return new long[] {value, i + 1};
            }
        }
        return null;
    }
}
