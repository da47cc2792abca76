package com.questrail.cot.codec.impl;

import java.util.Arrays;

/**
 * Growable byte window used by the stream framers.
 *
 * <p>Indices passed to and returned from this class are relative to the first
 * unconsumed byte. {@link #scanMark} lets a framer remember how far it has already
 * searched so a slow trickle of bytes is not rescanned from the start.</p>
 */
final class FrameBuffer
{
    private byte[] data = new byte[4096];
    private int start;
    private int end;

    int scanMark;

    void append(byte[] bytes) {
        if (bytes.length == 0) {
            return;
        }
        if (end + bytes.length > data.length) {
            int size = size();
            if (size + bytes.length <= data.length) {
                System.arraycopy(data, start, data, 0, size);
            } else {
                byte[] grown = new byte[Math.max(data.length * 2, size + bytes.length)];
                System.arraycopy(data, start, grown, 0, size);
                data = grown;
            }
            start = 0;
            end = size;
        }
        System.arraycopy(bytes, 0, data, end, bytes.length);
        end += bytes.length;
    }

    int size() {
        return end - start;
    }

    boolean isEmpty() {
        return start == end;
    }

    int get(int index) {
        return data[start + index] & 0xFF;
    }

    /**
     * @return relative index of the first occurrence of {@code pattern} at or after
     *         {@code from}, or -1
     */
    int indexOf(byte[] pattern, int from) {
        int last = end - pattern.length;
        outer:
        for (int i = start + Math.max(0, from); i <= last; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i - start;
        }
        return -1;
    }

    byte[] take(int length) {
        byte[] out = Arrays.copyOfRange(data, start, start + length);
        skip(length);
        return out;
    }

    void skip(int length) {
        if (length > size()) {
            throw new IllegalArgumentException("skip " + length + " > size " + size());
        }
        start += length;
        scanMark = 0;
        if (start == end) {
            start = 0;
            end = 0;
        }
    }

    void clear() {
        start = 0;
        end = 0;
        scanMark = 0;
    }
}
