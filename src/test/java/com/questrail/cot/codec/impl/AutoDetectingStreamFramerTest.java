package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.TakProtoVariant;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AutoDetectingStreamFramerTest
{
    @Test
    void switchesBetweenXmlAndBinaryPerFrame() {
        byte[] xml = "<event uid=\"x\"></event>".getBytes(StandardCharsets.UTF_8);
        byte[] tak = TakProtocolFraming.wrap("<event/>".getBytes(StandardCharsets.UTF_8), TakProtoVariant.STREAM);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(xml, 0, xml.length);
        out.write('\n');
        out.write(tak, 0, tak.length);
        out.write(xml, 0, xml.length);

        List<byte[]> frames = new AutoDetectingStreamFramer(1024).feed(out.toByteArray());

        assertEquals(3, frames.size());
        assertArrayEquals(xml, frames.get(0));
        assertArrayEquals(tak, frames.get(1));
        assertArrayEquals(xml, frames.get(2));
    }

    @Test
    void rejectsNonPositiveWindow() {
        assertThrows(IllegalArgumentException.class, () -> new AutoDetectingStreamFramer(0));
    }

    @Test
    void binaryResyncOverLongJunkRunDoesNotRecurse() {
        byte[] junk = new byte[200_000];
        Arrays.fill(junk, (byte) 0xBF);

        AutoDetectingStreamFramer framer = new AutoDetectingStreamFramer(1024 * 1024);

        assertTrue(framer.feed(junk).isEmpty());
        assertTrue(framer.buffered() <= TakProtocolFraming.MAX_VARINT_BYTES);
    }
}
