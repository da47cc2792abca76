package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.FrameTooLongException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XmlStreamFramerTest
{
    private static final String EVENT_A = "<event uid=\"a\"><detail/></event>";
    private static final String EVENT_B = "<event uid=\"b\"></event>";

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Test
    void frameSplitAcrossReadsIsReassembled() {
        XmlStreamFramer framer = new XmlStreamFramer(1024);

        assertTrue(framer.feed(bytes("<event uid=\"a\"><det")).isEmpty());
        assertTrue(framer.feed(bytes("ail/></eve")).isEmpty());
        List<byte[]> frames = framer.feed(bytes("nt>"));

        assertEquals(1, frames.size());
        assertEquals(EVENT_A, text(frames.get(0)));
        assertEquals(0, framer.buffered());
    }

    @Test
    void severalFramesInOneReadAreReturnedInOrder() {
        XmlStreamFramer framer = new XmlStreamFramer(1024);

        List<byte[]> frames = framer.feed(bytes(EVENT_A + "\r\n" + EVENT_B + "<event"));

        assertEquals(2, frames.size());
        assertEquals(EVENT_A, text(frames.get(0)));
        assertEquals(EVENT_B, text(frames.get(1)));
        assertEquals("<event".length(), framer.buffered());
    }

    @Test
    void declarationStaysWithItsEvent() {
        XmlStreamFramer framer = new XmlStreamFramer(1024);
        String doc = XmlEventWriter.DECLARATION + "\n" + EVENT_B;

        List<byte[]> frames = framer.feed(bytes("\n" + doc));

        assertEquals(doc, text(frames.get(0)));
    }

    @Test
    void endTagSplitOverManySmallReadsIsFound() {
        XmlStreamFramer framer = new XmlStreamFramer(1024);
        byte[] all = bytes(EVENT_B);
        int found = 0;
        for (byte b : all) {
            found += framer.feed(new byte[] {b}).size();
        }
        assertEquals(1, found);
    }

    @Test
    void unterminatedDataBeyondWindowIsDiscarded() {
        XmlStreamFramer framer = new XmlStreamFramer(64);

        FrameTooLongException e = assertThrows(FrameTooLongException.class,
                () -> framer.feed(bytes("<event>" + "x".repeat(100))));

        assertEquals(107, e.discardedBytes());
        assertTrue(e.completedFrames().isEmpty());
        assertEquals(0, framer.buffered());

        List<byte[]> next = framer.feed(bytes(EVENT_B));
        assertEquals(EVENT_B, text(next.get(0)));
    }

    @Test
    void oversizedFrameDoesNotLoseFollowingFrame() {
        XmlStreamFramer framer = new XmlStreamFramer(40);
        String big = "<event>" + "x".repeat(50) + "</event>";

        FrameTooLongException e = assertThrows(FrameTooLongException.class,
                () -> framer.feed(bytes(big + EVENT_B)));

        assertEquals(big.length(), e.discardedBytes());
        assertEquals(1, e.completedFrames().size());
        assertEquals(EVENT_B, text(e.completedFrames().get(0)));
    }
}
