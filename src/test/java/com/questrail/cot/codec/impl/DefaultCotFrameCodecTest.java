package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.ProtocolVersion;
import com.questrail.cot.codec.TakProtoVariant;
import com.questrail.cot.model.CotEvent;
import com.questrail.cot.model.CotEvents;
import com.questrail.cot.model.CotPayload;
import com.questrail.cot.model.CotPoint;
import com.questrail.cot.model.RawPayload;
import com.questrail.cot.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DefaultCotFrameCodecTest
{
    private final ManualWallClock clock = new ManualWallClock(Instant.parse("2024-05-01T12:00:00.5Z"));

    // ---------------------------------------------------------------------
    // Version 0
    // ---------------------------------------------------------------------

    @Test
    void xmlRoundTripPreservesEvent() {
        DefaultCotFrameEncoder encoder = new DefaultCotFrameEncoder();
        DefaultCotFrameDecoder decoder = new DefaultCotFrameDecoder();

        CotEvent event = CotEvents.event("unit-1", new CotPoint(38.5, -77.25, 12.0, 5.0, 7.5),
                Duration.ofMinutes(2), "Alpha & Bravo", clock);

        byte[] frame = encoder.encode(event, ProtocolVersion.V0_XML, TakProtoVariant.STREAM);
        CotPayload decoded = decoder.decode(frame, ProtocolVersion.V0_XML);

        assertEquals(event, decoded);
    }

    @Test
    void xmlFrameHasDeclarationAndEndsWithEndTag() {
        byte[] frame = new DefaultCotFrameEncoder().encode(
                CotEvents.hello("h", clock), ProtocolVersion.V0_XML, TakProtoVariant.STREAM);
        String xml = new String(frame, StandardCharsets.UTF_8);

        assertTrue(xml.startsWith(XmlEventWriter.DECLARATION + "\n<event version=\"2.0\""));
        assertTrue(xml.endsWith("</event>"));
    }

    @Test
    void eventWithoutPointOrDetailRoundTrips() {
        CotEvent pong = CotEvents.takPong(clock);
        byte[] frame = new DefaultCotFrameEncoder().encode(pong, ProtocolVersion.V0_XML, TakProtoVariant.STREAM);

        assertFalse(new String(frame, StandardCharsets.UTF_8).contains("<point"));
        assertEquals(pong, new DefaultCotFrameDecoder().decode(frame, ProtocolVersion.V0_XML));
    }

    @Test
    void emptyDetailRoundTrips() {
        CotEvent event = CotEvent.builder(clock).uid("u").detail("").build();
        byte[] frame = new DefaultCotFrameEncoder().encode(event, ProtocolVersion.V0_XML, TakProtoVariant.STREAM);

        assertTrue(new String(frame, StandardCharsets.UTF_8).contains("<detail/>"));
        assertEquals("", ((CotEvent) new DefaultCotFrameDecoder().decode(frame, ProtocolVersion.V0_XML)).detail());
    }

    @Test
    void missingAttributesFallBackToDefaults() {
        String xml = "<event type=\"a-f-G\" uid=\"x\" time=\"2024-01-01T00:00:00Z\" stale=\"2024-01-01T00:01:00Z\">"
                + "<point lat=\"1.5\" lon=\"2.5\"/></event>";
        CotEvent event = (CotEvent) new DefaultCotFrameDecoder().decode(
                xml.getBytes(StandardCharsets.UTF_8), ProtocolVersion.V0_XML);

        assertEquals("", event.how());
        assertEquals(event.time(), event.start());
        assertEquals(CotPoint.UNKNOWN, event.point().ce());
        assertNull(event.detail());
    }

    @Test
    void malformedXmlBecomesRawPayload() {
        byte[] junk = "<event uid=\"no-type\"></event>".getBytes(StandardCharsets.UTF_8);
        CotPayload payload = new DefaultCotFrameDecoder().decode(junk, ProtocolVersion.V0_XML);

        assertEquals(new RawPayload(junk), payload);
    }

    @Test
    void externalEntitiesAreNotResolved() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE e [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
                + "<event type=\"t\" uid=\"&x;\" time=\"2024-01-01T00:00:00Z\" stale=\"2024-01-01T00:01:00Z\"/>";
        CotPayload payload = new DefaultCotFrameDecoder().decode(xml.getBytes(StandardCharsets.UTF_8), ProtocolVersion.V0_XML);

        if (payload instanceof CotEvent event) {
            assertFalse(event.uid().contains("root:"));
        }
    }

    @Test
    void rawPayloadIsWrittenUnchanged() {
        byte[] bytes = {1, 2, 3};
        assertArrayEquals(bytes, new DefaultCotFrameEncoder().encode(
                new RawPayload(bytes), ProtocolVersion.V1_TAK, TakProtoVariant.MESH));
    }

    // ---------------------------------------------------------------------
    // Version 1
    // ---------------------------------------------------------------------

    @Test
    void binaryWithoutCodecFallsBackToXml() {
        CotEvent event = CotEvents.hello("h", clock);
        byte[] frame = new DefaultCotFrameEncoder(null).encode(event, ProtocolVersion.V1_TAK, TakProtoVariant.MESH);

        assertEquals('<', frame[0]);
    }

    @Test
    void meshFrameCarriesVersionMarker() {
        CotEvent event = CotEvents.hello("h", clock);
        byte[] frame = new DefaultCotFrameEncoder(new XmlBodyTakPayloadCodec())
                .encode(event, ProtocolVersion.V1_TAK, TakProtoVariant.MESH);

        assertEquals((byte) 0xBF, frame[0]);
        assertEquals(0x01, frame[1]);
        assertEquals((byte) 0xBF, frame[2]);
        assertEquals(event, new DefaultCotFrameDecoder(new XmlBodyTakPayloadCodec()).decode(frame, ProtocolVersion.V1_TAK));
    }

    @Test
    void streamFrameCarriesLength() {
        CotEvent event = CotEvents.hello("h", clock);
        byte[] body = XmlEventWriter.toBytes(event);
        byte[] frame = new DefaultCotFrameEncoder(new XmlBodyTakPayloadCodec())
                .encode(event, ProtocolVersion.V1_TAK, TakProtoVariant.STREAM);

        long[] varint = TakProtocolFraming.readVarint(frame, 1);
        assertNotNull(varint);
        assertEquals(body.length, varint[0]);
        assertEquals(1 + varint[1] + body.length, frame.length);
        assertEquals(event, new DefaultCotFrameDecoder(new XmlBodyTakPayloadCodec()).decode(frame, ProtocolVersion.V0_XML));
    }

    @Test
    void binaryFrameWithoutCodecIsRaw() {
        byte[] frame = TakProtocolFraming.wrap(new byte[] {9, 9, 9}, TakProtoVariant.STREAM);
        assertEquals(new RawPayload(frame), new DefaultCotFrameDecoder(null).decode(frame, ProtocolVersion.V1_TAK));
    }

    @Test
    void undecodableBinaryBodyIsRaw() {
        byte[] frame = TakProtocolFraming.wrap("not xml".getBytes(StandardCharsets.UTF_8), TakProtoVariant.MESH);
        assertEquals(new RawPayload(frame),
                new DefaultCotFrameDecoder(new XmlBodyTakPayloadCodec()).decode(frame, ProtocolVersion.V1_TAK));
    }

    @Test
    void codecIsDiscoveredFromServiceRegistration() {
        assertInstanceOf(XmlBodyTakPayloadCodec.class, TakPayloadCodecs.discover().orElseThrow());
    }
}
