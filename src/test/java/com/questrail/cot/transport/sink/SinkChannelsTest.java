package com.questrail.cot.transport.sink;

import com.questrail.cot.observability.CotTransportEvent;
import com.questrail.cot.observability.RecordingObservabilitySink;
import com.questrail.cot.transport.ChannelIOException;
import com.questrail.cot.transport.ChannelPair;
import com.questrail.cot.transport.Destination;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SinkChannelsTest
{
    @Test
    void logSinkWritesBytesVerbatim() {
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        ChannelPair pair = SinkChannels.log(Destination.parse("log://stdout"),
                new PrintStream(captured, true, StandardCharsets.UTF_8), sink);
        pair.writer().write("<event/>".getBytes(StandardCharsets.UTF_8));
        pair.close();

        assertEquals("<event/>", captured.toString(StandardCharsets.UTF_8));
        assertTrue(pair.reader().isEmpty());
        assertEquals(2, sink.eventsOfType(CotTransportEvent.class).size());
    }

    @Test
    void fileSinkCreatesParentsAndTruncates(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("nested/deeper/out.xml");
        Files.createDirectories(target.getParent());
        Files.writeString(target, "stale content");

        ChannelPair pair = SinkChannels.open(Destination.parse("file://" + target), new RecordingObservabilitySink());
        pair.writer().write("one".getBytes(StandardCharsets.US_ASCII));
        pair.writer().write("two".getBytes(StandardCharsets.US_ASCII));
        pair.close();

        assertEquals("onetwo", Files.readString(target));
    }

    @Test
    void fileSinkCreatesMissingDirectories(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("a/b/c.xml");

        ChannelPair pair = SinkChannels.open(Destination.parse("file://" + target), new RecordingObservabilitySink());
        pair.close();

        assertTrue(Files.exists(target));
    }

    @Test
    void writeAfterCloseFails(@TempDir Path dir) {
        Path target = dir.resolve("closed.xml");
        ChannelPair pair = SinkChannels.open(Destination.parse("file://" + target), new RecordingObservabilitySink());
        pair.close();

        assertThrows(ChannelIOException.class, () -> pair.writer().write(new byte[] {1}));
    }
}
