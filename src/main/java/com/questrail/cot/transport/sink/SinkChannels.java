package com.questrail.cot.transport.sink;

import com.questrail.cot.observability.CotErrorEvent;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotTransportEvent;
import com.questrail.cot.transport.AddressException;
import com.questrail.cot.transport.ChannelPair;
import com.questrail.cot.transport.Destination;
import com.questrail.cot.transport.Scheme;
import com.questrail.cot.transport.SocketBindException;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Objects;

/**
 * Writer-only channels that never touch the network.
 *
 * <ul>
 *   <li>{@code log://stdout}, {@code log://stderr}: frames go to the process
 *       streams, which are flushed but never closed</li>
 *   <li>{@code file:///path}: frames go to a file, truncated on open; missing
 *       parent directories are created</li>
 * </ul>
 */
public final class SinkChannels
{
    private SinkChannels() {}

    public static ChannelPair open(Destination destination, CotObservabilitySink sink) {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(sink, "sink");
        if (destination.scheme() == Scheme.LOG) {
            return log(destination, "stderr".equals(destination.host()) ? System.err : System.out, sink);
        }
        if (destination.scheme() == Scheme.FILE) {
            return file(destination, Path.of(destination.host()), sink);
        }
        throw new IllegalArgumentException("Not a sink destination: " + destination);
    }

    static ChannelPair log(Destination destination, PrintStream stream, CotObservabilitySink sink) {
        StreamSinkWriter writer = new StreamSinkWriter(stream, destination.host());
        sink.onTransportEvent(new CotTransportEvent(
                Instant.now(), destination.toString(), CotTransportEvent.Kind.OPENED, ""));
        return new ChannelPair(destination, null, writer, () -> {
            stream.flush();
            sink.onTransportEvent(new CotTransportEvent(
                    Instant.now(), destination.toString(), CotTransportEvent.Kind.CLOSED, ""));
        });
    }

    static ChannelPair file(Destination destination, Path path, CotObservabilitySink sink) {
        OutputStream out;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            out = Files.newOutputStream(path,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
        } catch (SecurityException e) {
            throw new AddressException("Not allowed to write " + path, e);
        } catch (IOException e) {
            throw new SocketBindException("Cannot open " + path + " for writing", e);
        }

        StreamSinkWriter writer = new StreamSinkWriter(out, path.toString());
        sink.onTransportEvent(new CotTransportEvent(
                Instant.now(), destination.toString(), CotTransportEvent.Kind.OPENED, path.toAbsolutePath().toString()));
        return new ChannelPair(destination, null, writer, () -> {
            try {
                writer.close();
            } catch (IOException e) {
                sink.onError(new CotErrorEvent(Instant.now(), "Failed to close " + path, e));
            }
            sink.onTransportEvent(new CotTransportEvent(
                    Instant.now(), destination.toString(), CotTransportEvent.Kind.CLOSED, ""));
        });
    }
}
