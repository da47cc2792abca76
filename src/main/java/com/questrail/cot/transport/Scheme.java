package com.questrail.cot.transport;

import java.util.Locale;

/**
 * Base scheme of a destination URL, without {@code +modifiers}.
 */
public enum Scheme {
    TCP(true),
    TLS(true),
    UDP(false),
    /** Writer-only sink onto stdout or stderr. */
    LOG(false),
    /** Writer-only sink onto a local file. */
    FILE(false);

    private final boolean streamOriented;

    Scheme(boolean streamOriented) {
        this.streamOriented = streamOriented;
    }

    public boolean isStreamOriented() {
        return streamOriented;
    }

    public boolean isNetwork() {
        return this == TCP || this == TLS || this == UDP;
    }

    /**
     * @throws UnsupportedSchemeException for anything but the known names and
     *                                    {@code ssl} (an alias of {@code tls})
     */
    public static Scheme parse(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "tcp":
                return TCP;
            case "tls":
            case "ssl":
                return TLS;
            case "udp":
                return UDP;
            case "log":
                return LOG;
            case "file":
                return FILE;
            default:
                throw new UnsupportedSchemeException("Unsupported scheme: " + name);
        }
    }
}
