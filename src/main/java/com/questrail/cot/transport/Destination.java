package com.questrail.cot.transport;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Destination
 * =============================================================================
 * Parsed, immutable form of a destination URL.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   scheme[+modifier...]://host[:port]
 *   scheme[+modifier...]:host[:port]
 *   log://stdout | log://stderr
 *   file:///path/to/output
 * </pre>
 *
 * <p>Modifiers are only accepted on {@code udp}: {@code broadcast},
 * {@code wo} (write-only) and the deprecated {@code multicast}, which is
 * accepted but carries no meaning since multicast is recognized from the address.</p>
 *
 * <p>When the port is omitted, broadcast and multicast destinations default to
 * {@value #DEFAULT_BROADCAST_PORT} and every other network destination to
 * {@value #DEFAULT_PORT}. IPv6 literals go in brackets.</p>
 *
 * <p>{@code host} holds the stream name for {@code log} and the file path for
 * {@code file}; {@code port} is {@code -1} for both.</p>
 */
public record Destination(Scheme scheme, Set<Modifier> modifiers, String host, int port)
{
    public static final int DEFAULT_PORT = 8087;
    public static final int DEFAULT_BROADCAST_PORT = 6969;

    public enum Modifier {
        BROADCAST,
        WRITE_ONLY,
        /** Deprecated; multicast is inferred from the group address. */
        MULTICAST
    }

    public Destination {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        modifiers = modifiers.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Modifier.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(modifiers));
    }

    /**
     * @throws UnsupportedSchemeException if the scheme or a modifier is unknown
     * @throws AddressException           if the host or port is malformed
     */
    public static Destination parse(String url) {
        Objects.requireNonNull(url, "url");
        String text = url.trim();

        int sep = text.indexOf(':');
        if (sep <= 0) {
            throw new UnsupportedSchemeException("Destination has no scheme: " + url);
        }
        String schemePart = text.substring(0, sep).toLowerCase(Locale.ROOT);
        String rest = text.substring(sep + 1);
        if (rest.startsWith("//")) {
            rest = rest.substring(2);
        }

        String[] parts = schemePart.split("\\+");
        Scheme scheme = Scheme.parse(parts[0]);
        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        for (int i = 1; i < parts.length; i++) {
            if (scheme != Scheme.UDP) {
                throw new UnsupportedSchemeException("Scheme " + parts[0] + " takes no modifiers: " + url);
            }
            modifiers.add(modifier(parts[i], url));
        }

        switch (scheme) {
            case LOG:
                return new Destination(scheme, modifiers, logStream(rest, url), -1);
            case FILE:
                if (rest.isEmpty()) {
                    throw new AddressException("file destination has no path: " + url);
                }
                return new Destination(scheme, modifiers, rest, -1);
            default:
                return network(scheme, modifiers, rest, url);
        }
    }

    /**
     * Converts a TAK {@code connectString} ({@code host:port:proto}) into a destination.
     *
     * @throws AddressException if the string does not have three parts
     */
    public static Destination fromConnectString(String connectString) {
        return parse(connectStringToUrl(connectString));
    }

    /**
     * Rewrites {@code host:port:proto} as {@code proto://host:port}.
     *
     * @throws AddressException if the string does not have three parts
     */
    public static String connectStringToUrl(String connectString) {
        Objects.requireNonNull(connectString, "connectString");
        String[] parts = connectString.trim().split(":");
        if (parts.length != 3) {
            throw new AddressException("connectString must be host:port:proto, was: " + connectString);
        }
        return parts[2] + "://" + parts[0] + ":" + parts[1];
    }

    public boolean isWriteOnly() {
        return modifiers.contains(Modifier.WRITE_ONLY) || scheme == Scheme.LOG || scheme == Scheme.FILE;
    }

    public boolean isBroadcast() {
        return modifiers.contains(Modifier.BROADCAST);
    }

    public boolean usesDeprecatedMulticastModifier() {
        return modifiers.contains(Modifier.MULTICAST);
    }

    /**
     * {@code true} when the host is a multicast IP literal. Names are not resolved.
     */
    public boolean isMulticastLiteral() {
        return isMulticastLiteral(host);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(scheme.name().toLowerCase(Locale.ROOT));
        if (modifiers.contains(Modifier.BROADCAST)) {
            sb.append("+broadcast");
        }
        if (modifiers.contains(Modifier.WRITE_ONLY)) {
            sb.append("+wo");
        }
        if (modifiers.contains(Modifier.MULTICAST)) {
            sb.append("+multicast");
        }
        sb.append("://");
        sb.append(host.indexOf(':') >= 0 && scheme.isNetwork() ? "[" + host + "]" : host);
        if (port >= 0) {
            sb.append(':').append(port);
        }
        return sb.toString();
    }

    private static Modifier modifier(String name, String url) {
        switch (name) {
            case "broadcast":
                return Modifier.BROADCAST;
            case "wo":
                return Modifier.WRITE_ONLY;
            case "multicast":
                return Modifier.MULTICAST;
            default:
                throw new UnsupportedSchemeException("Unknown modifier '+" + name + "' in " + url);
        }
    }

    private static String logStream(String rest, String url) {
        int colon = rest.indexOf(':');
        String name = (colon >= 0 ? rest.substring(0, colon) : rest).toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            return "stdout";
        }
        if (!name.equals("stdout") && !name.equals("stderr")) {
            throw new AddressException("log destination must be stdout or stderr: " + url);
        }
        return name;
    }

    private static Destination network(Scheme scheme, Set<Modifier> modifiers, String rest, String url) {
        int slash = rest.indexOf('/');
        String authority = slash >= 0 ? rest.substring(0, slash) : rest;

        String host;
        String portText = null;
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            if (close < 0) {
                throw new AddressException("Unterminated IPv6 literal: " + url);
            }
            host = authority.substring(1, close);
            String tail = authority.substring(close + 1);
            if (tail.startsWith(":")) {
                portText = tail.substring(1);
            } else if (!tail.isEmpty()) {
                throw new AddressException("Unexpected text after IPv6 literal: " + url);
            }
        } else {
            int colon = authority.lastIndexOf(':');
            if (colon >= 0) {
                host = authority.substring(0, colon);
                portText = authority.substring(colon + 1);
            } else {
                host = authority;
            }
        }
        if (host.isEmpty()) {
            throw new AddressException("Destination has no host: " + url);
        }

        int port;
        if (portText == null || portText.isEmpty()) {
            boolean mesh = scheme == Scheme.UDP
                    && (modifiers.contains(Modifier.BROADCAST) || isMulticastLiteral(host));
            port = mesh ? DEFAULT_BROADCAST_PORT : DEFAULT_PORT;
        } else {
            try {
                port = Integer.parseInt(portText);
            } catch (NumberFormatException e) {
                throw new AddressException("Port is not a number: " + url, e);
            }
            if (port < 1 || port > 65535) {
                throw new AddressException("Port out of range: " + url);
            }
        }
        return new Destination(scheme, modifiers, host, port);
    }

    static boolean isMulticastLiteral(String host) {
        if (host.indexOf(':') >= 0) {
            return host.toLowerCase(Locale.ROOT).startsWith("ff");
        }
        String[] octets = host.split("\\.");
        if (octets.length != 4) {
            return false;
        }
        try {
            int first = Integer.parseInt(octets[0]);
            return first >= 224 && first <= 239;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
