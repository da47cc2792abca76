package com.questrail.cot.config;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * CotClientConfig
 * =============================================================================
 * Immutable key/value configuration surface read by every client component.
 *
 * <p>The raw string values are kept (so they can be merged and forwarded
 * verbatim), and typed accessors apply defaults and validation on read. Blank
 * values are treated as absent.</p>
 *
 * <p>Where the values come from (INI file, environment, command line) is the
 * caller's concern; {@link #fromMap(Map)} and {@link #fromProperties(Properties)}
 * accept whatever the caller loaded.</p>
 */
public final class CotClientConfig
{
    private static final Set<String> TRUTHY = Set.of("true", "yes", "y", "on", "1");

    private final Map<String, String> values;

    private CotClientConfig(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static CotClientConfig defaults() {
        return new CotClientConfig(Map.of());
    }

    public static CotClientConfig fromMap(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        Map<String, String> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k != null && v != null && !v.isBlank()) {
                copy.put(k, v.trim());
            }
        });
        return new CotClientConfig(copy);
    }

    public static CotClientConfig fromProperties(Properties properties) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String name : properties.stringPropertyNames()) {
            map.put(name, properties.getProperty(name));
        }
        return fromMap(map);
    }

    /**
     * Returns a config in which {@code defaults} fill every key this config does not set.
     * Keys already set here always win.
     */
    public CotClientConfig withDefaults(Map<String, String> defaults) {
        Map<String, String> merged = new LinkedHashMap<>();
        defaults.forEach((k, v) -> {
            if (k != null && v != null && !v.isBlank()) {
                merged.put(k, v.trim());
            }
        });
        merged.putAll(values);
        return new CotClientConfig(merged);
    }

    public Map<String, String> asMap() {
        return values;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String get(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public boolean isSet(String key) {
        return values.containsKey(key);
    }

    public boolean getBoolean(String key) {
        String v = values.get(key);
        return v != null && TRUTHY.contains(v.toLowerCase(Locale.ROOT));
    }

    public int getInt(String key, int defaultValue) {
        String v = values.get(key);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, was: " + v, e);
        }
    }

    public Duration getSeconds(String key, int defaultSeconds) {
        String v = values.get(key);
        if (v == null) {
            return Duration.ofSeconds(defaultSeconds);
        }
        try {
            Duration d = Duration.ofMillis(Math.round(Double.parseDouble(v) * 1000.0));
            if (d.isNegative()) {
                throw new IllegalArgumentException(key + " must be non-negative, was: " + v);
            }
            return d;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number of seconds, was: " + v, e);
        }
    }

    public Optional<Path> getPath(String key) {
        return get(key).map(Path::of);
    }

    // -------------------------------------------------------------------------
    // Typed accessors
    // -------------------------------------------------------------------------

    public String cotUrl() {
        return get(ConfigKeys.COT_URL, ConfigKeys.DEFAULT_COT_URL);
    }

    public int takProto() {
        return getInt(ConfigKeys.TAK_PROTO, ConfigKeys.DEFAULT_TAK_PROTO);
    }

    public Duration staleAfter() {
        return getSeconds(ConfigKeys.COT_STALE, ConfigKeys.DEFAULT_COT_STALE_SECONDS);
    }

    public Optional<String> hostId() {
        return get(ConfigKeys.COT_HOST_ID);
    }

    public boolean helloSuppressed() {
        return getBoolean(ConfigKeys.NO_HELLO);
    }

    public int multicastTtl() {
        int ttl = getInt(ConfigKeys.MULTICAST_TTL, ConfigKeys.DEFAULT_MULTICAST_TTL);
        if (ttl < 0 || ttl > 255) {
            throw new IllegalArgumentException(ConfigKeys.MULTICAST_TTL + " must be 0-255, was: " + ttl);
        }
        return ttl;
    }

    /**
     * @throws IllegalArgumentException if the configured value is not an IP literal
     *                                  or resolvable host name
     */
    public InetAddress multicastLocalAddress() {
        String v = get(ConfigKeys.MULTICAST_LOCAL_ADDR, ConfigKeys.DEFAULT_MULTICAST_LOCAL_ADDR);
        try {
            return InetAddress.getByName(v);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException(ConfigKeys.MULTICAST_LOCAL_ADDR + " is not resolvable: " + v, e);
        }
    }

    public IpFamily ipFamily() {
        return get(ConfigKeys.IP_FAMILY).map(IpFamily::parse).orElse(IpFamily.IPV4);
    }

    public int maxInQueue() {
        return nonNegative(ConfigKeys.MAX_IN_QUEUE, ConfigKeys.DEFAULT_MAX_IN_QUEUE);
    }

    public int maxOutQueue() {
        return nonNegative(ConfigKeys.MAX_OUT_QUEUE, ConfigKeys.DEFAULT_MAX_OUT_QUEUE);
    }

    public int maxFrameLength() {
        int v = getInt(ConfigKeys.MAX_FRAME_LENGTH, ConfigKeys.DEFAULT_MAX_FRAME_LENGTH);
        if (v <= 0) {
            throw new IllegalArgumentException(ConfigKeys.MAX_FRAME_LENGTH + " must be positive, was: " + v);
        }
        return v;
    }

    public Duration connectTimeout() {
        return getSeconds(ConfigKeys.CONNECT_TIMEOUT, ConfigKeys.DEFAULT_CONNECT_TIMEOUT_SECONDS);
    }

    public Duration tlsHandshakeTimeout() {
        return getSeconds(ConfigKeys.TLS_HANDSHAKE_TIMEOUT, ConfigKeys.DEFAULT_TLS_HANDSHAKE_TIMEOUT_SECONDS);
    }

    public Optional<Path> preferencePackage() {
        return getPath(ConfigKeys.PREF_PACKAGE);
    }

    private int nonNegative(String key, int defaultValue) {
        int v = getInt(key, defaultValue);
        if (v < 0) {
            throw new IllegalArgumentException(key + " must be non-negative, was: " + v);
        }
        return v;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CotClientConfig{");
        boolean first = true;
        for (Map.Entry<String, String> e : values.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(e.getKey()).append('=');
            sb.append(e.getKey().contains("PASSWORD") || e.getKey().contains("PASSPHRASE") ? "****" : e.getValue());
        }
        return sb.append('}').toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, String> values = new LinkedHashMap<>();

        public Builder set(String key, String value) {
            Objects.requireNonNull(key, "key");
            if (value == null || value.isBlank()) {
                values.remove(key);
            } else {
                values.put(key, value.trim());
            }
            return this;
        }

        public Builder setAll(Map<String, String> entries) {
            entries.forEach(this::set);
            return this;
        }

        public Builder withCotUrl(String url) {
            return set(ConfigKeys.COT_URL, url);
        }

        public Builder withTakProto(int version) {
            return set(ConfigKeys.TAK_PROTO, Integer.toString(version));
        }

        public Builder withHostId(String hostId) {
            return set(ConfigKeys.COT_HOST_ID, hostId);
        }

        public Builder withHelloSuppressed(boolean suppressed) {
            return set(ConfigKeys.NO_HELLO, suppressed ? "1" : null);
        }

        public Builder withMulticastTtl(int ttl) {
            return set(ConfigKeys.MULTICAST_TTL, Integer.toString(ttl));
        }

        public Builder withMulticastLocalAddress(String address) {
            return set(ConfigKeys.MULTICAST_LOCAL_ADDR, address);
        }

        public Builder withMaxInQueue(int depth) {
            return set(ConfigKeys.MAX_IN_QUEUE, Integer.toString(depth));
        }

        public Builder withMaxOutQueue(int depth) {
            return set(ConfigKeys.MAX_OUT_QUEUE, Integer.toString(depth));
        }

        public CotClientConfig build() {
            return new CotClientConfig(values);
        }
    }
}
