package com.questrail.cot.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * W3C XML Schema {@code dateTime} handling for CoT timestamps.
 *
 * <p>Output always carries six fractional digits and a literal {@code Z}. Input is
 * parsed leniently (any number of fractional digits, or none), because peers differ.</p>
 */
public final class CotTime
{
    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private CotTime() {}

    public static String format(Instant instant) {
        return FORMAT.format(instant);
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not an ISO-8601 UTC instant
     */
    public static Instant parse(String text) {
        try {
            return DateTimeFormatter.ISO_INSTANT.parse(text, Instant::from);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid CoT timestamp: " + text, e);
        }
    }

    /**
     * Truncates to the precision that survives {@link #format(Instant)}.
     */
    public static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS);
    }
}
