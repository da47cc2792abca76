package com.questrail.cot.observability;

import java.time.Instant;

/**
 * Channel lifecycle notification.
 *
 * @param destination the destination URL the channel belongs to
 * @param kind        what happened
 * @param detail      free-form description (local address, variant); may be empty
 */
public record CotTransportEvent(
    Instant timestamp,
    String destination,
    Kind kind,
    String detail
) {
    public enum Kind {
        OPENED,
        TLS_ESTABLISHED,
        CLOSED
    }
}
