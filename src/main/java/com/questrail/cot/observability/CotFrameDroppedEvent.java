package com.questrail.cot.observability;

import java.time.Instant;

/**
 * Data was discarded without reaching its consumer.
 *
 * @param reason why the data was dropped
 * @param bytes  number of bytes (or queued elements, for {@link Reason#QUEUE_FULL}) discarded
 */
public record CotFrameDroppedEvent(
    Instant timestamp,
    Reason reason,
    long bytes
) {
    public enum Reason {
        FRAME_TOO_LONG,
        UNDECODABLE,
        QUEUE_FULL
    }
}
