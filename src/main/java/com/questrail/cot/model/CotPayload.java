package com.questrail.cot.model;

/**
 * Unit of traffic carried by the client pipeline.
 *
 * <p>Outbound, application code enqueues {@link CotEvent}s (or pre-encoded
 * {@link RawPayload}s it wants written verbatim). Inbound, the receive path
 * produces a {@link CotEvent} whenever the frame could be parsed, and a
 * {@link RawPayload} when it carries a binary protocol frame that no installed
 * codec can translate.</p>
 */
public sealed interface CotPayload permits CotEvent, RawPayload {
}
