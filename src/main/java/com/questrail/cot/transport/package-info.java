/**
 * CoT Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between the event pipeline and the network.
 * A {@link com.questrail.cot.transport.Destination} names where events go; a
 * {@link com.questrail.cot.transport.TransportResolver} turns it into a
 * {@link com.questrail.cot.transport.ChannelPair} of byte-level reader and
 * writer.</p>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>Everything above this package sees payloads as {@code byte[]} only.</li>
 *   <li>Netty types stay inside {@code transport.netty}.</li>
 *   <li>Channels do no framing and no decoding; stream re-framing happens in the
 *       pipeline.</li>
 *   <li>Channels never reconnect. A dead channel surfaces as
 *       {@link com.questrail.cot.transport.ChannelIOException}.</li>
 * </ul>
 */
package com.questrail.cot.transport;
