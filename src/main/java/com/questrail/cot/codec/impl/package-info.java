/**
 * Reference codec implementations.
 *
 * <h2>Framing</h2>
 * <ul>
 *   <li>{@link com.questrail.cot.codec.impl.XmlStreamFramer}: version 0, split on
 *       {@code </event>}</li>
 *   <li>{@link com.questrail.cot.codec.impl.TakStreamFramer}: version 1 stream,
 *       {@code 0xBF} + varint length</li>
 *   <li>{@link com.questrail.cot.codec.impl.AutoDetectingStreamFramer}: either, chosen
 *       per frame</li>
 * </ul>
 *
 * <p>Datagram transports need no framer: one datagram is one frame.</p>
 *
 * <h2>Serialization</h2>
 * XML is written by hand (attribute escaping only) and read with StAX. The binary
 * body is delegated to a {@link com.questrail.cot.codec.TakPayloadCodec} found with
 * {@link com.questrail.cot.codec.impl.TakPayloadCodecs}.
 */
package com.questrail.cot.codec.impl;
