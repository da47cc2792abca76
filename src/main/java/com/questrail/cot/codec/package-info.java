/**
 * CoT Codec
 * =============================================================================
 *
 * <p>The codec layer turns {@link com.questrail.cot.model.CotPayload}s into wire
 * frames and back, and finds frame boundaries in byte streams. It knows nothing
 * about sockets, queues or threads.</p>
 *
 * <pre>
 *   CotEvent
 *        → CotFrameEncoder     (XML document, or binary header + body)
 *            → byte[] frame
 *                → channel
 *
 *   channel bytes
 *        → StreamFramer        (stream transports only)
 *            → byte[] frame
 *                → CotFrameDecoder
 *                    → CotEvent | RawPayload
 * </pre>
 *
 * <h2>Protocol versions</h2>
 * <ul>
 *   <li><strong>Version 0</strong>: self-delimited XML ending in {@code </event>}.</li>
 *   <li><strong>Version 1</strong>: {@code 0xBF}-prefixed binary header. Mesh
 *       (multicast) frames carry a version marker, stream frames a length. The body
 *       codec is pluggable; without one, encoding falls back to version 0 and
 *       binary frames are decoded as raw bytes.</li>
 * </ul>
 */
package com.questrail.cot.codec;
