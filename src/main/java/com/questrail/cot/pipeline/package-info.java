/**
 * Worker/Queue Pipeline
 * =============================================================================
 *
 * <p>Moves payloads between application code and a channel pair.</p>
 *
 * <pre>
 *   application → EventQueue (tx) → TransmitWorker → encoder → ChannelWriter
 *   ChannelReader → FramedChannelReader → decoder → ReceiveWorker → EventQueue (rx) → application
 * </pre>
 *
 * <p>Each worker runs on its own thread under {@link com.questrail.cot.pipeline.CotClientRuntime}.
 * The two queues are the only state shared between threads; each has exactly one
 * producer and one consumer.</p>
 */
package com.questrail.cot.pipeline;
