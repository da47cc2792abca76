package com.questrail.cot.observability;

/**
 * Process-wide diagnostics sink for the client stack.
 *
 * <p>Create one instance at startup and hand the same reference to every component
 * (resolver, TLS builder, importer, runtime). Implementations can provide logging,
 * metrics, or tracing, and must tolerate calls from several worker threads.</p>
 */
public interface CotObservabilitySink {
    /**
     * Called when a channel is opened, upgraded to TLS, or closed.
     */
    void onTransportEvent(CotTransportEvent event);

    /**
     * Called when a worker changes state.
     */
    void onWorkerEvent(CotWorkerEvent event);

    /**
     * Called when a verification step is disabled or a deprecated form is used.
     */
    void onSecurityWarning(CotSecurityWarning warning);

    /**
     * Called when inbound or outbound data is discarded.
     */
    void onFrameDropped(CotFrameDroppedEvent event);

    /**
     * Called when an error or anomaly occurs in the client stack.
     */
    void onError(CotErrorEvent event);
}
