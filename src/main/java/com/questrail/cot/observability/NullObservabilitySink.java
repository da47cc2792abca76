package com.questrail.cot.observability;

/**
 * No-op implementation of CotObservabilitySink.
 */
public final class NullObservabilitySink implements CotObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(CotTransportEvent event) {}

    @Override
    public void onWorkerEvent(CotWorkerEvent event) {}

    @Override
    public void onSecurityWarning(CotSecurityWarning warning) {}

    @Override
    public void onFrameDropped(CotFrameDroppedEvent event) {}

    @Override
    public void onError(CotErrorEvent event) {}
}
