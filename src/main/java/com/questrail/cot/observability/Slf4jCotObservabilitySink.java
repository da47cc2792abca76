package com.questrail.cot.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CotObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCotObservabilitySink implements CotObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCotObservabilitySink.class);

    @Override
    public void onTransportEvent(CotTransportEvent event) {
        if (event.detail() == null || event.detail().isEmpty()) {
            log.info("CoT transport {}: {}", event.kind(), event.destination());
        } else {
            log.info("CoT transport {}: {} ({})", event.kind(), event.destination(), event.detail());
        }
    }

    @Override
    public void onWorkerEvent(CotWorkerEvent event) {
        log.debug("Worker {}: {} -> {}", event.worker(), event.from(), event.to());
    }

    @Override
    public void onSecurityWarning(CotSecurityWarning warning) {
        log.warn("{}", warning.message());
    }

    @Override
    public void onFrameDropped(CotFrameDroppedEvent event) {
        if (event.reason() == CotFrameDroppedEvent.Reason.QUEUE_FULL) {
            log.warn("Queue full, dropped oldest element. Consider raising MAX_IN_QUEUE or MAX_OUT_QUEUE");
        } else {
            log.warn("Dropped {} bytes: {}", event.bytes(), event.reason());
        }
    }

    @Override
    public void onError(CotErrorEvent event) {
        log.error("CoT client error: {}", event.message(), event.cause());
    }
}
