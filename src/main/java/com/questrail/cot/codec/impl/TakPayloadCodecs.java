package com.questrail.cot.codec.impl;

import com.questrail.cot.codec.TakPayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Locates an installed {@link TakPayloadCodec}.
 */
public final class TakPayloadCodecs
{
    private static final Logger log = LoggerFactory.getLogger(TakPayloadCodecs.class);

    private TakPayloadCodecs() {}

    /**
     * @return the first provider registered on the class path, if any
     */
    public static Optional<TakPayloadCodec> discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    public static Optional<TakPayloadCodec> discover(ClassLoader loader) {
        try {
            Optional<TakPayloadCodec> codec = ServiceLoader.load(TakPayloadCodec.class, loader).findFirst();
            codec.ifPresent(c -> log.debug("Using binary payload codec {}", c.getClass().getName()));
            return codec;
        } catch (ServiceConfigurationError e) {
            log.warn("Binary payload codec could not be loaded; continuing without one", e);
            return Optional.empty();
        }
    }
}
