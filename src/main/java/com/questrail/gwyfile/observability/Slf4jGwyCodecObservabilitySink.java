package com.questrail.gwyfile.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of GwyCodecObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jGwyCodecObservabilitySink implements GwyCodecObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jGwyCodecObservabilitySink.class);

    @Override
    public void onContainerDecoded(GwyContainerEvent event) {
        log.info("Decoded container {}: {} channel(s), {} graph(s), {} skipped",
            describe(event), event.channels(), event.graphs(), event.skipped());
    }

    @Override
    public void onContainerEncoded(GwyContainerEvent event) {
        log.info("Encoded container {}: {} channel(s), {} graph(s), {} skipped",
            describe(event), event.channels(), event.graphs(), event.skipped());
    }

    @Override
    public void onEntitySkipped(GwyEntitySkippedEvent event) {
        if (event.cause() != null) {
            log.warn("Skipped {} {}: {}", event.entity(), event.id(), event.message(), event.cause());
        } else {
            log.warn("Skipped {} {}: {}", event.entity(), event.id(), event.message());
        }
    }

    @Override
    public void onError(GwyErrorEvent event) {
        log.error("GWY codec error: {}", event.message(), event.cause());
    }

    private static String describe(GwyContainerEvent event) {
        return event.filename() != null ? "'" + event.filename() + "'" : "<unnamed>";
    }
}
