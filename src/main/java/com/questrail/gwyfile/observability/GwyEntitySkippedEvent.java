package com.questrail.gwyfile.observability;

import java.time.Instant;

/**
 * Record of a channel or graph that was left out of a container.
 */
public record GwyEntitySkippedEvent(
    Instant timestamp,
    Entity entity,
    int id,
    String message,
    Throwable cause
) {
    public enum Entity {
        CHANNEL,
        GRAPH
    }
}
