package com.questrail.gwyfile.observability;

import java.time.Instant;

/**
 * Record representing a failed container decode or encode.
 */
public record GwyErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
