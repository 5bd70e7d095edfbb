package com.questrail.gwyfile.observability;

import java.time.Instant;

/**
 * Summary of one container decode or encode.
 *
 * @param filename base name recorded in the container, or {@code null} if none
 * @param skipped  number of entities left out (see {@link GwyEntitySkippedEvent})
 */
public record GwyContainerEvent(
    Instant timestamp,
    String filename,
    int channels,
    int graphs,
    int skipped
) {
}
