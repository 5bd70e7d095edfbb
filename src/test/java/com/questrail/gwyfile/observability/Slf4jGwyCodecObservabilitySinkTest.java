package com.questrail.gwyfile.observability;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jGwyCodecObservabilitySinkTest
{
    private final Slf4jGwyCodecObservabilitySink sink = new Slf4jGwyCodecObservabilitySink();

    @Test
    void logsEveryEventKind()
    {
        Instant now = Instant.now();

        assertDoesNotThrow(() -> {
            sink.onContainerDecoded(new GwyContainerEvent(now, "scan.gwy", 3, 2, 0));
            sink.onContainerEncoded(new GwyContainerEvent(now, null, 1, 0, 0));
            sink.onEntitySkipped(new GwyEntitySkippedEvent(now,
                    GwyEntitySkippedEvent.Entity.CHANNEL, 4, "missing title", null));
            sink.onEntitySkipped(new GwyEntitySkippedEvent(now,
                    GwyEntitySkippedEvent.Entity.GRAPH, 1, "bad curve", new IllegalStateException("boom")));
            sink.onError(new GwyErrorEvent(now, "Failed to decode container", new RuntimeException("x")));
        });
    }
}
