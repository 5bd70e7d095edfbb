package com.questrail.gwyfile.observability;

/**
 * Receives events from the container codec.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface GwyCodecObservabilitySink {
    /**
     * Called after a whole item tree has been decoded into a container.
     * @param event counts of the entities that were decoded
     */
    void onContainerDecoded(GwyContainerEvent event);

    /**
     * Called after a container has been encoded into a fresh item tree.
     * @param event counts of the entities that were written
     */
    void onContainerEncoded(GwyContainerEvent event);

    /**
     * Called when a channel or graph is left out of a decoded or encoded container.
     * @param event which entity was skipped and why
     */
    void onEntitySkipped(GwyEntitySkippedEvent event);

    /**
     * Called when a whole decode or encode fails.
     * @param event the error event
     */
    void onError(GwyErrorEvent event);
}
