package com.questrail.gwyfile.observability;

/**
 * No-op implementation of GwyCodecObservabilitySink.
 */
public final class NullObservabilitySink implements GwyCodecObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onContainerDecoded(GwyContainerEvent event) {}

    @Override
    public void onContainerEncoded(GwyContainerEvent event) {}

    @Override
    public void onEntitySkipped(GwyEntitySkippedEvent event) {}

    @Override
    public void onError(GwyErrorEvent event) {}
}
