package com.questrail.aplan.observability;

/**
 * No-op implementation of AplanObservabilitySink.
 */
public final class NullObservabilitySink implements AplanObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDecoded(AplanDecodeEvent event) {}

    @Override
    public void onEncoded(AplanEncodeEvent event) {}

    @Override
    public void onError(AplanErrorEvent event) {}
}
