package com.questrail.aplan.observability;

/**
 * Main interface for receiving APLAN codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface AplanObservabilitySink {
    /**
     * Called after a source text has been decoded successfully.
     * @param event the decode details
     */
    void onDecoded(AplanDecodeEvent event);

    /**
     * Called after a value has been encoded successfully.
     * @param event the encode details
     */
    void onEncoded(AplanEncodeEvent event);

    /**
     * Called when decoding or encoding fails, before the failure is rethrown
     * to the caller.
     * @param event the error event
     */
    void onError(AplanErrorEvent event);
}
