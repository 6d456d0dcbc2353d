package com.questrail.aplan.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * Test implementation of AplanObservabilitySink that records all events.
 */
public class RecordingObservabilitySink implements AplanObservabilitySink {
    public final List<AplanDecodeEvent> decodes = new ArrayList<>();
    public final List<AplanEncodeEvent> encodes = new ArrayList<>();
    public final List<AplanErrorEvent> errors = new ArrayList<>();

    @Override
    public void onDecoded(AplanDecodeEvent event) {
        decodes.add(event);
    }

    @Override
    public void onEncoded(AplanEncodeEvent event) {
        encodes.add(event);
    }

    @Override
    public void onError(AplanErrorEvent event) {
        errors.add(event);
    }

    public void clear() {
        decodes.clear();
        encodes.clear();
        errors.clear();
    }
}
