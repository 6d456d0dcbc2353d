package com.questrail.aplan.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of AplanObservabilitySink that emits logs via SLF4J.
 *
 * <p>Successful decodes and encodes are logged at DEBUG. Failures are logged at
 * WARN: they are caller input problems, not faults of the library.</p>
 */
public final class Slf4jAplanObservabilitySink implements AplanObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jAplanObservabilitySink.class);

    @Override
    public void onDecoded(AplanDecodeEvent event) {
        log.debug("APLAN decoded {} chars ({} tokens) into {}",
            event.sourceLength(),
            event.tokenCount(),
            event.rootKind());
    }

    @Override
    public void onEncoded(AplanEncodeEvent event) {
        log.debug("APLAN encoded {} into {} chars",
            event.rootKind(),
            event.outputLength());
    }

    @Override
    public void onError(AplanErrorEvent event) {
        log.warn("APLAN Error: {}", event.message(), event.cause());
    }
}
