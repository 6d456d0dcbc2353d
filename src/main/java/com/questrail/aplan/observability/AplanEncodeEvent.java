package com.questrail.aplan.observability;

import com.questrail.aplan.model.AplValue;

import java.time.Instant;

/**
 * Record describing one successful encode.
 */
public record AplanEncodeEvent(
    Instant timestamp,
    AplValue.Kind rootKind,
    int outputLength
) {
}
