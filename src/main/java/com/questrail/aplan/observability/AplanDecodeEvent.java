package com.questrail.aplan.observability;

import com.questrail.aplan.model.AplValue;

import java.time.Instant;

/**
 * Record describing one successful decode.
 */
public record AplanDecodeEvent(
    Instant timestamp,
    int sourceLength,
    int tokenCount,
    AplValue.Kind rootKind
) {
}
