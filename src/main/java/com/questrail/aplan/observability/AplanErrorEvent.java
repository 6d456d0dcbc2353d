package com.questrail.aplan.observability;

import java.time.Instant;

/**
 * Record representing a decode or encode failure.
 */
public record AplanErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
