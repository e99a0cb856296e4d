package com.questrail.pvl.validate.observability;

import java.time.Instant;

/**
 * Record describing a load or encode failure seen while validating a file.
 */
public record ValidationFailureEvent(
    Instant timestamp,
    String profile,
    String file,
    Throwable cause
) {
}
