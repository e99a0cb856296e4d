package com.questrail.pvl.validate.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ValidationObservabilitySink that emits logs via SLF4J.
 *
 * <p>Failures are expected outcomes of validation, so the stack trace is only
 * attached at DEBUG.</p>
 */
public final class Slf4jValidationObservabilitySink implements ValidationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jValidationObservabilitySink.class);

    @Override
    public void onLoadFailure(ValidationFailureEvent event) {
        log.error("{} load error {} {}", event.profile(), event.file(), message(event));
        log.debug("{} load failure cause", event.profile(), event.cause());
    }

    @Override
    public void onEncodeFailure(ValidationFailureEvent event) {
        log.error("{} encode error {} {}", event.profile(), event.file(), message(event));
        log.debug("{} encode failure cause", event.profile(), event.cause());
    }

    private static String message(ValidationFailureEvent event) {
        Throwable cause = event.cause();
        return cause == null ? "" : cause.getMessage();
    }
}
