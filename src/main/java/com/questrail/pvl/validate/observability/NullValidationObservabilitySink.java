package com.questrail.pvl.validate.observability;

/**
 * No-op implementation of ValidationObservabilitySink.
 */
public final class NullValidationObservabilitySink implements ValidationObservabilitySink {
    public static final NullValidationObservabilitySink INSTANCE = new NullValidationObservabilitySink();

    private NullValidationObservabilitySink() {}

    @Override
    public void onLoadFailure(ValidationFailureEvent event) {}

    @Override
    public void onEncodeFailure(ValidationFailureEvent event) {}
}
