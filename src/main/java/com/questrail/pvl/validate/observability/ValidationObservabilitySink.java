package com.questrail.pvl.validate.observability;

/**
 * Receives failures observed by the label validator.
 * Implementations can provide logging, metrics, or collection for tests.
 */
public interface ValidationObservabilitySink {
    /**
     * Called when a profile's loader rejects a file.
     * @param event the failure details
     */
    void onLoadFailure(ValidationFailureEvent event);

    /**
     * Called when a loaded label can not be encoded by the profile's encoder.
     * @param event the failure details
     */
    void onEncodeFailure(ValidationFailureEvent event);
}
