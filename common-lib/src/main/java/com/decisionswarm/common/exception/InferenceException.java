package com.decisionswarm.common.exception;

/**
 * Transport-level failure talking to a regional inference endpoint: connection errors,
 * non-2xx responses, or a 2xx response without a completion in it.
 */
public class InferenceException extends RuntimeException {
    private final String region;

    public InferenceException(String region, String message) {
        super("[" + region + "] " + message);
        this.region = region;
    }

    public InferenceException(String region, String message, Throwable cause) {
        super("[" + region + "] " + message, cause);
        this.region = region;
    }

    public String getRegion() {
        return region;
    }
}
