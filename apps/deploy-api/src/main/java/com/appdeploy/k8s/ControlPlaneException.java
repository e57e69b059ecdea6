package com.appdeploy.k8s;

/**
 * Control-plane failure other than "not found". Carries the API server status code so it can be surfaced as is.
 */
public class ControlPlaneException extends RuntimeException {

    private final int statusCode;
    private final String reason;

    public ControlPlaneException(int statusCode, String reason, Throwable cause) {
        super("Control plane error " + statusCode + ": " + reason, cause);
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public int statusCode() {
        return statusCode;
    }

    public String reason() {
        return reason;
    }
}
