package com.appdeploy.autoscaler;

public record CorrectionResult(Status status, int attempts, String revision) {

    public enum Status {
        CORRECTED,
        ALREADY_CORRECT,
        EXHAUSTED,
        CANCELLED
    }

    public boolean corrected() {
        return status == Status.CORRECTED || status == Status.ALREADY_CORRECT;
    }
}
