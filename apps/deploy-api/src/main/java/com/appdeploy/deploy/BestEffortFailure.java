package com.appdeploy.deploy;

import com.appdeploy.k8s.ControlPlaneException;

public record BestEffortFailure(
        DeploymentStage stage,
        String operation,
        String target,
        Integer statusCode,
        String reason,
        Throwable cause
) {
    public static BestEffortFailure of(DeploymentStage stage, String operation, String target, Throwable cause) {
        if (cause instanceof ControlPlaneException controlPlane) {
            return new BestEffortFailure(stage, operation, target, controlPlane.statusCode(), controlPlane.reason(),
                    cause);
        }
        return new BestEffortFailure(stage, operation, target, null,
                cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
    }

    public static BestEffortFailure status(DeploymentStage stage, String operation, String target, int statusCode,
            String reason) {
        return new BestEffortFailure(stage, operation, target, statusCode, reason, null);
    }
}
