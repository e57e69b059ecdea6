package com.appdeploy.deploy;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

public final class StepResult<T> {

    private final T value;
    private final BestEffortFailure failure;

    private StepResult(T value, BestEffortFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> StepResult<T> success(T value) {
        return new StepResult<>(value, null);
    }

    public static <T> StepResult<T> failure(BestEffortFailure failure) {
        return new StepResult<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public static <T> StepResult<T> attempt(DeploymentStage stage, String operation, String target,
            Supplier<StepResult<T>> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            return failure(BestEffortFailure.of(stage, operation, target, e));
        }
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<BestEffortFailure> failure() {
        return Optional.ofNullable(failure);
    }
}
