package com.appdeploy.autoscaler;

import com.appdeploy.config.BackgroundExecutorProducer;
import com.appdeploy.k8s.ControlPlaneException;
import com.appdeploy.k8s.ControlPlaneGateway;
import com.appdeploy.k8s.ResourceFields;
import com.appdeploy.k8s.ResourceKind;
import com.appdeploy.spec.ResourceSpecBuilder;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Forces the scale floor of a workload's newest revision back to zero.
 * <p>
 * The autoscaler policy is created by the platform after the workload has been reconciled and its name is only
 * known once the workload status reports the revision, so the correction polls: one attempt per interval, up to
 * a fixed number of attempts. Each attempt is a scheduled task and the next one is scheduled only when the
 * previous one has finished. Failures never escape; the returned future always completes with a
 * {@link CorrectionResult}, unless the caller cancels it, which also stops further attempts.
 */
@ApplicationScoped
public class AutoscalerCorrector {

    private static final Logger LOGGER = Logger.getLogger("API.AutoscalerCorrector");

    static final String ZERO = "0";

    @Inject
    ControlPlaneGateway controlPlane;

    @Inject
    ResourceSpecBuilder specs;

    @Inject
    @Named(BackgroundExecutorProducer.BACKGROUND)
    ScheduledExecutorService scheduler;

    @ConfigProperty(name = "autoscaler.correction.max-attempts", defaultValue = "30")
    int maxAttempts = 30;

    @ConfigProperty(name = "autoscaler.correction.interval", defaultValue = "1s")
    Duration interval = Duration.ofSeconds(1);

    public CompletableFuture<CorrectionResult> correctAsync(String namespace, String workloadName) {
        CorrectionTask task = new CorrectionTask(namespace, workloadName);
        task.schedule(Duration.ZERO);
        return task.result;
    }

    Optional<CorrectionResult> attempt(String namespace, String workloadName, int attemptNumber) {
        Optional<String> revision = controlPlane.get(ResourceKind.WORKLOAD, namespace, workloadName)
                .flatMap(this::currentRevision);
        if (revision.isEmpty()) {
            LOGGER.debugf("[AUTOSCALER-WAIT] ns=%s name=%s attempt=%d revision not reported yet",
                    namespace, workloadName, attemptNumber);
            return Optional.empty();
        }
        String revisionName = revision.get();
        Optional<GenericKubernetesResource> policy =
                controlPlane.get(ResourceKind.AUTOSCALER_POLICY, namespace, revisionName);
        if (policy.isEmpty()) {
            LOGGER.debugf("[AUTOSCALER-WAIT] ns=%s revision=%s attempt=%d policy not created yet",
                    namespace, revisionName, attemptNumber);
            return Optional.empty();
        }
        String floor = Optional.ofNullable(policy.get().getMetadata())
                .map(ObjectMeta::getAnnotations)
                .map(annotations -> annotations.get(ResourceSpecBuilder.MIN_SCALE_ANNOTATION))
                .orElse(null);
        if (ZERO.equals(floor)) {
            LOGGER.infov("[AUTOSCALER-OK] ns={0} revision={1} attempt={2} scale floor already zero",
                    namespace, revisionName, attemptNumber);
            return Optional.of(new CorrectionResult(CorrectionResult.Status.ALREADY_CORRECT, attemptNumber,
                    revisionName));
        }
        controlPlane.patch(ResourceKind.AUTOSCALER_POLICY, namespace, revisionName, specs.buildScaleFloorPatch());
        LOGGER.infov("[AUTOSCALER-CORRECTED] ns={0} revision={1} attempt={2} previousFloor={3}",
                namespace, revisionName, attemptNumber, floor);
        return Optional.of(new CorrectionResult(CorrectionResult.Status.CORRECTED, attemptNumber, revisionName));
    }

    // status may still describe the previous generation right after an update
    private Optional<String> currentRevision(GenericKubernetesResource workload) {
        Optional<String> revision = ResourceFields.string(workload, "status", "latestCreatedRevisionName")
                .filter(value -> !value.isBlank());
        Long generation = Optional.ofNullable(workload.getMetadata()).map(ObjectMeta::getGeneration).orElse(null);
        if (generation == null) {
            return revision;
        }
        boolean observed = ResourceFields.number(workload, "status", "observedGeneration")
                .map(value -> value >= generation)
                .orElse(false);
        return observed ? revision : Optional.empty();
    }

    private final class CorrectionTask implements Runnable {

        private final String namespace;
        private final String workloadName;
        private final CompletableFuture<CorrectionResult> result = new CompletableFuture<>();
        private volatile ScheduledFuture<?> pending;
        private int attempts;

        private CorrectionTask(String namespace, String workloadName) {
            this.namespace = namespace;
            this.workloadName = workloadName;
            result.whenComplete((value, error) -> {
                ScheduledFuture<?> next = pending;
                if (result.isCancelled() && next != null) {
                    next.cancel(false);
                }
            });
        }

        void schedule(Duration delay) {
            try {
                pending = scheduler.schedule(this, delay.toMillis(), TimeUnit.MILLISECONDS);
                if (result.isCancelled()) {
                    pending.cancel(false);
                }
            } catch (RejectedExecutionException e) {
                LOGGER.warnf("[AUTOSCALER-CANCELLED] ns=%s name=%s attempts=%d scheduler unavailable",
                        namespace, workloadName, attempts);
                result.complete(new CorrectionResult(CorrectionResult.Status.CANCELLED, attempts, null));
            }
        }

        @Override
        public void run() {
            if (result.isDone()) {
                return;
            }
            attempts++;
            Optional<CorrectionResult> outcome = Optional.empty();
            try {
                outcome = attempt(namespace, workloadName, attempts);
            } catch (ControlPlaneException e) {
                LOGGER.warnf("[AUTOSCALER-ATTEMPT-FAILED] ns=%s name=%s attempt=%d status=%d reason=%s",
                        namespace, workloadName, attempts, e.statusCode(), e.reason());
            } catch (RuntimeException e) {
                LOGGER.warnf(e, "[AUTOSCALER-ATTEMPT-FAILED] ns=%s name=%s attempt=%d",
                        namespace, workloadName, attempts);
            }
            if (outcome.isPresent()) {
                result.complete(outcome.get());
                return;
            }
            if (attempts >= maxAttempts) {
                LOGGER.warnf("[AUTOSCALER-EXHAUSTED] ns=%s name=%s attempts=%d scale floor left as set by the platform",
                        namespace, workloadName, attempts);
                result.complete(new CorrectionResult(CorrectionResult.Status.EXHAUSTED, attempts, null));
                return;
            }
            schedule(interval);
        }
    }
}
