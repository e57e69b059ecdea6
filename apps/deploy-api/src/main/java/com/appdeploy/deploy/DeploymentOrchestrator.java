package com.appdeploy.deploy;

import com.appdeploy.autoscaler.AutoscalerCorrector;
import com.appdeploy.autoscaler.CorrectionResult;
import com.appdeploy.edge.EdgeGateway;
import com.appdeploy.edge.EdgeResponse;
import com.appdeploy.edge.WarmUpProbe;
import com.appdeploy.k8s.ControlPlaneException;
import com.appdeploy.k8s.ControlPlaneGateway;
import com.appdeploy.k8s.ResourceFields;
import com.appdeploy.k8s.ResourceKind;
import com.appdeploy.k8s.UpsertResult;
import com.appdeploy.model.DeletionAck;
import com.appdeploy.model.DeploymentOutcome;
import com.appdeploy.model.DeploymentRequest;
import com.appdeploy.spec.ResourceSpecBuilder;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Converges one application to the requested image and runs the post-deploy steps.
 * <p>
 * Only the upsert of the workload (and, on delete, its removal) may fail a request. Domain mappings, autoscaler
 * correction, cache purge and warm-up are best-effort: each returns a {@link StepResult} that is settled in
 * {@link #settle(String, StepResult)} and never propagated.
 * <p>
 * An existing domain mapping is never re-pointed. Deleting an app leaves its custom-domain mappings in place and
 * only reports them in the log.
 */
@ApplicationScoped
public class DeploymentOrchestrator {

    private static final Logger LOGGER = Logger.getLogger("API.DeploymentOrchestrator");

    @Inject
    ControlPlaneGateway controlPlane;

    @Inject
    EdgeGateway edge;

    @Inject
    WarmUpProbe warmUp;

    @Inject
    ResourceSpecBuilder specs;

    @Inject
    AutoscalerCorrector corrector;

    @ConfigProperty(name = "deploy.default-namespace", defaultValue = "default")
    String defaultNamespace = "default";

    @ConfigProperty(name = "cdn.purge.propagation-delay", defaultValue = "3s")
    Duration propagationDelay = Duration.ofSeconds(3);

    @PostConstruct
    void init() {
        LOGGER.infov(
                "[INIT] DeploymentOrchestrator ready. defaultNamespace={0} propagationDelay={1} cdnConfigured={2}",
                defaultNamespace,
                propagationDelay,
                edge != null && edge.isConfigured());
    }

    public String resolveNamespace(String namespace) {
        return namespace == null || namespace.isBlank() ? defaultNamespace : namespace;
    }

    public DeploymentOutcome deploy(DeploymentRequest request) {
        String requestId = UUID.randomUUID().toString();
        String namespace = resolveNamespace(request.namespace());
        String name = request.name();
        Instant start = Instant.now();
        LOGGER.infov("[DEPLOY-START] requestId={0} ns={1} name={2} image={3} customDomain={4}",
                requestId, namespace, name, request.image(), request.customDomain());

        GenericKubernetesResource desired = specs.buildWorkloadSpec(name, request.image(), request.environment());
        logStep(requestId, DeploymentStage.SPEC_BUILT, name);

        UpsertResult upsert;
        try {
            upsert = controlPlane.createOrReplace(ResourceKind.WORKLOAD, namespace, name, desired);
        } catch (ControlPlaneException e) {
            LOGGER.errorf(e, "[DEPLOY-ERROR] requestId=%s stage=%s ns=%s name=%s status=%d reason=%s",
                    requestId, DeploymentStage.UPSERTED, namespace, name, e.statusCode(), e.reason());
            throw e;
        }
        logStep(requestId, DeploymentStage.UPSERTED, name + " action=" + upsert.action().wireValue());

        List<String> hostnames = hostnamesOf(request);
        for (String hostname : hostnames) {
            settle(requestId, ensureDomainMapping(namespace, name, hostname));
        }
        logStep(requestId, DeploymentStage.DOMAIN_RECONCILED, String.join(",", hostnames));

        settle(requestId, startAutoscalerCorrection(requestId, namespace, name));

        if (edge.isConfigured()) {
            for (String hostname : hostnames) {
                settle(requestId, purge(hostname));
            }
            logStep(requestId, DeploymentStage.CACHE_PURGED, String.join(",", hostnames));
            waitForPropagation(requestId);
        } else {
            LOGGER.infov("[STEP-SKIPPED] requestId={0} stage={1} reason=CDN not configured",
                    requestId, DeploymentStage.CACHE_PURGED);
        }

        String primaryUrl = specs.primaryUrl(name);
        settle(requestId, warmUp(primaryUrl));

        String secondaryUrl = request.hasCustomDomain() ? ResourceSpecBuilder.urlOf(request.customDomain()) : null;
        LOGGER.infov("[DEPLOY-SUCCESS] requestId={0} ns={1} name={2} action={3} url={4} durationMs={5}",
                requestId, namespace, name, upsert.action().wireValue(), primaryUrl,
                Duration.between(start, Instant.now()).toMillis());
        return DeploymentOutcome.success(name, namespace, upsert.action(), primaryUrl, secondaryUrl);
    }

    public DeletionAck delete(String namespace, String name) {
        String requestId = UUID.randomUUID().toString();
        String ns = resolveNamespace(namespace);
        LOGGER.infov("[DELETE-START] requestId={0} ns={1} name={2}", requestId, ns, name);
        if (controlPlane.get(ResourceKind.WORKLOAD, ns, name).isEmpty()) {
            throw new AppNotFoundException(name, ns);
        }

        String primaryHost = specs.primaryHostname(name);
        settle(requestId, StepResult.attempt(DeploymentStage.MAPPING_REMOVED, "delete-domain-mapping", primaryHost,
                () -> StepResult.success(controlPlane.delete(ResourceKind.DOMAIN_MAPPING, ns, primaryHost))));
        reportRetainedMappings(requestId, ns, name, primaryHost);

        boolean removed;
        try {
            removed = controlPlane.delete(ResourceKind.WORKLOAD, ns, name);
        } catch (ControlPlaneException e) {
            LOGGER.errorf(e, "[DELETE-ERROR] requestId=%s stage=%s ns=%s name=%s status=%d reason=%s",
                    requestId, DeploymentStage.WORKLOAD_REMOVED, ns, name, e.statusCode(), e.reason());
            throw e;
        }
        if (!removed) {
            throw new AppNotFoundException(name, ns);
        }
        LOGGER.infov("[DELETE-SUCCESS] requestId={0} ns={1} name={2}", requestId, ns, name);
        return DeletionAck.deleted(name, ns);
    }

    List<String> hostnamesOf(DeploymentRequest request) {
        List<String> hostnames = new ArrayList<>();
        hostnames.add(specs.primaryHostname(request.name()));
        if (request.hasCustomDomain() && !hostnames.contains(request.customDomain())) {
            hostnames.add(request.customDomain());
        }
        return hostnames;
    }

    private StepResult<Boolean> ensureDomainMapping(String namespace, String name, String hostname) {
        return StepResult.attempt(DeploymentStage.DOMAIN_RECONCILED, "ensure-domain-mapping", hostname, () -> {
            if (controlPlane.get(ResourceKind.DOMAIN_MAPPING, namespace, hostname).isPresent()) {
                LOGGER.infov("DomainMapping already exists: {0}", hostname);
                return StepResult.success(false);
            }
            LOGGER.infov("Creating DomainMapping: {0} -> {1}", hostname, name);
            controlPlane.create(ResourceKind.DOMAIN_MAPPING, namespace,
                    specs.buildDomainMappingSpec(hostname, name, namespace));
            return StepResult.success(true);
        });
    }

    private StepResult<CompletableFuture<CorrectionResult>> startAutoscalerCorrection(String requestId,
            String namespace, String name) {
        return StepResult.attempt(DeploymentStage.AUTOSCALER_CORRECTING, "schedule-correction", name, () -> {
            CompletableFuture<CorrectionResult> correction = corrector.correctAsync(namespace, name);
            correction.thenAccept(result -> LOGGER.infov(
                    "[STEP-END] requestId={0} stage={1} target={2} result={3} attempts={4}",
                    requestId, DeploymentStage.AUTOSCALER_CORRECTING, name, result.status(), result.attempts()));
            return StepResult.success(correction);
        });
    }

    private StepResult<EdgeResponse> purge(String hostname) {
        return StepResult.attempt(DeploymentStage.CACHE_PURGED, "purge-cache", hostname, () -> {
            EdgeResponse response = edge.purgeHosts(List.of(hostname));
            if (!response.isSuccessful()) {
                return StepResult.failure(BestEffortFailure.status(DeploymentStage.CACHE_PURGED, "purge-cache",
                        hostname, response.statusCode(), abbreviate(response.body())));
            }
            return StepResult.success(response);
        });
    }

    // heuristic only: edge nodes may still serve stale content after the delay
    private void waitForPropagation(String requestId) {
        if (propagationDelay.isZero() || propagationDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(propagationDelay.toMillis());
            logStep(requestId, DeploymentStage.PROPAGATION_WAIT, propagationDelay.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warnf("[STEP-FAILED] requestId=%s stage=%s reason=interrupted", requestId,
                    DeploymentStage.PROPAGATION_WAIT);
        }
    }

    private StepResult<Integer> warmUp(String url) {
        return StepResult.attempt(DeploymentStage.WARMED_UP, "warm-up", url,
                () -> StepResult.success(warmUp.probe(url)));
    }

    private void reportRetainedMappings(String requestId, String namespace, String name, String primaryHost) {
        StepResult<List<String>> retained = StepResult.attempt(DeploymentStage.MAPPING_REMOVED,
                "list-domain-mappings", name, () -> StepResult.success(
                        controlPlane.list(ResourceKind.DOMAIN_MAPPING, namespace).stream()
                                .filter(mapping -> name.equals(
                                        ResourceFields.string(mapping, "spec", "ref", "name").orElse(null)))
                                .map(mapping -> mapping.getMetadata().getName())
                                .filter(host -> !primaryHost.equals(host))
                                .toList()));
        settle(requestId, retained)
                .filter(hosts -> !hosts.isEmpty())
                .ifPresent(hosts -> LOGGER.warnf(
                        "[DELETE-NOTICE] requestId=%s ns=%s name=%s custom domain mappings left in place: %s",
                        requestId, namespace, name, hosts));
    }

    /**
     * The single place where best-effort failures end: logged with their context, then discarded.
     */
    <T> Optional<T> settle(String requestId, StepResult<T> result) {
        result.failure().ifPresent(failure -> LOGGER.warnf(
                "[STEP-FAILED] requestId=%s stage=%s operation=%s target=%s status=%s reason=%s",
                requestId,
                failure.stage(),
                failure.operation(),
                failure.target(),
                failure.statusCode() != null ? failure.statusCode() : "-",
                failure.reason()));
        return result.value();
    }

    private void logStep(String requestId, DeploymentStage stage, String target) {
        LOGGER.infov("[STEP-END] requestId={0} stage={1} target={2}", requestId, stage, target);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
