package com.appdeploy.logs;

import com.appdeploy.deploy.AppNotFoundException;
import com.appdeploy.k8s.ControlPlaneException;
import com.appdeploy.k8s.ControlPlaneGateway;
import com.appdeploy.k8s.ResourceKind;
import com.appdeploy.model.LogResult;
import com.appdeploy.model.PodSummary;
import com.appdeploy.spec.ResourceSpecBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

@ApplicationScoped
public class LogRetrievalService {

    private static final Logger LOGGER = Logger.getLogger("API.LogRetrievalService");

    static final String USER_CONTAINER = "user-container";
    static final Set<String> READABLE_PHASES = Set.of("Running", "Succeeded");

    @Inject
    ControlPlaneGateway controlPlane;

    public LogResult getLogs(String namespace, String name, int tailLines) {
        if (controlPlane.get(ResourceKind.WORKLOAD, namespace, name).isEmpty()) {
            throw new AppNotFoundException(name, namespace);
        }
        List<PodSummary> pods = controlPlane.listPods(namespace, Map.of(ResourceSpecBuilder.SERVICE_LABEL, name));
        if (pods.isEmpty()) {
            return LogResult.noPods(name, namespace);
        }
        PodSummary latest = pods.stream()
                .max(Comparator.comparing(PodSummary::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                .orElseThrow();
        String container = primaryContainer(latest);

        try {
            String logs = controlPlane.readLogs(namespace, latest.name(), container, tailLines);
            return new LogResult(name, namespace, latest.name(), latest.phase(), tailLines, logs, null);
        } catch (ControlPlaneException e) {
            if (READABLE_PHASES.contains(latest.phase())) {
                throw e;
            }
            LOGGER.infof("Logs of pod %s (%s) not readable yet: %d %s", latest.name(), latest.phase(),
                    e.statusCode(), e.reason());
            return new LogResult(name, namespace, latest.name(), latest.phase(), null, "",
                    "Pod is in " + latest.phase() + " state and logs are not available yet.");
        }
    }

    static String primaryContainer(PodSummary pod) {
        List<String> containers = Optional.ofNullable(pod.containers()).orElse(List.of());
        if (containers.contains(USER_CONTAINER)) {
            return USER_CONTAINER;
        }
        return containers.isEmpty() ? null : containers.get(0);
    }
}
