package com.appdeploy.logs;

import com.appdeploy.deploy.AppNotFoundException;
import com.appdeploy.k8s.ControlPlaneException;
import com.appdeploy.k8s.InMemoryControlPlaneGateway;
import com.appdeploy.k8s.ResourceKind;
import com.appdeploy.model.LogResult;
import com.appdeploy.model.PodSummary;
import com.appdeploy.spec.ResourceSpecBuilder;
import com.appdeploy.spec.SpecFixtures;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LogRetrievalServiceTest {

    LogRetrievalService service;
    InMemoryControlPlaneGateway controlPlane;

    @BeforeEach
    void setUp() {
        controlPlane = new InMemoryControlPlaneGateway();
        controlPlane.put(ResourceKind.WORKLOAD, "default",
                SpecFixtures.specs().buildWorkloadSpec("shop", "img", Map.of()));
        service = new LogRetrievalService();
        service.controlPlane = controlPlane;
    }

    @Test
    void scaledToZeroAppReturnsMessage() {
        LogResult result = service.getLogs("default", "shop", 100);

        assertEquals("", result.logs());
        assertEquals("No pods found for this app. The app may not be running yet or scaled to zero.",
                result.message());
        assertNull(result.podName());
        assertEquals(Map.of(ResourceSpecBuilder.SERVICE_LABEL, "shop"), controlPlane.lastPodSelector);
    }

    @Test
    void readsNewestPodFromUserContainer() {
        controlPlane.pods.add(new PodSummary("shop-old", "default", "Running",
                Instant.parse("2024-01-01T00:00:00Z"), List.of("user-container", "queue-proxy")));
        controlPlane.pods.add(new PodSummary("shop-new", "default", "Running",
                Instant.parse("2024-01-02T00:00:00Z"), List.of("queue-proxy", "user-container")));
        controlPlane.logs.put("shop-new", "line 1\nline 2\n");

        LogResult result = service.getLogs("default", "shop", 50);

        assertEquals("shop-new", result.podName());
        assertEquals("Running", result.podStatus());
        assertEquals(50, result.tailLines());
        assertEquals("line 1\nline 2\n", result.logs());
        assertEquals(List.of("listPods:default", "readLogs:shop-new:user-container:50"),
                controlPlane.calls.subList(1, controlPlane.calls.size()));
    }

    @Test
    void pendingPodWithoutLogsReturnsMessage() {
        controlPlane.pods.add(new PodSummary("shop-1", "default", "Pending", Instant.now(), List.of("user-container")));
        controlPlane.logFailures.put("shop-1", new ControlPlaneException(400, "ContainerCreating", null));

        LogResult result = service.getLogs("default", "shop", 100);

        assertEquals("shop-1", result.podName());
        assertEquals("", result.logs());
        assertEquals("Pod is in Pending state and logs are not available yet.", result.message());
    }

    @Test
    void runningPodReadFailureIsRaised() {
        controlPlane.pods.add(new PodSummary("shop-1", "default", "Running", Instant.now(), List.of("user-container")));
        controlPlane.logFailures.put("shop-1", new ControlPlaneException(403, "Forbidden", null));

        ControlPlaneException error = assertThrows(ControlPlaneException.class,
                () -> service.getLogs("default", "shop", 100));
        assertEquals(403, error.statusCode());
    }

    @Test
    void pendingPodWithReadableLogsReturnsThem() {
        controlPlane.pods.add(new PodSummary("shop-1", "default", "Pending", Instant.now(), List.of("user-container")));
        controlPlane.logs.put("shop-1", "starting\n");

        LogResult result = service.getLogs("default", "shop", 10);

        assertEquals("starting\n", result.logs());
        assertEquals(10, result.tailLines());
        assertNull(result.message());
    }

    @Test
    void fallsBackToFirstContainer() {
        PodSummary pod = new PodSummary("p", "default", "Running", null, List.of("main", "sidecar"));

        assertEquals("main", LogRetrievalService.primaryContainer(pod));
    }

    @Test
    void unknownAppIsNotFound() {
        assertThrows(AppNotFoundException.class, () -> service.getLogs("default", "ghost", 100));
    }
}
