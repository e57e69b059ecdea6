package com.appdeploy.model;

import java.time.Instant;
import java.util.List;

public record PodSummary(
        String name,
        String namespace,
        String phase,
        Instant createdAt,
        List<String> containers
) {
}
