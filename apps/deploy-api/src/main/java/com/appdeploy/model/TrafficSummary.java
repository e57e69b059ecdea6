package com.appdeploy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrafficSummary(
        String hostname,
        Instant from,
        Instant to,
        long requests,
        long bytes,
        long visits,
        Double ttfbP50Ms,
        Double ttfbP95Ms,
        Double originP50Ms,
        Double originP95Ms,
        String message
) {
    public static TrafficSummary empty(String hostname, Instant from, Instant to, String message) {
        return new TrafficSummary(hostname, from, to, 0, 0, 0, null, null, null, null, message);
    }
}
