package com.appdeploy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogResult(
        String name,
        String namespace,
        String podName,
        String podStatus,
        Integer tailLines,
        String logs,
        String message
) {
    public static LogResult noPods(String name, String namespace) {
        return new LogResult(name, namespace, null, null, null, "",
                "No pods found for this app. The app may not be running yet or scaled to zero.");
    }
}
