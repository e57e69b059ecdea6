package com.appdeploy.edge.impl;

import com.appdeploy.edge.EdgeException;
import com.appdeploy.edge.WarmUpProbe;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class HttpWarmUpProbe implements WarmUpProbe {

    private static final Logger LOGGER = Logger.getLogger("API.HttpWarmUpProbe");

    @ConfigProperty(name = "warmup.timeout", defaultValue = "15s")
    Duration timeout = Duration.ofSeconds(15);

    HttpClient httpClient;

    @PostConstruct
    void init() {
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        LOGGER.infov("[INIT] HttpWarmUpProbe ready. timeout={0}", timeout);
    }

    @Override
    public int probe(String url) {
        Instant start = Instant.now();
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            LOGGER.infov("[COMM-END] target={0} action=warm-up status={1} durationMs={2}",
                    url, response.statusCode(), Duration.between(start, Instant.now()).toMillis());
            return response.statusCode();
        } catch (HttpTimeoutException e) {
            throw new EdgeException("Warm-up request timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EdgeException("Warm-up request interrupted", e);
        } catch (IOException e) {
            throw new EdgeException("Warm-up request failed: " + e.getMessage(), e);
        }
    }
}
