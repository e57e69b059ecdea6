package com.appdeploy.edge.impl;

import com.appdeploy.edge.EdgeException;
import com.appdeploy.edge.EdgeGateway;
import com.appdeploy.edge.EdgeResponse;
import com.appdeploy.model.TrafficSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class CloudflareEdgeGateway implements EdgeGateway {

    private static final Logger LOGGER = Logger.getLogger("API.CloudflareEdgeGateway");

    static final String TRAFFIC_QUERY = """
            query ($tag: string, $filter: %s) {
              viewer {
                %s(filter: {%s: $tag}) {
                  httpRequestsAdaptiveGroups(limit: 1, filter: $filter) {
                    count
                    sum { edgeResponseBytes visits }
                    quantiles {
                      edgeTimeToFirstByteMsP50
                      edgeTimeToFirstByteMsP95
                      originResponseDurationMsP50
                      originResponseDurationMsP95
                    }
                  }
                }
              }
            }
            """;

    @ConfigProperty(name = "cdn.api.url", defaultValue = "https://api.cloudflare.com/client/v4")
    String apiUrl;

    @ConfigProperty(name = "cdn.zone-id")
    Optional<String> zoneId = Optional.empty();

    @ConfigProperty(name = "cdn.account-id")
    Optional<String> accountId = Optional.empty();

    @ConfigProperty(name = "cdn.api-token")
    Optional<String> apiToken = Optional.empty();

    @ConfigProperty(name = "cdn.request-timeout", defaultValue = "10s")
    Duration requestTimeout = Duration.ofSeconds(10);

    @Inject
    ObjectMapper mapper;

    HttpClient httpClient;

    @PostConstruct
    void init() {
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        LOGGER.infov(
                "[INIT] CloudflareEdgeGateway ready. api={0} zoneConfigured={1} accountConfigured={2} tokenConfigured={3}",
                apiUrl,
                present(zoneId),
                present(accountId),
                present(apiToken));
    }

    @Override
    public boolean isConfigured() {
        return present(zoneId) && present(apiToken);
    }

    @Override
    public EdgeResponse purgeHosts(List<String> hostnames) {
        if (!isConfigured()) {
            throw new EdgeException("CDN zone or API token not configured");
        }
        String target = baseUrl() + "/zones/" + zoneId.get().trim() + "/purge_cache";
        String requestId = UUID.randomUUID().toString();
        Instant start = Instant.now();
        try {
            HttpRequest request = authorized(target)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(Map.of("hosts", hostnames))))
                    .build();
            LOGGER.infov("[COMM-START] requestId={0} target={1} action=purge hosts={2}", requestId, target, hostnames);
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            LOGGER.infov(
                    "[COMM-END] requestId={0} status={1} durationMs={2}",
                    requestId,
                    response.statusCode(),
                    Duration.between(start, Instant.now()).toMillis());
            return new EdgeResponse(response.statusCode(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.errorf(e, "[COMM-ERROR] requestId=%s target=%s purge interrupted", requestId, target);
            throw new EdgeException("Cache purge interrupted", e);
        } catch (IOException e) {
            LOGGER.errorf(e, "[COMM-ERROR] requestId=%s target=%s hosts=%s", requestId, target, hostnames);
            throw new EdgeException("Cache purge failed: " + e.getMessage(), e);
        }
    }

    @Override
    public TrafficSummary queryTraffic(Instant from, Instant to, String hostname) {
        Optional<Scope> scope = scope();
        if (scope.isEmpty()) {
            return TrafficSummary.empty(hostname, from, to, "CDN analytics not configured.");
        }
        String target = baseUrl() + "/graphql";
        String requestId = UUID.randomUUID().toString();
        Instant start = Instant.now();
        try {
            HttpRequest request = authorized(target)
                    .POST(HttpRequest.BodyPublishers.ofString(buildTrafficQuery(scope.get(), from, to, hostname)))
                    .build();
            LOGGER.infov("[COMM-START] requestId={0} target={1} action=analytics host={2} from={3} to={4}",
                    requestId, target, hostname, from, to);
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            LOGGER.infov(
                    "[COMM-END] requestId={0} status={1} durationMs={2}",
                    requestId,
                    response.statusCode(),
                    Duration.between(start, Instant.now()).toMillis());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new EdgeException("CDN analytics returned status " + response.statusCode());
            }
            return parseTraffic(scope.get(), mapper.readTree(response.body()), from, to, hostname);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.errorf(e, "[COMM-ERROR] requestId=%s target=%s analytics interrupted", requestId, target);
            throw new EdgeException("CDN analytics interrupted", e);
        } catch (IOException e) {
            LOGGER.errorf(e, "[COMM-ERROR] requestId=%s target=%s host=%s", requestId, target, hostname);
            throw new EdgeException("CDN analytics failed: " + e.getMessage(), e);
        }
    }

    String buildTrafficQuery(Scope scope, Instant from, Instant to, String hostname) throws JsonProcessingException {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("datetime_geq", from.toString());
        filter.put("datetime_lt", to.toString());
        if (hostname != null && !hostname.isBlank()) {
            filter.put("clientRequestHTTPHost", hostname);
        }
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("tag", scope.tag());
        variables.put("filter", filter);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", TRAFFIC_QUERY.formatted(scope.filterType(), scope.collection(), scope.tagField()));
        body.put("variables", variables);
        return mapper.writeValueAsString(body);
    }

    TrafficSummary parseTraffic(Scope scope, JsonNode root, Instant from, Instant to, String hostname) {
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new EdgeException("CDN analytics query rejected: " + errors.get(0).path("message").asText("unknown"));
        }
        JsonNode group = root.path("data").path("viewer").path(scope.collection())
                .path(0).path("httpRequestsAdaptiveGroups").path(0);
        if (group.isMissingNode()) {
            return TrafficSummary.empty(hostname, from, to, "No traffic recorded in this window.");
        }
        JsonNode sum = group.path("sum");
        JsonNode quantiles = group.path("quantiles");
        return new TrafficSummary(
                hostname,
                from,
                to,
                group.path("count").asLong(0),
                sum.path("edgeResponseBytes").asLong(0),
                sum.path("visits").asLong(0),
                doubleOrNull(quantiles.path("edgeTimeToFirstByteMsP50")),
                doubleOrNull(quantiles.path("edgeTimeToFirstByteMsP95")),
                doubleOrNull(quantiles.path("originResponseDurationMsP50")),
                doubleOrNull(quantiles.path("originResponseDurationMsP95")),
                null);
    }

    private Optional<Scope> scope() {
        if (!present(apiToken)) {
            return Optional.empty();
        }
        if (present(zoneId)) {
            return Optional.of(Scope.zone(zoneId.get().trim()));
        }
        return accountId.map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(Scope::account);
    }

    private HttpRequest.Builder authorized(String target) {
        return HttpRequest.newBuilder(URI.create(target))
                .header("Authorization", "Bearer " + apiToken.orElse("").trim())
                .header("Content-Type", "application/json")
                .timeout(requestTimeout);
    }

    private String baseUrl() {
        String value = apiUrl.trim();
        if (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static Double doubleOrNull(JsonNode node) {
        return node.isNumber() ? node.asDouble() : null;
    }

    private static boolean present(Optional<String> value) {
        return value.map(v -> !v.isBlank()).orElse(false);
    }

    record Scope(String collection, String tagField, String filterType, String tag) {

        static Scope zone(String zoneTag) {
            return new Scope("zones", "zoneTag", "ZoneHttpRequestsAdaptiveGroupsFilter_InputObject", zoneTag);
        }

        static Scope account(String accountTag) {
            return new Scope("accounts", "accountTag", "AccountHttpRequestsAdaptiveGroupsFilter_InputObject",
                    accountTag);
        }
    }
}
