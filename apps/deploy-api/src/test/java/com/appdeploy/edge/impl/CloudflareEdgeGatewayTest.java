package com.appdeploy.edge.impl;

import com.appdeploy.edge.EdgeException;
import com.appdeploy.edge.EdgeResponse;
import com.appdeploy.model.TrafficSummary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CloudflareEdgeGatewayTest {

    static final Instant FROM = Instant.parse("2024-05-01T00:00:00Z");
    static final Instant TO = Instant.parse("2024-05-02T00:00:00Z");

    CloudflareEdgeGateway gateway;
    HttpClient httpClient;
    HttpResponse<String> response;

    @BeforeEach
    void setUp() {
        gateway = new CloudflareEdgeGateway();
        gateway.mapper = new ObjectMapper();
        gateway.apiUrl = "https://cdn.test/client/v4/";
        gateway.zoneId = Optional.of("zone-1");
        gateway.accountId = Optional.empty();
        gateway.apiToken = Optional.of("secret");
        gateway.requestTimeout = Duration.ofSeconds(2);
        httpClient = mock(HttpClient.class);
        gateway.httpClient = httpClient;
        response = mock();
    }

    @Test
    void configuredOnlyWithZoneAndToken() {
        assertTrue(gateway.isConfigured());

        gateway.apiToken = Optional.of("  ");
        assertFalse(gateway.isConfigured());

        gateway.apiToken = Optional.of("secret");
        gateway.zoneId = Optional.empty();
        assertFalse(gateway.isConfigured());
    }

    @Test
    void purgePostsToZoneEndpoint() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"success\":true}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        EdgeResponse result = gateway.purgeHosts(List.of("shop.apps.example.com"));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertTrue(result.isSuccessful());
        assertEquals(URI.create("https://cdn.test/client/v4/zones/zone-1/purge_cache"), request.getValue().uri());
        assertEquals("POST", request.getValue().method());
        assertEquals(Optional.of("Bearer secret"), request.getValue().headers().firstValue("Authorization"));
    }

    @Test
    void purgeRejectionIsReturnedNotThrown() throws Exception {
        when(response.statusCode()).thenReturn(403);
        when(response.body()).thenReturn("{\"success\":false}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        EdgeResponse result = gateway.purgeHosts(List.of("shop.apps.example.com"));

        assertEquals(403, result.statusCode());
        assertFalse(result.isSuccessful());
    }

    @Test
    void purgeTransportErrorBecomesEdgeException() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(EdgeException.class, () -> gateway.purgeHosts(List.of("shop.apps.example.com")));
    }

    @Test
    void purgeWithoutConfigurationFailsFast() throws Exception {
        gateway.zoneId = Optional.empty();

        assertThrows(EdgeException.class, () -> gateway.purgeHosts(List.of("shop.apps.example.com")));
        verify(httpClient, never()).send(any(HttpRequest.class), any());
    }

    @Test
    void trafficWithoutCredentialsIsEmptySummary() {
        gateway.apiToken = Optional.empty();

        TrafficSummary summary = gateway.queryTraffic(FROM, TO, "shop.apps.example.com");

        assertEquals(0, summary.requests());
        assertEquals("CDN analytics not configured.", summary.message());
    }

    @Test
    void trafficQueryIsScopedToZoneAndHost() throws Exception {
        CloudflareEdgeGateway.Scope scope = CloudflareEdgeGateway.Scope.zone("zone-1");

        JsonNode body = gateway.mapper.readTree(gateway.buildTrafficQuery(scope, FROM, TO, "shop.apps.example.com"));

        assertTrue(body.path("query").asText().contains("zones(filter: {zoneTag: $tag})"));
        assertTrue(body.path("query").asText().contains("$filter: ZoneHttpRequestsAdaptiveGroupsFilter_InputObject"));
        assertEquals("zone-1", body.path("variables").path("tag").asText());
        assertEquals("2024-05-01T00:00:00Z", body.path("variables").path("filter").path("datetime_geq").asText());
        assertEquals("shop.apps.example.com",
                body.path("variables").path("filter").path("clientRequestHTTPHost").asText());
    }

    @Test
    void accountScopedQueryUsesAccountFilterType() throws Exception {
        CloudflareEdgeGateway.Scope scope = CloudflareEdgeGateway.Scope.account("acct-9");

        JsonNode body = gateway.mapper.readTree(gateway.buildTrafficQuery(scope, FROM, TO, null));
        String query = body.path("query").asText();

        assertTrue(query.contains("$filter: AccountHttpRequestsAdaptiveGroupsFilter_InputObject"));
        assertFalse(query.contains("ZoneHttpRequestsAdaptiveGroupsFilter_InputObject"));
        assertTrue(query.contains("accounts(filter: {accountTag: $tag})"));
        assertEquals("acct-9", body.path("variables").path("tag").asText());
        assertTrue(body.path("variables").path("filter").path("clientRequestHTTPHost").isMissingNode());
    }

    @Test
    void trafficQueryFallsBackToAccountScope() throws Exception {
        gateway.zoneId = Optional.empty();
        gateway.accountId = Optional.of("acct-9");
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"data\":{\"viewer\":{\"accounts\":[]}}}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        TrafficSummary summary = gateway.queryTraffic(FROM, TO, null);

        assertEquals("No traffic recorded in this window.", summary.message());
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertEquals(URI.create("https://cdn.test/client/v4/graphql"), request.getValue().uri());
    }

    @Test
    void trafficGroupIsMapped() throws Exception {
        CloudflareEdgeGateway.Scope scope = CloudflareEdgeGateway.Scope.zone("zone-1");
        JsonNode root = gateway.mapper.readTree("""
                {"data":{"viewer":{"zones":[{"httpRequestsAdaptiveGroups":[{
                  "count": 1200,
                  "sum": {"edgeResponseBytes": 4096, "visits": 300},
                  "quantiles": {"edgeTimeToFirstByteMsP50": 35.5, "edgeTimeToFirstByteMsP95": 120,
                                "originResponseDurationMsP50": 20}
                }]}]}}}
                """);

        TrafficSummary summary = gateway.parseTraffic(scope, root, FROM, TO, "shop.apps.example.com");

        assertEquals(1200, summary.requests());
        assertEquals(4096, summary.bytes());
        assertEquals(300, summary.visits());
        assertEquals(35.5, summary.ttfbP50Ms());
        assertEquals(120.0, summary.ttfbP95Ms());
        assertEquals(20.0, summary.originP50Ms());
        assertNull(summary.originP95Ms());
        assertNull(summary.message());
    }

    @Test
    void graphQlErrorsAreRaised() throws Exception {
        CloudflareEdgeGateway.Scope scope = CloudflareEdgeGateway.Scope.zone("zone-1");
        JsonNode root = gateway.mapper.readTree("{\"data\":null,\"errors\":[{\"message\":\"zone not authorized\"}]}");

        EdgeException error = assertThrows(EdgeException.class,
                () -> gateway.parseTraffic(scope, root, FROM, TO, null));
        assertTrue(error.getMessage().contains("zone not authorized"));
    }

    @Test
    void trafficNon2xxIsRaised() throws Exception {
        when(response.statusCode()).thenReturn(502);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        assertThrows(EdgeException.class, () -> gateway.queryTraffic(FROM, TO, null));
    }
}
