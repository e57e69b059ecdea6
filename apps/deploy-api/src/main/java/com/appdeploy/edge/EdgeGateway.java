package com.appdeploy.edge;

import com.appdeploy.model.TrafficSummary;
import java.time.Instant;
import java.util.List;

public interface EdgeGateway {

    boolean isConfigured();

    EdgeResponse purgeHosts(List<String> hostnames);

    TrafficSummary queryTraffic(Instant from, Instant to, String hostname);
}
