package com.appdeploy.deploy;

public enum DeploymentStage {
    SPEC_BUILT,
    UPSERTED,
    DOMAIN_RECONCILED,
    AUTOSCALER_CORRECTING,
    CACHE_PURGED,
    PROPAGATION_WAIT,
    WARMED_UP,
    MAPPING_REMOVED,
    WORKLOAD_REMOVED
}
