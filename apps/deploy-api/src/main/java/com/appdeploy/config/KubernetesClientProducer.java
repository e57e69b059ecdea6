package com.appdeploy.config;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.jboss.logging.Logger;

@ApplicationScoped
public class KubernetesClientProducer {

    private static final Logger LOGGER = Logger.getLogger("API.KubernetesClientProducer");

    private final KubernetesClient client = new KubernetesClientBuilder().build();

    @Produces
    @ApplicationScoped
    public KubernetesClient kubernetesClient() {
        LOGGER.infov("[INIT] KubernetesClient ready. master={0} namespace={1}",
                client.getMasterUrl(), client.getNamespace());
        return client;
    }

    @PreDestroy
    void close() {
        client.close();
    }
}
