package com.appdeploy.config;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class BackgroundExecutorProducer {

    public static final String BACKGROUND = "deploy-background";

    private static final int POOL_SIZE = 2;

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(POOL_SIZE, daemonThreads());

    @Produces
    @ApplicationScoped
    @Named(BACKGROUND)
    public ScheduledExecutorService backgroundScheduler() {
        return scheduler;
    }

    @PreDestroy
    void close() {
        scheduler.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, BACKGROUND + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
