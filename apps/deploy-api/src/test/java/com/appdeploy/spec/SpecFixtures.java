package com.appdeploy.spec;

public final class SpecFixtures {

    public static final String DOMAIN = "apps.example.com";

    private SpecFixtures() {
    }

    public static ResourceSpecBuilder specs() {
        ResourceSpecBuilder specs = new ResourceSpecBuilder();
        specs.domain = DOMAIN;
        return specs;
    }
}
