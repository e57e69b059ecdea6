package com.appdeploy.deploy;

public class AppNotFoundException extends RuntimeException {

    private final String name;
    private final String namespace;

    public AppNotFoundException(String name, String namespace) {
        super("App " + name + " not found in namespace " + namespace);
        this.name = name;
        this.namespace = namespace;
    }

    public String name() {
        return name;
    }

    public String namespace() {
        return namespace;
    }
}
