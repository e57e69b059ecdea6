package com.appdeploy.model;

public record DeletionAck(String name, String namespace, String status) {

    public static DeletionAck deleted(String name, String namespace) {
        return new DeletionAck(name, namespace, "deleted");
    }
}
