package com.appdeploy.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DeploymentAction {
    CREATED,
    UPDATED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
