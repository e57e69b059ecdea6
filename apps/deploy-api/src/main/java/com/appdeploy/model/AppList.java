package com.appdeploy.model;

import java.util.List;

public record AppList(List<AppSummary> apps, int count) {

    public static AppList of(List<AppSummary> apps) {
        return new AppList(List.copyOf(apps), apps.size());
    }
}
