package com.appdeploy.edge;

public interface WarmUpProbe {

    int probe(String url);
}
