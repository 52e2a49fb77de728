package com.csd.updateserver.exception;

import java.util.List;

public class DependencyCycleException extends UpdateServerException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
