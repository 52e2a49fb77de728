package com.csd.updateserver.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * {@link AppFolderMapping} backed by {@code update-server.app-names.*} and
 * {@code update-server.app-folder-names.*}.
 */
@Slf4j
@Component
public class ConfiguredAppFolderMapping implements AppFolderMapping {

    private final Map<String, String> appNames;
    private final Map<String, String> appFolderNames;

    @Autowired
    public ConfiguredAppFolderMapping(Environment environment) {
        this(bindMap(environment, "update-server.app-names"),
                bindMap(environment, "update-server.app-folder-names"));
    }

    public ConfiguredAppFolderMapping(Map<String, String> appNames, Map<String, String> appFolderNames) {
        this.appNames = Map.copyOf(appNames);
        this.appFolderNames = Map.copyOf(appFolderNames);
        log.info("Loaded {} app folder mappings and {} device folder mappings", appNames.size(), appFolderNames.size());
    }

    @Override
    public Optional<String> folderFor(String appName) {
        return Optional.ofNullable(appNames.get(appName));
    }

    @Override
    public Optional<String> deviceFolderFor(String appName) {
        return Optional.ofNullable(appFolderNames.get(appName));
    }

    private static Map<String, String> bindMap(Environment environment, String prefix) {
        return Binder.get(environment)
                .bind(prefix, Bindable.mapOf(String.class, String.class))
                .orElse(Map.of());
    }
}
