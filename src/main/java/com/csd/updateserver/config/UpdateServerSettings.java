package com.csd.updateserver.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Filesystem layout and updater settings. Relative paths resolve against the working directory.
 */
@Data
@Component
public class UpdateServerSettings {

    @Value("${update-server.apps-root:apps}")
    private String appsRoot = "apps";

    @Value("${update-server.upgrade-root:upgrade}")
    private String upgradeRoot = "upgrade";

    @Value("${update-server.cache-fallback-root:${java.io.tmpdir}/update-server-cache}")
    private String cacheFallbackRoot = System.getProperty("java.io.tmpdir") + "/update-server-cache";

    @Value("${update-server.scratch-root:${java.io.tmpdir}}")
    private String scratchRoot = System.getProperty("java.io.tmpdir");

    @Value("${update-server.updater-app-name:Updater}")
    private String updaterAppName = "Updater";

    @Value("${update-server.min-updater-version:2.0.0}")
    private String minUpdaterVersion = "2.0.0";

    @Value("${update-server.installer-staging-root:/opt/updater/pending-update}")
    private String installerStagingRoot = "/opt/updater/pending-update";

    @Value("${update-server.device-home:/home/device}")
    private String deviceHome = "/home/device";

    public Path appsRootPath() {
        return Path.of(appsRoot).toAbsolutePath().normalize();
    }

    public Path upgradeRootPath() {
        return Path.of(upgradeRoot).toAbsolutePath().normalize();
    }

    public Path cacheFallbackRootPath() {
        return Path.of(cacheFallbackRoot).toAbsolutePath().normalize();
    }

    public Path scratchRootPath() {
        return Path.of(scratchRoot).toAbsolutePath().normalize();
    }
}
