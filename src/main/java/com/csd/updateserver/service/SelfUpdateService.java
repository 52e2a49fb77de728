package com.csd.updateserver.service;

import com.csd.updateserver.config.UpdateServerSettings;
import com.csd.updateserver.model.AppVersion;
import com.csd.updateserver.model.FileDirective;
import com.csd.updateserver.model.UpdateFileRecord;
import com.csd.updateserver.model.UpgradeKind;
import com.csd.updateserver.model.UpgradeManifest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Knows about the on-device updater itself: where its builds live and when devices need a new one.
 */
@Slf4j
@Service
public class SelfUpdateService {

    public static final String SELF_UPDATE_TYPE = "UpdaterSelfUpdate";
    public static final int SELF_UPDATE_PRIORITY = Integer.MAX_VALUE;

    private final UpdateLocator updateLocator;
    private final UpdateServerSettings settings;

    public SelfUpdateService(UpdateLocator updateLocator, UpdateServerSettings settings) {
        this.updateLocator = updateLocator;
        this.settings = settings;
    }

    /**
     * Newest stable updater build with a parseable version.
     */
    public Optional<UpdateFileRecord> latestUpdater() {
        Optional<Path> folder = updateLocator.getFolder(settings.getUpdaterAppName());
        if (folder.isEmpty()) {
            log.debug("Updater folder not found");
            return Optional.empty();
        }
        return updateLocator.scanLatest(folder.get(), false)
                .filter(record -> !record.isWildcard());
    }

    public Optional<Path> updaterFolder() {
        return updateLocator.getFolder(settings.getUpdaterAppName());
    }

    /**
     * True when the newest stable updater is at least the configured minimum, i.e. devices running
     * an older protocol should receive it.
     */
    public boolean isUpdaterUpdateNeeded() {
        Optional<UpdateFileRecord> latest = latestUpdater();
        if (latest.isEmpty()) {
            log.debug("No stable updater version found");
            return false;
        }
        AppVersion minVersion = AppVersion.parse(settings.getMinUpdaterVersion());
        boolean needed = latest.get().getVersion().compareTo(minVersion) >= 0;
        log.info("Updater update needed: {} (latest: {}, min: {})", needed, latest.get().getVersion(), minVersion);
        return needed;
    }

    /**
     * Synthetic manifest replacing the device's updater, or empty when the device already runs the
     * newest build. The file directive records the archive size seen now; staging checks the copy
     * against it.
     */
    public Optional<UpgradeManifest> generateSelfUpdateManifest(String installerVersion) {
        AppVersion current = AppVersion.parse(installerVersion);
        Optional<UpdateFileRecord> latest = latestUpdater();
        if (latest.isEmpty() || !latest.get().getVersion().isNewerThan(current)) {
            return Optional.empty();
        }
        UpdateFileRecord archive = latest.get();
        AppVersion version = archive.getVersion();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(UpgradeManifest.METADATA_TYPE, SELF_UPDATE_TYPE);

        return Optional.of(UpgradeManifest.builder()
                .id("updater-self-update-" + version)
                .name("Updater Self-Update " + version)
                .description("Updates the updater from " + current + " to " + version)
                .version(version.toString())
                .targetVersion(version.toString())
                .priority(SELF_UPDATE_PRIORITY)
                .files(new ArrayList<>(List.of(FileDirective.builder()
                        .path(archive.getFileName())
                        .target(stagingTarget(version.toString()))
                        .explode(true)
                        .required(true)
                        .size(archive.getSize())
                        .build())))
                .postInstallScript("echo \"update-staged\" > .pending-update")
                .metadata(metadata)
                .kind(UpgradeKind.SELF_UPDATE)
                .sourceArchive(archive.getFilePath())
                .build());
    }

    public String stagingTarget(String version) {
        String root = settings.getInstallerStagingRoot();
        return (root.endsWith("/") ? root : root + "/") + "updater-" + version;
    }
}
