package com.csd.updateserver.service;

import com.csd.updateserver.config.AppFolderMapping;
import com.csd.updateserver.config.UpdateServerSettings;
import com.csd.updateserver.model.UpdateFileRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Serves clients that predate the upgrade protocol. Such clients only know how to download and
 * explode a plain app archive and run {@code upgrade/run.sh} from it, so the newest updater is
 * smuggled into a copy of the app archive together with a script that installs it.
 *
 * <p>The stored app archive is never touched; the combined archive is cached next to the upgrade
 * packages.</p>
 */
@Slf4j
@Service
public class LegacyPackageService {

    public static final String UPGRADE_FOLDER = "upgrade";
    public static final String BOOTSTRAP_FOLDER = "bootstrap";
    public static final String UPDATER_ARCHIVE_NAME = "updater-new.tar.gz";
    public static final String RUN_SCRIPT = "run.sh";
    public static final String COMBINED_PREFIX = "legacy-";

    private final SelfUpdateService selfUpdateService;
    private final TarCodec tarCodec;
    private final PackageCache packageCache;
    private final AppFolderMapping folderMapping;
    private final UpdateServerSettings settings;

    public LegacyPackageService(SelfUpdateService selfUpdateService,
                                TarCodec tarCodec,
                                PackageCache packageCache,
                                AppFolderMapping folderMapping,
                                UpdateServerSettings settings) {
        this.selfUpdateService = selfUpdateService;
        this.tarCodec = tarCodec;
        this.packageCache = packageCache;
        this.folderMapping = folderMapping;
        this.settings = settings;
    }

    /**
     * Combined archive of the app update plus the newest updater, or empty when the original
     * file should be served unchanged (no updater due, or the asset is not a tarball).
     *
     * @param appFolderName folder the app lives in on the device; null to look it up
     */
    public Optional<Path> packageAppUpdateWithUpdater(String appName, Path appUpdatePath, String appFolderName) throws IOException {
        if (!appUpdatePath.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(UpdateLocator.TAR_GZ)) {
            log.info("App file {} is not a tar.gz, serving it without the updater", appUpdatePath.getFileName());
            return Optional.empty();
        }
        if (!selfUpdateService.isUpdaterUpdateNeeded()) {
            log.info("No updater update needed, serving app update as-is");
            return Optional.empty();
        }
        Optional<UpdateFileRecord> updater = selfUpdateService.latestUpdater();
        if (updater.isEmpty()) {
            log.warn("Latest updater file not found");
            return Optional.empty();
        }
        Path updaterArchive = updater.get().getFilePath();
        String deviceFolder = appFolderName != null ? appFolderName : deviceFolderName(appName);
        Optional<Path> bootstrapDir = selfUpdateService.updaterFolder()
                .map(folder -> folder.resolve(BOOTSTRAP_FOLDER))
                .filter(Files::isDirectory);

        String fingerprint = fingerprint(appUpdatePath, updaterArchive, bootstrapDir.orElse(null),
                deviceFolder, settings.getDeviceHome());
        Path combined = packageCache.getOrBuild(appUpdatePath.getParent(), appName, fingerprint,
                target -> repackage(appUpdatePath, updaterArchive, bootstrapDir.orElse(null), deviceFolder, target));
        log.info("Packaged app update with updater update: {} ({} bytes)", combined.getFileName(), Files.size(combined));
        return Optional.of(combined);
    }

    public String deviceFolderName(String appName) {
        Optional<String> mapped = folderMapping.deviceFolderFor(appName);
        if (mapped.isPresent()) {
            log.debug("Mapped app '{}' to folder '{}'", appName, mapped.get());
            return mapped.get();
        }
        String fallback = appName.toLowerCase(Locale.ROOT);
        log.warn("Unknown app name '{}' in app folder mapping, using default folder name: {}", appName, fallback);
        return fallback;
    }

    private void repackage(Path appUpdatePath, Path updaterArchive, Path bootstrapDir,
                           String deviceFolder, Path output) throws IOException {
        Path scratchRoot = settings.scratchRootPath();
        Files.createDirectories(scratchRoot);
        Path tempDir = Files.createTempDirectory(scratchRoot, "legacy-build-");
        try {
            Path appDir = Files.createDirectories(tempDir.resolve("app"));
            tarCodec.extractTarGz(appUpdatePath, appDir);

            Path upgradeDir = Files.createDirectories(appDir.resolve(UPGRADE_FOLDER));
            FileTrees.copyFile(updaterArchive, upgradeDir, UPDATER_ARCHIVE_NAME);
            log.info("Copied updater archive to upgrade folder as {} (original: {})",
                    UPDATER_ARCHIVE_NAME, updaterArchive.getFileName());

            boolean withBootstrap = bootstrapDir != null;
            if (withBootstrap) {
                FileTrees.copyDirectory(bootstrapDir, upgradeDir.resolve(BOOTSTRAP_FOLDER));
            }

            Path runScript = upgradeDir.resolve(RUN_SCRIPT);
            Files.writeString(runScript, runScript(deviceFolder, withBootstrap), StandardCharsets.UTF_8);
            makeExecutable(runScript);

            tarCodec.createTarGz(appDir, output);
        } finally {
            FileTrees.deleteQuietly(tempDir);
        }
    }

    String runScript(String deviceFolder, boolean withBootstrap) {
        String deviceHome = settings.getDeviceHome();
        String script = """
                #!/bin/bash

                # Installs the updater shipped inside this app update.
                # Generated by the update server.

                APP_FOLDER="%s"
                UPDATER_PATH="%s/$APP_FOLDER/upgrade/%s"
                DESTINATION_DIR="%s/updater"

                if [ ! -f "$UPDATER_PATH" ]; then
                    echo "[Upgrade] ERROR: Updater archive not found: $UPDATER_PATH"
                    exit 1
                fi

                mkdir -p "$DESTINATION_DIR"

                echo "[Upgrade] Extracting updater archive..."
                tar -xzf "$UPDATER_PATH" -C "$DESTINATION_DIR"

                if [ $? -eq 0 ]; then
                    echo "[Upgrade] Extraction for updater completed successfully."
                else
                    echo "[Upgrade] ERROR: Extraction failed."
                    exit 1
                fi
                """.formatted(deviceFolder, deviceHome, UPDATER_ARCHIVE_NAME, deviceHome);
        if (withBootstrap) {
            script += """

                    BOOTSTRAP_DIR="%s/$APP_FOLDER/upgrade/%s"
                    for step in "$BOOTSTRAP_DIR"/*.sh; do
                        [ -f "$step" ] || continue
                        echo "[Upgrade] Running bootstrap step $(basename "$step")"
                        bash "$step" || { echo "[Upgrade] ERROR: bootstrap step failed: $step"; exit 1; }
                    done
                    """.formatted(deviceHome, BOOTSTRAP_FOLDER);
        }
        return script;
    }

    public static boolean isCombinedPackage(Path file) {
        return file.getFileName().toString().startsWith(COMBINED_PREFIX);
    }

    private static void makeExecutable(Path script) throws IOException {
        try {
            Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported, {} keeps default mode", script);
        }
    }

    /**
     * Covers every input of the combined archive: both artifacts, the bootstrap scripts and the
     * values baked into {@code run.sh}.
     */
    static String fingerprint(Path appUpdate, Path updater, Path bootstrapDir,
                              String deviceFolder, String deviceHome) throws IOException {
        StringBuilder key = new StringBuilder()
                .append(describe(appUpdate)).append('\n')
                .append(describe(updater)).append('\n')
                .append(deviceFolder).append('\n')
                .append(deviceHome).append('\n');
        if (bootstrapDir != null) {
            List<Path> scripts;
            try (Stream<Path> walk = Files.walk(bootstrapDir)) {
                scripts = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
            }
            for (Path script : scripts) {
                key.append(bootstrapDir.relativize(script).toString().replace('\\', '/'))
                        .append(':').append(Files.size(script))
                        .append(':').append(Files.getLastModifiedTime(script).toMillis())
                        .append('\n');
            }
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.toString().getBytes(StandardCharsets.UTF_8));
            return COMBINED_PREFIX + HexFormat.of().formatHex(digest).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String describe(Path file) throws IOException {
        return file.getFileName() + ":" + Files.size(file) + ":" + Files.getLastModifiedTime(file).toMillis();
    }
}
