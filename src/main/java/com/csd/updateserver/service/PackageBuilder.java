package com.csd.updateserver.service;

import com.csd.updateserver.config.UpdateServerSettings;
import com.csd.updateserver.exception.IntegrityMismatchException;
import com.csd.updateserver.exception.SourceMissingException;
import com.csd.updateserver.model.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the upgrade archive a client downloads: one folder per resolved upgrade plus a
 * package-level manifest, gzipped tar, cached by fingerprint.
 *
 * <pre>
 * package-manifest.json
 * upgrades/&lt;id&gt;/manifest.json
 * upgrades/&lt;id&gt;/...            upgrade payload
 * </pre>
 */
@Slf4j
@Service
public class PackageBuilder {

    public static final String PACKAGE_MANIFEST = "package-manifest.json";
    public static final String UPGRADE_MANIFEST = "manifest.json";
    public static final String UPGRADES_FOLDER = "upgrades";

    private final UpgradeResolver upgradeResolver;
    private final UpdateLocator updateLocator;
    private final SelfUpdateService selfUpdateService;
    private final TarCodec tarCodec;
    private final PackageCache packageCache;
    private final UpdateServerSettings settings;
    private final ObjectWriter jsonWriter;

    public PackageBuilder(UpgradeResolver upgradeResolver,
                          UpdateLocator updateLocator,
                          SelfUpdateService selfUpdateService,
                          TarCodec tarCodec,
                          PackageCache packageCache,
                          UpdateServerSettings settings,
                          ObjectMapper objectMapper) {
        this.upgradeResolver = upgradeResolver;
        this.updateLocator = updateLocator;
        this.selfUpdateService = selfUpdateService;
        this.tarCodec = tarCodec;
        this.packageCache = packageCache;
        this.settings = settings;
        this.jsonWriter = objectMapper.writerWithDefaultPrettyPrinter();
    }

    /**
     * @return the archive path, or empty when there is nothing to install
     */
    public Optional<Path> buildUpgradePackage(String appName, AppVersion clientVersion,
                                              boolean includePrerelease, String installerVersion) throws IOException {
        Optional<ApplicableUpgradesResult> resolved =
                upgradeResolver.getApplicableUpgrades(appName, clientVersion, includePrerelease, installerVersion);
        if (resolved.isEmpty() || resolved.get().isUpToDate()) {
            return Optional.empty();
        }
        ApplicableUpgradesResult result = resolved.get();
        Path appFolder = updateLocator.getFolder(appName).orElseThrow();
        String fingerprint = fingerprint(clientVersion, result.getUpgrades());

        Path archive = packageCache.getOrBuild(appFolder, appName, fingerprint,
                target -> packageUpgrades(result, clientVersion, target));
        return Optional.of(archive);
    }

    /**
     * Cache key over the client version and the sorted upgrade ids.
     */
    static String fingerprint(AppVersion clientVersion, List<UpgradeManifest> upgrades) {
        String ids = upgrades.stream().map(UpgradeManifest::getId).sorted().collect(Collectors.joining("\n"));
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] digest = sha256.digest((clientVersion + "\n" + ids).getBytes(StandardCharsets.UTF_8));
            return "upgrade-" + clientVersion + "-" + HexFormat.of().formatHex(digest).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void packageUpgrades(ApplicableUpgradesResult result, AppVersion clientVersion, Path output) throws IOException {
        Path scratchRoot = settings.scratchRootPath();
        Files.createDirectories(scratchRoot);
        Path tempDir = Files.createTempDirectory(scratchRoot, "upgrade-build-");
        try {
            Path packageDir = Files.createDirectories(tempDir.resolve("upgrade"));

            UpgradePackageManifest packageManifest = UpgradePackageManifest.builder()
                    .fromVersion(clientVersion.toString())
                    .toVersion(result.getTargetVersion())
                    .upgrades(result.getUpgrades().stream().map(UpgradeManifest::getId).collect(Collectors.toList()))
                    .build();
            jsonWriter.writeValue(packageDir.resolve(PACKAGE_MANIFEST).toFile(), packageManifest);

            Path upgradesDir = Files.createDirectories(packageDir.resolve(UPGRADES_FOLDER));
            for (UpgradeManifest upgrade : result.getUpgrades()) {
                FileTrees.checkInterrupted();
                Path destPath = Files.createDirectories(upgradesDir.resolve(upgrade.getId()));
                switch (upgrade.getKind()) {
                    case APP_UPDATE:
                        stageAppUpdate(upgrade, destPath);
                        break;
                    case SELF_UPDATE:
                        stageSelfUpdate(upgrade, destPath);
                        break;
                    default:
                        stageStandard(upgrade, destPath);
                }
                jsonWriter.writeValue(destPath.resolve(UPGRADE_MANIFEST).toFile(), upgrade);
            }

            tarCodec.createTarGz(packageDir, output);
        } finally {
            FileTrees.deleteQuietly(tempDir);
        }
    }

    private void stageStandard(UpgradeManifest upgrade, Path destPath) throws IOException {
        Path sourcePath = upgradeSourcePath(upgrade);
        if (!Files.isDirectory(sourcePath)) {
            log.warn("Upgrade source path not found: {}", sourcePath);
            throw new SourceMissingException(upgrade.getId(), sourcePath);
        }
        FileTrees.copyDirectory(sourcePath, destPath);
    }

    private void stageAppUpdate(UpgradeManifest upgrade, Path destPath) throws IOException {
        Path archive = upgrade.getSourceArchive();
        if (archive == null || !Files.isRegularFile(archive)) {
            throw new SourceMissingException(upgrade.getId(), archive);
        }
        log.info("Packaging app update from {}", archive);
        String fileName = archive.getFileName().toString();
        FileTrees.copyFile(archive, destPath, fileName);

        upgrade.setFiles(List.of(FileDirective.builder()
                .path(fileName)
                .explode(true)
                .required(true)
                .size(Files.size(archive))
                .build()));
    }

    void stageSelfUpdate(UpgradeManifest upgrade, Path destPath) throws IOException {
        Path archive = upgrade.getSourceArchive();
        if (archive == null || !Files.isRegularFile(archive)) {
            log.warn("Updater update file not found");
            throw new SourceMissingException(upgrade.getId(), archive);
        }
        log.info("Packaging updater self-update from {}", archive);
        String fileName = archive.getFileName().toString();
        Optional<FileDirective> recorded = upgrade.getFiles() == null ? Optional.empty()
                : upgrade.getFiles().stream().filter(f -> fileName.equals(f.getPath())).findFirst();
        long expected = recorded.isPresent() ? recorded.get().getSize() : Files.size(archive);

        Path copy = FileTrees.copyFile(archive, destPath, fileName);
        long actual = Files.size(copy);
        if (expected != actual) {
            log.error("Updater archive {} changed since it was resolved", archive);
            throw new IntegrityMismatchException(copy, expected, actual);
        }

        upgrade.setFiles(List.of(FileDirective.builder()
                .path(fileName)
                .target(selfUpdateService.stagingTarget(upgrade.getVersion()))
                .explode(true)
                .required(true)
                .size(expected)
                .build()));
    }

    Path upgradeSourcePath(UpgradeManifest manifest) {
        UpgradeStorage storage = manifest.getStorage();
        Path basePath = storage != null && storage.getBasePath() != null && !storage.getBasePath().isBlank()
                ? Path.of(storage.getBasePath())
                : settings.upgradeRootPath();
        String relative = storage != null && storage.getPath() != null ? storage.getPath() : "";
        return basePath.resolve(relative).normalize();
    }
}
