package com.csd.updateserver.service;

import com.csd.updateserver.exception.AppNotFoundException;
import com.csd.updateserver.exception.CorruptAssetException;
import com.csd.updateserver.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Operations offered to the HTTP layer.
 */
@Slf4j
@Service
public class UpdateDistributionService {

    private final UpdateLocator updateLocator;
    private final UpgradeResolver upgradeResolver;
    private final PackageBuilder packageBuilder;
    private final LegacyPackageService legacyPackageService;

    public UpdateDistributionService(UpdateLocator updateLocator,
                                     UpgradeResolver upgradeResolver,
                                     PackageBuilder packageBuilder,
                                     LegacyPackageService legacyPackageService) {
        this.updateLocator = updateLocator;
        this.upgradeResolver = upgradeResolver;
        this.packageBuilder = packageBuilder;
        this.legacyPackageService = legacyPackageService;
    }

    /**
     * Legacy clients are always out of date so that they download the package carrying the new updater.
     *
     * @return true when the client already has the latest file
     */
    public boolean checkVersion(String appId, String clientVersion, Instant modifiedSince,
                                String checksum, boolean includePrerelease, boolean legacy) {
        Path folder = updateLocator.getFolder(appId).orElseThrow(() -> new AppNotFoundException(appId));
        log.info("{} Checking... user version: {}, old updater: {}",
                appId, clientVersion != null ? clientVersion : "Unknown", legacy);
        boolean upToDate = !legacy
                && updateLocator.checkVersion(folder, clientVersion, modifiedSince, checksum, includePrerelease);
        log.info("{} is up to date: {}", appId, upToDate);
        return upToDate;
    }

    public Optional<ApplicableUpgradesResult> listApplicableUpgrades(String appId, String clientVersion,
                                                                   boolean includePrerelease, String installerVersion) {
        return upgradeResolver.getApplicableUpgrades(appId, AppVersion.parse(clientVersion), includePrerelease, installerVersion);
    }

    public Optional<Path> fetchUpgradePackage(String appId, String clientVersion,
                                              boolean includePrerelease, String installerVersion) throws IOException {
        return packageBuilder.buildUpgradePackage(appId, AppVersion.parse(clientVersion), includePrerelease, installerVersion);
    }

    /**
     * The newest plain update file, or for legacy clients that file with the updater embedded.
     * A failed legacy repackaging falls back to the plain file.
     *
     * @throws CorruptAssetException when the stored file is neither an executable nor a tarball
     */
    public Path fetchPlainUpdate(String appId, boolean includePrerelease, boolean legacy) {
        Path file = updateLocator.getUpdateFileForApp(appId, includePrerelease)
                .orElseThrow(() -> new AppNotFoundException(appId));
        if (!isExecutable(file) && !isTarball(file)) {
            throw new CorruptAssetException(file);
        }
        if (legacy) {
            log.info("Old updater detected. Packaging app update with updater update for app: {}", appId);
            try {
                Optional<Path> combined = legacyPackageService.packageAppUpdateWithUpdater(appId, file, null);
                if (combined.isPresent()) {
                    return combined.get();
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to package with updater, serving normal update", e);
            }
        }
        return file;
    }

    public LatestInfo latestInfo(String appId, boolean includePrerelease) {
        Path folder = updateLocator.getFolder(appId).orElseThrow(() -> new AppNotFoundException(appId));
        AppUpdateInfo info = updateLocator.getLatestUpdateInfo(folder);
        return LatestInfo.builder()
                .stable(LatestInfo.Track.of(info.getLatestStable()))
                .prerelease(includePrerelease ? LatestInfo.Track.of(info.getLatestPreRelease()) : null)
                .build();
    }

    public static boolean isExecutable(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(UpdateLocator.EXE);
    }

    public static boolean isTarball(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gz");
    }
}
