package com.csd.updateserver.service;

import com.csd.updateserver.exception.AppNotFoundException;
import com.csd.updateserver.exception.DependencyCycleException;
import com.csd.updateserver.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Works out which upgrades a client needs and in which order they must be installed.
 */
@Slf4j
@Service
public class UpgradeResolver {

    public static final String APP_UPDATE_TYPE = "AppUpdate";
    public static final int APP_UPDATE_PRIORITY = 100;

    private static final Comparator<UpgradeManifest> BY_PRIORITY =
            Comparator.comparingInt(UpgradeManifest::getPriority).thenComparing(UpgradeManifest::getId);

    private final UpdateLocator updateLocator;
    private final ManifestRepository manifestRepository;
    private final SelfUpdateService selfUpdateService;

    public UpgradeResolver(UpdateLocator updateLocator,
                           ManifestRepository manifestRepository,
                           SelfUpdateService selfUpdateService) {
        this.updateLocator = updateLocator;
        this.manifestRepository = manifestRepository;
        this.selfUpdateService = selfUpdateService;
    }

    /**
     * Ordered upgrades for a client. An empty upgrade list means the client is up to date.
     *
     * @param installerVersion version of the client's updater, or null when it did not report one
     * @return empty when the app has no versioned update file to target
     * @throws AppNotFoundException when the app has no update folder
     * @throws DependencyCycleException when the applicable manifests depend on each other in a cycle
     */
    public Optional<ApplicableUpgradesResult> getApplicableUpgrades(String appName, AppVersion clientVersion,
                                                                   boolean includePrerelease, String installerVersion) {
        Path appFolder = updateLocator.getFolder(appName)
                .orElseThrow(() -> new AppNotFoundException(appName));

        Optional<UpdateFileRecord> latestFile = selectLatest(updateLocator.getLatestUpdateInfo(appFolder), includePrerelease);
        if (latestFile.isEmpty()) {
            log.warn("No latest version found for {}", appName);
            return Optional.empty();
        }
        AppVersion latestVersion = latestFile.get().getVersion();

        List<UpgradeManifest> manifests = manifestRepository.loadForApp(appFolder);
        List<UpgradeManifest> applicable = filterApplicable(manifests, clientVersion, latestVersion);
        List<UpgradeManifest> ordered = resolveUpgradeOrder(applicable);

        if (latestVersion.isNewerThan(clientVersion)) {
            ordered.add(appUpdateManifest(latestVersion, latestFile.get().getFilePath()));
        }

        if (installerVersion != null && !installerVersion.isBlank()) {
            selfUpdateService.generateSelfUpdateManifest(installerVersion).ifPresent(selfUpdate -> {
                log.info("Injecting updater self-update manifest {}", selfUpdate.getId());
                ordered.add(selfUpdate);
            });
        }

        long estimatedSize = ordered.stream().mapToLong(UpgradeManifest::totalFileSize).sum();
        log.info("{} client {} -> {}: {} upgrade(s), ~{} bytes", appName, clientVersion, latestVersion,
                ordered.size(), estimatedSize);

        return Optional.of(ApplicableUpgradesResult.builder()
                .targetVersion(latestVersion.toString())
                .upgrades(ordered)
                .estimatedSize(estimatedSize)
                .build());
    }

    /**
     * Pre-release track when asked for and strictly newer than stable, otherwise stable.
     * Wildcard files have no version to target and are ignored here.
     */
    static Optional<UpdateFileRecord> selectLatest(AppUpdateInfo info, boolean includePrerelease) {
        Optional<UpdateFileRecord> stable = info.stable().filter(r -> !r.isWildcard());
        Optional<UpdateFileRecord> preRelease = info.preRelease().filter(r -> !r.isWildcard());
        if (includePrerelease && preRelease.isPresent()
                && (stable.isEmpty() || preRelease.get().getVersion().isNewerThan(stable.get().getVersion()))) {
            return preRelease;
        }
        return stable;
    }

    static List<UpgradeManifest> filterApplicable(List<UpgradeManifest> manifests, AppVersion clientVersion,
                                                  AppVersion latestVersion) {
        return manifests.stream()
                .filter(m -> m.getAppliesTo() == null || m.getAppliesTo().contains(clientVersion))
                .filter(m -> m.getTargetVersion() == null
                        || AppVersion.parse(m.getTargetVersion()).compareTo(latestVersion) <= 0)
                .collect(Collectors.toList());
    }

    /**
     * Depth-first topological order: roots are visited by ascending priority (id breaks ties) and
     * every dependency is emitted before its dependents. Dependencies outside the given list are
     * ignored. Uses an explicit stack, so deep chains cannot overflow the call stack.
     */
    static List<UpgradeManifest> resolveUpgradeOrder(List<UpgradeManifest> upgrades) {
        Map<String, UpgradeManifest> byId = new LinkedHashMap<>();
        for (UpgradeManifest upgrade : upgrades) {
            byId.putIfAbsent(upgrade.getId(), upgrade);
        }
        List<UpgradeManifest> roots = new ArrayList<>(byId.values());
        roots.sort(BY_PRIORITY);

        List<UpgradeManifest> ordered = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> visiting = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (UpgradeManifest root : roots) {
            if (visited.contains(root.getId())) continue;
            visiting.add(root.getId());
            stack.push(new Frame(root));

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.hasNextDependency()) {
                    String depId = top.nextDependency();
                    UpgradeManifest dependency = byId.get(depId);
                    if (dependency == null || visited.contains(depId)) continue;
                    if (visiting.contains(depId)) {
                        throw new DependencyCycleException(cyclePath(stack, depId));
                    }
                    visiting.add(depId);
                    stack.push(new Frame(dependency));
                } else {
                    stack.pop();
                    String id = top.manifest.getId();
                    visiting.remove(id);
                    visited.add(id);
                    ordered.add(top.manifest);
                }
            }
        }
        return ordered;
    }

    private static List<String> cyclePath(Deque<Frame> stack, String repeatedId) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        Iterator<Frame> bottomUp = stack.descendingIterator();
        while (bottomUp.hasNext()) {
            String id = bottomUp.next().manifest.getId();
            if (id.equals(repeatedId)) inCycle = true;
            if (inCycle) path.add(id);
        }
        path.add(repeatedId);
        return path;
    }

    private static UpgradeManifest appUpdateManifest(AppVersion latestVersion, Path archive) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(UpgradeManifest.METADATA_TYPE, APP_UPDATE_TYPE);
        return UpgradeManifest.builder()
                .id("app-update-" + latestVersion)
                .name("Application Update " + latestVersion)
                .description("Main application update")
                .version(latestVersion.toString())
                .targetVersion(latestVersion.toString())
                .appliesTo(VersionRange.builder().maxVersion(latestVersion.toString()).build())
                .priority(APP_UPDATE_PRIORITY)
                .files(new ArrayList<>())
                .metadata(metadata)
                .kind(UpgradeKind.APP_UPDATE)
                .sourceArchive(archive)
                .build();
    }

    private static final class Frame {
        private final UpgradeManifest manifest;
        private int next;

        private Frame(UpgradeManifest manifest) {
            this.manifest = manifest;
        }

        boolean hasNextDependency() {
            return manifest.getDependencies() != null && next < manifest.getDependencies().size();
        }

        String nextDependency() {
            return manifest.getDependencies().get(next++);
        }
    }
}
