package com.csd.updateserver.service;

import com.csd.updateserver.model.AppVersion;
import com.csd.updateserver.model.UpgradeManifest;
import com.csd.updateserver.model.VersionRange;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads upgrade manifests from an app's {@code upgrade-manifests} directory.
 * A bad file is logged and skipped, it never fails the whole load.
 */
@Slf4j
@Service
public class ManifestRepository {

    public static final String MANIFESTS_FOLDER = "upgrade-manifests";

    private final ObjectReader manifestReader;

    public ManifestRepository(ObjectMapper objectMapper) {
        this.manifestReader = objectMapper.readerFor(UpgradeManifest.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public List<UpgradeManifest> loadForApp(Path appFolder) {
        return loadAll(appFolder.resolve(MANIFESTS_FOLDER));
    }

    public List<UpgradeManifest> loadAll(Path manifestsDir) {
        if (manifestsDir == null || !Files.isDirectory(manifestsDir)) {
            return new ArrayList<>();
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(manifestsDir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to list manifest directory {}", manifestsDir, e);
            return new ArrayList<>();
        }

        Map<String, UpgradeManifest> byId = new LinkedHashMap<>();
        for (Path file : files) {
            try {
                UpgradeManifest manifest = manifestReader.readValue(file.toFile());
                String problem = validate(manifest);
                if (problem != null) {
                    log.warn("Skipping manifest {}: {}", file.getFileName(), problem);
                    continue;
                }
                if (byId.containsKey(manifest.getId())) {
                    log.warn("Skipping manifest {}: duplicate id '{}'", file.getFileName(), manifest.getId());
                    continue;
                }
                byId.put(manifest.getId(), manifest);
            } catch (IOException e) {
                log.error("Failed to parse manifest: {}", file, e);
            }
        }
        log.debug("Loaded {} manifests from {}", byId.size(), manifestsDir);
        return new ArrayList<>(byId.values());
    }

    // null when valid
    private static String validate(UpgradeManifest manifest) {
        if (manifest == null) return "empty document";
        if (manifest.getId() == null || manifest.getId().isBlank()) return "missing id";
        if (!isSafeFolderName(manifest.getId())) return "id is not usable as a folder name: " + manifest.getId();
        if (!isVersionOrNull(manifest.getTargetVersion())) return "invalid targetVersion " + manifest.getTargetVersion();
        VersionRange range = manifest.getAppliesTo();
        if (range != null) {
            if (!isVersionOrNull(range.getMinVersion())) return "invalid minVersion " + range.getMinVersion();
            if (!isVersionOrNull(range.getMaxVersion())) return "invalid maxVersion " + range.getMaxVersion();
        }
        if (manifest.getDependencies() == null) manifest.setDependencies(new ArrayList<>());
        if (manifest.getConflicts() == null) manifest.setConflicts(new ArrayList<>());
        if (manifest.getFiles() == null) manifest.setFiles(new ArrayList<>());
        return null;
    }

    // ids become folder names inside the package
    static boolean isSafeFolderName(String id) {
        return !id.contains("/") && !id.contains("\\") && !id.contains("..")
                && !id.equals(".") && id.indexOf('\0') < 0;
    }

    private static boolean isVersionOrNull(String value) {
        return value == null || AppVersion.tryParse(value).isPresent();
    }
}
