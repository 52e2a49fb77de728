package com.csd.updateserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One optional upgrade unit, read from {@code upgrade-manifests/*.json} or synthesized by the
 * resolver for app and updater updates.
 *
 * <p>{@link #kind} and {@link #sourceArchive} never appear in JSON. Manifests read from disk are
 * always {@link UpgradeKind#STANDARD}; synthetic ones carry the archive they were resolved from.
 * The {@code metadata.Type} entry is still written so devices can tell the kinds apart.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpgradeManifest {

    public static final String METADATA_TYPE = "Type";

    private String id;
    private String name;
    private String description;
    private String version;
    private String type;
    private VersionRange appliesTo;
    private String targetVersion;
    private int priority;
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();
    @Builder.Default
    private List<String> conflicts = new ArrayList<>();
    private UpgradeStorage storage;
    @Builder.Default
    private List<FileDirective> files = new ArrayList<>();
    private String preInstallScript;
    private String postInstallScript;
    private String rollbackScript;
    private UpgradeChecksum checksum;
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonIgnore
    @Builder.Default
    private UpgradeKind kind = UpgradeKind.STANDARD;

    @JsonIgnore
    private Path sourceArchive;

    @JsonIgnore
    public long totalFileSize() {
        if (files == null) return 0L;
        return files.stream().mapToLong(FileDirective::getSize).sum();
    }
}
