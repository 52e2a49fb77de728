package com.csd.updateserver.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Top-level {@code package-manifest.json} of an upgrade archive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpgradePackageManifest {
    private String fromVersion;
    private String toVersion;
    private List<String> upgrades;
}
