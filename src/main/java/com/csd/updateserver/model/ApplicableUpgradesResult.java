package com.csd.updateserver.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ApplicableUpgradesResult {
    private String targetVersion;
    private List<UpgradeManifest> upgrades;
    private long estimatedSize;

    public boolean isUpToDate() {
        return upgrades == null || upgrades.isEmpty();
    }
}
