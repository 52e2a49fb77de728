package com.csd.updateserver.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response body of {@code check-upgrades}.
 */
@Data
@Builder
public class UpgradeInfoWrapper {
    private String currentVersion;
    private String targetVersion;
    private List<UpgradeSummary> upgrades;
    private long packageSize;
    private boolean requiresDownload;
}
