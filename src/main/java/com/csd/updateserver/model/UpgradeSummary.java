package com.csd.updateserver.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class UpgradeSummary {
    private String id;
    private String name;
    private int priority;

    public static UpgradeSummary of(UpgradeManifest manifest) {
        return UpgradeSummary.builder()
                .id(manifest.getId())
                .name(manifest.getName())
                .priority(manifest.getPriority())
                .build();
    }
}
