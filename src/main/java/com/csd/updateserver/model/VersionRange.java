package com.csd.updateserver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Client versions an upgrade applies to. {@code minVersion} is inclusive, {@code maxVersion} is
 * exclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class VersionRange {
    private String minVersion;
    private String maxVersion;
    private List<String> excludeVersions;

    public boolean contains(AppVersion version) {
        if (minVersion != null && version.compareTo(AppVersion.parse(minVersion)) < 0) {
            return false;
        }
        if (maxVersion != null && version.compareTo(AppVersion.parse(maxVersion)) >= 0) {
            return false;
        }
        if (excludeVersions != null) {
            for (String excluded : excludeVersions) {
                boolean same = AppVersion.tryParse(excluded)
                        .map(v -> v.compareTo(version) == 0)
                        .orElse(excluded.equals(version.toString()));
                if (same) return false;
            }
        }
        return true;
    }
}
