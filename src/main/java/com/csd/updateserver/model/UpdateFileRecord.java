package com.csd.updateserver.model;

import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;

/**
 * One candidate update file found while scanning an app folder. Recomputed on every scan.
 */
@Value
public class UpdateFileRecord {

    /**
     * Best file first: unversioned (wildcard) files, then version descending, then most recently
     * modified. Modification time is the explicit tie-break for versions of equal rank.
     */
    public static final Comparator<UpdateFileRecord> NEWEST_FIRST = (a, b) -> {
        if (a.isWildcard() != b.isWildcard()) {
            return a.isWildcard() ? -1 : 1;
        }
        if (!a.isWildcard()) {
            int byVersion = b.getVersion().compareTo(a.getVersion());
            if (byVersion != 0) return byVersion;
        }
        return b.getLastModified().compareTo(a.getLastModified());
    };

    Path filePath;
    AppVersion version; // null for wildcard files
    Instant lastModified;
    long size;

    public boolean isWildcard() {
        return version == null;
    }

    public boolean isPrerelease() {
        return version != null && version.isPrerelease();
    }

    public String getFileName() {
        return filePath.getFileName().toString();
    }
}
