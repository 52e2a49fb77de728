package com.csd.updateserver.service;

import org.apache.maven.artifact.versioning.ArtifactVersion;
import org.apache.maven.artifact.versioning.DefaultArtifactVersion;

import java.util.regex.Pattern;

/**
 * Loose version checks for values reported by clients (User-Agent markers, headers), where the
 * strict {@link com.csd.updateserver.model.AppVersion} grammar is not required.
 */
public final class VersionUtil {
    private static final Pattern NUMERIC = Pattern.compile("^\\d+(\\.\\d+){0,3}$");

    private VersionUtil() {}

    public static boolean isNumeric(String version) {
        return version != null && NUMERIC.matcher(version.trim()).matches();
    }

    public static int compare(String a, String b) {
        ArtifactVersion av = new DefaultArtifactVersion(a.trim());
        ArtifactVersion bv = new DefaultArtifactVersion(b.trim());
        return av.compareTo(bv);
    }

    /**
     * True when {@code version} is a numeric version below {@code minVersion}. Malformed values are
     * never "below" anything; callers decide how to treat them.
     */
    public static boolean isBelow(String version, String minVersion) {
        if (!isNumeric(version) || minVersion == null) return false;
        return compare(version, minVersion) < 0;
    }
}
