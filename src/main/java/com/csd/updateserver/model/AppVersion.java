package com.csd.updateserver.model;

import com.csd.updateserver.exception.InvalidVersionException;
import lombok.EqualsAndHashCode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable application version: 2 to 4 numeric components, an optional pre-release tag and an
 * optional opaque build id (usually a short commit hash).
 *
 * <p>Note: {@link #compareTo} is inconsistent with {@link #equals}. Build ids are ignored by the
 * ordering and tags of the same rank (beta, preview) compare as equal.</p>
 */
@EqualsAndHashCode
public final class AppVersion implements Comparable<AppVersion> {

    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "^[vV]?(\\d+)\\.(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:-([A-Za-z]+)(?:\\.([A-Za-z0-9]+))?)?$");

    private final int[] components;
    private final PrereleaseTag tag;
    private final String buildId;

    private AppVersion(int[] components, PrereleaseTag tag, String buildId) {
        this.components = components;
        this.tag = tag;
        this.buildId = buildId;
    }

    public static AppVersion of(int major, int minor, int patch) {
        return new AppVersion(new int[]{major, minor, patch}, null, null);
    }

    public static AppVersion parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidVersionException(value);
        }
        Matcher m = VERSION_PATTERN.matcher(value.trim());
        if (!m.matches()) {
            throw new InvalidVersionException(value);
        }
        int count = m.group(4) != null ? 4 : m.group(3) != null ? 3 : 2;
        int[] parts = new int[count];
        try {
            for (int i = 0; i < count; i++) {
                parts[i] = Integer.parseInt(m.group(i + 1));
            }
        } catch (NumberFormatException e) {
            throw new InvalidVersionException(value);
        }
        PrereleaseTag tag = null;
        if (m.group(5) != null) {
            tag = PrereleaseTag.fromLabel(m.group(5))
                    .orElseThrow(() -> new InvalidVersionException(value));
        }
        return new AppVersion(parts, tag, m.group(6));
    }

    public static Optional<AppVersion> tryParse(String value) {
        try {
            return Optional.of(parse(value));
        } catch (InvalidVersionException e) {
            return Optional.empty();
        }
    }

    public int component(int index) {
        return index < components.length ? components[index] : 0;
    }

    public int getMajor() {
        return component(0);
    }

    public int getMinor() {
        return component(1);
    }

    public int getPatch() {
        return component(2);
    }

    public Optional<PrereleaseTag> getTag() {
        return Optional.ofNullable(tag);
    }

    public Optional<String> getBuildId() {
        return Optional.ofNullable(buildId);
    }

    public boolean isPrerelease() {
        return tag != null;
    }

    public boolean isNewerThan(AppVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(AppVersion other) {
        int length = Math.max(components.length, other.components.length);
        for (int i = 0; i < length; i++) {
            int cmp = Integer.compare(component(i), other.component(i));
            if (cmp != 0) return cmp;
        }
        if (tag == null && other.tag == null) return 0;
        // a release always outranks a pre-release of the same numbers
        if (tag == null) return 1;
        if (other.tag == null) return -1;
        return Integer.compare(tag.getRank(), other.tag.getRank());
    }

    /**
     * Canonical form {@code N.N.N[.N][-tag.buildId]}.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(component(0)).append('.').append(component(1)).append('.').append(component(2));
        if (components.length > 3) {
            sb.append('.').append(components[3]);
        }
        if (tag != null) {
            sb.append('-').append(tag.label());
            if (buildId != null) {
                sb.append('.').append(buildId);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
