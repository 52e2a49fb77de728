package com.csd.updateserver.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Pre-release tags recognised in version strings. Tags sharing a rank compare as equal.
 */
public enum PrereleaseTag {
    ALPHA(0),
    BETA(1),
    PREVIEW(1),
    RC(2);

    private final int rank;

    PrereleaseTag(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PrereleaseTag> fromLabel(String label) {
        if (label == null) return Optional.empty();
        for (PrereleaseTag tag : values()) {
            if (tag.label().equalsIgnoreCase(label)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
