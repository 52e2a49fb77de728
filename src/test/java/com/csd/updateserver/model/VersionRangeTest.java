package com.csd.updateserver.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VersionRangeTest {

    @Test
    void minIsInclusiveMaxIsExclusive() {
        VersionRange range = VersionRange.builder().minVersion("1.0.0").maxVersion("2.0.0").build();
        assertTrue(range.contains(AppVersion.parse("1.0.0")));
        assertTrue(range.contains(AppVersion.parse("1.9.9")));
        assertFalse(range.contains(AppVersion.parse("2.0.0")));
        assertFalse(range.contains(AppVersion.parse("0.9.0")));
    }

    @Test
    void openBoundsAcceptEverything() {
        assertTrue(new VersionRange().contains(AppVersion.parse("0.0.1")));
        assertTrue(VersionRange.builder().minVersion("1.0").build().contains(AppVersion.parse("99.0.0")));
    }

    @Test
    void excludedVersionsAreRejected() {
        VersionRange range = VersionRange.builder()
                .minVersion("1.0.0")
                .excludeVersions(List.of("1.2", "1.3.0-beta.xyz"))
                .build();
        assertFalse(range.contains(AppVersion.parse("1.2.0")));
        assertFalse(range.contains(AppVersion.parse("1.3.0-beta.xyz")));
        assertTrue(range.contains(AppVersion.parse("1.2.1")));
    }
}
