package com.csd.updateserver.service;

import com.csd.updateserver.config.UpdateServerSettings;
import com.csd.updateserver.model.AppVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises clients that predate the manifest-driven upgrade protocol.
 */
@Slf4j
@Component
public class LegacyClientDetector {

    public static final String UPDATER_VERSION_HEADER = "X-Updater-Version";

    private static final Pattern USER_AGENT_MARKER = Pattern.compile("AppUpdater/(\\d+\\.\\d+\\.\\d+)");

    private final UpdateServerSettings settings;

    public LegacyClientDetector(UpdateServerSettings settings) {
        this.settings = settings;
    }

    /**
     * A client is legacy unless it reports an updater version of at least the configured minimum,
     * either as {@code AppUpdater/x.y.z} in its User-Agent or in the {@value #UPDATER_VERSION_HEADER} header.
     */
    public boolean isLegacy(String userAgent, String updaterVersionHeader) {
        String minVersion = settings.getMinUpdaterVersion();
        if (userAgent != null && !userAgent.isBlank()) {
            Matcher m = USER_AGENT_MARKER.matcher(userAgent);
            if (m.find()) {
                boolean legacy = VersionUtil.isBelow(m.group(1), minVersion);
                log.debug("Detected updater version {} from User-Agent. Is old: {}", m.group(1), legacy);
                return legacy;
            }
        }
        if (updaterVersionHeader != null && VersionUtil.isNumeric(updaterVersionHeader)) {
            boolean legacy = VersionUtil.isBelow(updaterVersionHeader, minVersion);
            log.debug("Detected updater version {} from header. Is old: {}", updaterVersionHeader, legacy);
            return legacy;
        }
        log.debug("No updater version detected, assuming old updater");
        return true;
    }

    /**
     * Updater version reported by the client, or null when it reported none that parses.
     */
    public String reportedUpdaterVersion(String userAgent, String updaterVersionHeader) {
        if (userAgent != null) {
            Matcher m = USER_AGENT_MARKER.matcher(userAgent);
            if (m.find()) return m.group(1);
        }
        if (updaterVersionHeader == null) return null;
        return AppVersion.tryParse(updaterVersionHeader)
                .map(v -> updaterVersionHeader.trim())
                .orElse(null);
    }
}
