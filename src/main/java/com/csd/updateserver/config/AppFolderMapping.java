package com.csd.updateserver.config;

import java.util.Optional;

/**
 * Read-only lookup from public app names to on-disk folder names and device folder names.
 */
public interface AppFolderMapping {

    /**
     * Folder under the apps root holding the app's update files.
     */
    Optional<String> folderFor(String appName);

    /**
     * Folder name the app is installed under on the device. Used by generated legacy scripts.
     */
    default Optional<String> deviceFolderFor(String appName) {
        return Optional.empty();
    }
}
