package com.csd.updateserver.service;

import com.csd.updateserver.config.UpdateServerSettings;
import com.csd.updateserver.exception.CacheUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * On-disk archive cache shared by all requests. Entries are keyed by fingerprint and never evicted.
 *
 * <p>At most one build runs per fingerprint at a time, and finished archives are published by
 * renaming a fully written temp file, so readers never see a partial archive.</p>
 */
@Slf4j
@Service
public class PackageCache {

    public static final String CACHE_FOLDER = "cache";
    public static final String ARCHIVE_SUFFIX = ".tar.gz";

    private final UpdateServerSettings settings;
    private final Map<String, BuildLock> locks = new ConcurrentHashMap<>();

    public PackageCache(UpdateServerSettings settings) {
        this.settings = settings;
    }

    @FunctionalInterface
    public interface ArchiveWriter {
        void writeTo(Path target) throws IOException;
    }

    /**
     * Per-fingerprint lock with a count of the threads holding or waiting for it. The entry leaves the
     * table when the count drops to zero; the count is only changed inside map compute calls.
     */
    private static final class BuildLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    public Path preferredDir(Path appFolder) {
        return appFolder.resolve(CACHE_FOLDER);
    }

    public Path fallbackDir(String appName) {
        return settings.cacheFallbackRootPath().resolve(appName);
    }

    /**
     * An existing archive for the fingerprint in either cache location.
     */
    public Optional<Path> lookup(Path appFolder, String appName, String fingerprint) {
        String fileName = fingerprint + ARCHIVE_SUFFIX;
        for (Path dir : new Path[]{preferredDir(appFolder), fallbackDir(appName)}) {
            Path candidate = dir.resolve(fileName);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * The app's own cache folder when writable, otherwise a per-app folder under the fallback root.
     *
     * @throws CacheUnavailableException when neither can be written
     */
    public Path resolveCacheDir(Path appFolder, String appName) {
        Path preferred = preferredDir(appFolder);
        try {
            checkWritable(preferred);
            return preferred;
        } catch (IOException e) {
            Path fallback = fallbackDir(appName);
            log.warn("Cache directory {} is not writable ({}), falling back to {}", preferred, e.toString(), fallback);
            try {
                checkWritable(fallback);
                return fallback;
            } catch (IOException fallbackError) {
                fallbackError.addSuppressed(e);
                throw new CacheUnavailableException(preferred, fallback, fallbackError);
            }
        }
    }

    /**
     * Returns the cached archive for the fingerprint, building it under the fingerprint's lock when
     * missing. The writer fills a temp file in the cache dir which is then renamed into place; on
     * failure the temp file is removed and nothing is published.
     */
    public Path getOrBuild(Path appFolder, String appName, String fingerprint, ArchiveWriter writer) throws IOException {
        Optional<Path> hit = lookup(appFolder, appName, fingerprint);
        if (hit.isPresent()) {
            log.info("Returning cached package: {}", hit.get());
            return hit.get();
        }

        String key = appName + "/" + fingerprint;
        BuildLock buildLock = acquire(key);
        try {
            hit = lookup(appFolder, appName, fingerprint);
            if (hit.isPresent()) {
                log.info("Package {} was built by a concurrent request", hit.get().getFileName());
                return hit.get();
            }
            Path cacheDir = resolveCacheDir(appFolder, appName);
            Path target = cacheDir.resolve(fingerprint + ARCHIVE_SUFFIX);
            return publish(target, writer);
        } finally {
            release(key, buildLock);
        }
    }

    private BuildLock acquire(String key) {
        BuildLock buildLock = locks.compute(key, (k, existing) -> {
            BuildLock entry = existing != null ? existing : new BuildLock();
            entry.users++;
            return entry;
        });
        buildLock.lock.lock();
        return buildLock;
    }

    private void release(String key, BuildLock buildLock) {
        buildLock.lock.unlock();
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    int lockCount() {
        return locks.size();
    }

    Path publish(Path target, ArchiveWriter writer) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        boolean published = false;
        try {
            writer.writeTo(temp);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, using plain replace", target.getParent());
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            published = true;
            log.info("Published package {} ({} bytes)", target, Files.size(target));
            return target;
        } finally {
            if (!published) {
                Files.deleteIfExists(temp);
            }
        }
    }

    private static void checkWritable(Path dir) throws IOException {
        Files.createDirectories(dir);
        Path marker = Files.createTempFile(dir, ".write-check-", ".tmp");
        Files.delete(marker);
    }
}
