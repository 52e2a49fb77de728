package com.csd.updateserver.service;

import com.csd.updateserver.config.AppFolderMapping;
import com.csd.updateserver.config.UpdateServerSettings;
import com.csd.updateserver.model.AppUpdateInfo;
import com.csd.updateserver.model.AppVersion;
import com.csd.updateserver.model.UpdateFileRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds an app's update folder and the newest update file in it.
 *
 * <p>Update files follow {@code <name>-<major.minor[.patch[.build]]>[-<tag>.<shortId>].<ext>} with
 * {@code ext} being {@code tar.gz} or {@code exe}. A file whose name carries no parseable version is a
 * wildcard and always counts as the latest.</p>
 */
@Slf4j
@Service
public class UpdateLocator {

    public static final String TAR_GZ = ".tar.gz";
    public static final String EXE = ".exe";

    private static final Pattern VERSIONED_NAME = Pattern.compile("^.+?-([vV]?\\d+\\.\\d+.*)$");

    private final AppFolderMapping folderMapping;
    private final UpdateServerSettings settings;

    public UpdateLocator(AppFolderMapping folderMapping, UpdateServerSettings settings) {
        this.folderMapping = folderMapping;
        this.settings = settings;
    }

    public Optional<Path> getFolder(String appName) {
        if (appName == null || appName.isBlank()) {
            return Optional.empty();
        }
        Path appsRoot = settings.appsRootPath();
        Optional<String> mapped = folderMapping.folderFor(appName);
        if (mapped.isPresent()) {
            return Optional.of(appsRoot.resolve(mapped.get()).normalize());
        }
        Path sameName = appsRoot.resolve(appName).normalize();
        if (sameName.startsWith(appsRoot) && Files.isDirectory(sameName)) {
            return Optional.of(sameName);
        }
        return Optional.empty();
    }

    public Optional<Path> getUpdateFileForApp(String appName, boolean includePrerelease) {
        return getFolder(appName)
                .flatMap(folder -> scanLatest(folder, includePrerelease))
                .map(UpdateFileRecord::getFilePath);
    }

    public AppUpdateInfo getLatestUpdateInfo(Path folder) {
        UpdateFileRecord stable = scanLatest(folder, false).orElse(null);
        UpdateFileRecord preRelease = scanLatest(folder, true).orElse(null);
        return new AppUpdateInfo(stable, preRelease);
    }

    public Optional<UpdateFileRecord> scanLatest(Path folder, boolean includePrerelease) {
        if (folder == null || !Files.isDirectory(folder)) {
            return Optional.empty();
        }
        List<UpdateFileRecord> candidates;
        try (Stream<Path> files = Files.list(folder)) {
            candidates = files
                    .filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .map(this::toRecord)
                    .filter(r -> includePrerelease || !r.isPrerelease())
                    .sorted(UpdateFileRecord.NEWEST_FIRST)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list update folder " + folder, e);
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(0));
    }

    /**
     * Tells whether the client already has the latest file.
     *
     * @return true when up to date
     */
    public boolean checkVersion(Path folder, String clientVersion, Instant clientModifiedSince,
                                String clientChecksum, boolean includePrerelease) {
        Optional<UpdateFileRecord> latestFile = scanLatest(folder, includePrerelease);
        if (latestFile.isEmpty()) {
            return true;
        }
        UpdateFileRecord latest = latestFile.get();

        boolean hasVersion = clientVersion != null && !clientVersion.isBlank();
        if (!hasVersion && clientModifiedSince == null) {
            return false;
        }

        if (hasVersion && latest.getVersion() != null
                && latest.getVersion().isNewerThan(AppVersion.parse(clientVersion))) {
            return false;
        }

        if (clientChecksum != null && !clientChecksum.isBlank()) {
            return md5Hex(latest.getFilePath()).equalsIgnoreCase(clientChecksum.trim());
        }

        if (clientModifiedSince != null
                && latest.getLastModified().truncatedTo(ChronoUnit.SECONDS).isAfter(clientModifiedSince)) {
            return false;
        }
        return true;
    }

    /**
     * Version encoded in an update file name, or empty for wildcard names.
     */
    static Optional<AppVersion> versionFromFileName(String fileName) {
        String base = stripExtension(fileName);
        Matcher m = VERSIONED_NAME.matcher(base);
        if (!m.matches()) {
            return Optional.empty();
        }
        return AppVersion.tryParse(m.group(1));
    }

    static String stripExtension(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(TAR_GZ)) {
            return fileName.substring(0, fileName.length() - TAR_GZ.length());
        }
        if (lower.endsWith(EXE)) {
            return fileName.substring(0, fileName.length() - EXE.length());
        }
        int dot = fileName.lastIndexOf('.');
        // a dot inside the version itself is not an extension
        if (dot > 0 && dot + 1 < fileName.length() && !Character.isDigit(fileName.charAt(dot + 1))) {
            return fileName.substring(0, dot);
        }
        return fileName;
    }

    private UpdateFileRecord toRecord(Path file) {
        AppVersion version = versionFromFileName(file.getFileName().toString()).orElse(null);
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read attributes of " + file, e);
        }
        return new UpdateFileRecord(file, version, attributes.lastModifiedTime().toInstant(), attributes.size());
    }

    static String md5Hex(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                md5.update(buffer, 0, read);
            }
            return HexFormat.of().withUpperCase().formatHex(md5.digest());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash " + file, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
