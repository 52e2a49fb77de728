package com.csd.updateserver.service;

import com.csd.updateserver.config.UpdateServerSettings;
import com.csd.updateserver.model.AppUpdateInfo;
import com.csd.updateserver.model.AppVersion;
import com.csd.updateserver.model.UpdateFileRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class UpdateLocatorTest {

    @TempDir
    Path appsRoot;

    private UpdateLocator locator;
    private Path demo;

    @BeforeEach
    void setUp() throws IOException {
        UpdateServerSettings settings = new UpdateServerSettings();
        settings.setAppsRoot(appsRoot.toString());
        Map<String, String> mapping = Map.of("Demo", "demo");
        locator = new UpdateLocator(name -> Optional.ofNullable(mapping.get(name)), settings);
        demo = Files.createDirectories(appsRoot.resolve("demo"));
    }

    @Test
    void folderComesFromMappingThenSameNamedDirectory() throws IOException {
        Files.createDirectories(appsRoot.resolve("Other"));
        assertEquals(demo, locator.getFolder("Demo").orElseThrow());
        assertEquals(appsRoot.resolve("Other"), locator.getFolder("Other").orElseThrow());
        assertTrue(locator.getFolder("Missing").isEmpty());
        assertTrue(locator.getFolder("../outside").isEmpty());
    }

    @Test
    void versionIsTakenFromFileName() {
        assertEquals(AppVersion.parse("1.2.3"), UpdateLocator.versionFromFileName("demo-1.2.3.tar.gz").orElseThrow());
        assertEquals("1.1.0-beta.ab12cd3",
                UpdateLocator.versionFromFileName("demo-1.1.0-beta.ab12cd3.tar.gz").orElseThrow().toString());
        assertEquals(AppVersion.parse("2.0.1"), UpdateLocator.versionFromFileName("my-app-2.0.1.exe").orElseThrow());
        assertTrue(UpdateLocator.versionFromFileName("demo.tar.gz").isEmpty());
        assertTrue(UpdateLocator.versionFromFileName("demo-latest.tar.gz").isEmpty());
    }

    @Test
    void highestVersionWins() throws IOException {
        write("demo-1.9.0.tar.gz", 100);
        write("demo-1.10.0.tar.gz", 50);
        write("demo-1.2.0.tar.gz", 200);

        assertEquals("demo-1.10.0.tar.gz", locator.scanLatest(demo, false).orElseThrow().getFileName());
    }

    @Test
    void wildcardOutranksVersionedFiles() throws IOException {
        write("demo-9.0.0.tar.gz", 200);
        write("demo.tar.gz", 100);

        UpdateFileRecord latest = locator.scanLatest(demo, false).orElseThrow();
        assertEquals("demo.tar.gz", latest.getFileName());
        assertTrue(latest.isWildcard());
    }

    @Test
    void newerWildcardWinsAmongWildcards() throws IOException {
        write("demo-a.tar.gz", 100);
        write("demo-b.tar.gz", 300);

        assertEquals("demo-b.tar.gz", locator.scanLatest(demo, false).orElseThrow().getFileName());
    }

    @Test
    void sameRankTagsFallBackToModificationTime() throws IOException {
        write("demo-2.0.0-beta.aaa.tar.gz", 500);
        write("demo-2.0.0-preview.bbb.tar.gz", 100);

        assertEquals("demo-2.0.0-beta.aaa.tar.gz", locator.scanLatest(demo, true).orElseThrow().getFileName());
    }

    @Test
    void prereleasesAreSkippedUnlessRequested() throws IOException {
        write("demo-1.0.0.tar.gz", 100);
        write("demo-1.1.0-beta.ab12cd3.tar.gz", 200);

        assertEquals("demo-1.0.0.tar.gz", locator.scanLatest(demo, false).orElseThrow().getFileName());
        assertEquals("demo-1.1.0-beta.ab12cd3.tar.gz", locator.scanLatest(demo, true).orElseThrow().getFileName());

        AppUpdateInfo info = locator.getLatestUpdateInfo(demo);
        assertEquals(AppVersion.parse("1.0.0"), info.getLatestStable().getVersion());
        assertEquals("1.1.0-beta.ab12cd3", info.getLatestPreRelease().getVersion().toString());
    }

    @Test
    void hiddenFilesAndDirectoriesAreIgnored() throws IOException {
        write(".demo-5.0.0.tar.gz", 100);
        Files.createDirectories(demo.resolve("cache"));
        write("demo-1.0.0.tar.gz", 100);

        assertEquals("demo-1.0.0.tar.gz", locator.scanLatest(demo, true).orElseThrow().getFileName());
    }

    @Test
    void emptyFolderHasNoLatest() {
        assertTrue(locator.scanLatest(demo, true).isEmpty());
        assertTrue(locator.checkVersion(demo, "0.1.0", null, null, true));
    }

    @Test
    void clientOnLatestVersionIsUpToDate() throws IOException {
        write("demo-1.0.0.tar.gz", 100);
        write("demo-1.1.0-beta.ab12cd3.tar.gz", 200);

        assertTrue(locator.checkVersion(demo, "1.0.0", null, null, false));
        assertFalse(locator.checkVersion(demo, "0.9.0", null, null, false));
        assertFalse(locator.checkVersion(demo, "1.0.0", null, null, true));
    }

    @Test
    void clientWithoutVersionOrTimestampIsOutOfDate() throws IOException {
        write("demo-1.0.0.tar.gz", 100);
        assertFalse(locator.checkVersion(demo, null, null, null, false));
    }

    @Test
    void newerFileTimestampMeansOutOfDate() throws IOException {
        write("demo.tar.gz", 1_000);

        assertFalse(locator.checkVersion(demo, null, Instant.ofEpochSecond(500), null, false));
        assertTrue(locator.checkVersion(demo, null, Instant.ofEpochSecond(1_000), null, false));
        assertTrue(locator.checkVersion(demo, null, Instant.ofEpochSecond(2_000), null, false));
    }

    @Test
    void checksumDecidesWhenSupplied() throws IOException {
        Path file = write("demo.tar.gz", 1_000);
        String md5 = UpdateLocator.md5Hex(file);

        assertTrue(locator.checkVersion(demo, null, Instant.ofEpochSecond(1), md5.toLowerCase(), false));
        assertFalse(locator.checkVersion(demo, null, Instant.ofEpochSecond(5_000), "00112233445566778899AABBCCDDEEFF", false));
    }

    @Test
    void checksumDoesNotOverrideNewerServerVersion() throws IOException {
        Path file = write("demo-2.0.0.tar.gz", 1_000);
        assertFalse(locator.checkVersion(demo, "1.0.0", null, UpdateLocator.md5Hex(file), false));
    }

    @Test
    void updateFileForAppResolvesThroughMapping() throws IOException {
        Path file = write("demo-1.0.0.tar.gz", 100);
        assertEquals(file, locator.getUpdateFileForApp("Demo", false).orElseThrow());
        assertTrue(locator.getUpdateFileForApp("Unknown", false).isEmpty());
    }

    private Path write(String name, long mtimeSeconds) throws IOException {
        Path file = demo.resolve(name);
        Files.writeString(file, name, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(file, FileTime.from(Instant.ofEpochSecond(mtimeSeconds)));
        return file;
    }
}
