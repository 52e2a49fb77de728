package com.csd.updateserver.service;

import com.csd.updateserver.config.UpdateServerSettings;
import com.csd.updateserver.exception.IntegrityMismatchException;
import com.csd.updateserver.exception.SourceMissingException;
import com.csd.updateserver.model.AppVersion;
import com.csd.updateserver.model.FileDirective;
import com.csd.updateserver.model.UpgradeKind;
import com.csd.updateserver.model.UpgradeManifest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class PackageBuilderTest {

    @TempDir
    Path root;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TarCodec tarCodec = new TarCodec();
    private UpdateServerSettings settings;
    private PackageBuilder builder;
    private Path demo;
    private Path upgradeRoot;

    @BeforeEach
    void setUp() throws IOException {
        settings = new UpdateServerSettings();
        settings.setAppsRoot(root.resolve("apps").toString());
        settings.setUpgradeRoot(root.resolve("upgrade").toString());
        settings.setCacheFallbackRoot(root.resolve("fallback").toString());
        settings.setScratchRoot(root.resolve("scratch").toString());

        Map<String, String> mapping = Map.of("Demo", "demo", "Updater", "updater");
        UpdateLocator locator = new UpdateLocator(name -> Optional.ofNullable(mapping.get(name)), settings);
        SelfUpdateService selfUpdateService = new SelfUpdateService(locator, settings);
        UpgradeResolver resolver = new UpgradeResolver(locator, new ManifestRepository(objectMapper), selfUpdateService);
        builder = new PackageBuilder(resolver, locator, selfUpdateService, tarCodec,
                new PackageCache(settings), settings, objectMapper);

        demo = Files.createDirectories(root.resolve("apps/demo"));
        upgradeRoot = Files.createDirectories(root.resolve("upgrade"));
        Files.writeString(demo.resolve("demo-1.0.0.tar.gz"), "app archive");
    }

    @Test
    void packageHoldsManifestsAndStagedFiles() throws IOException {
        addStandardUpgrade("fix-config", "patch.sh", "echo fixed");

        Path archive = builder.buildUpgradePackage("Demo", AppVersion.parse("0.9.0"), false, null).orElseThrow();
        Path extracted = root.resolve("extracted");
        tarCodec.extractTarGz(archive, extracted);

        assertEquals(demo.resolve(PackageCache.CACHE_FOLDER), archive.getParent());
        JsonNode packageManifest = objectMapper.readTree(extracted.resolve(PackageBuilder.PACKAGE_MANIFEST).toFile());
        assertEquals("0.9.0", packageManifest.get("fromVersion").asText());
        assertEquals("1.0.0", packageManifest.get("toVersion").asText());
        assertEquals("fix-config", packageManifest.get("upgrades").get(0).asText());
        assertEquals("app-update-1.0.0", packageManifest.get("upgrades").get(1).asText());

        Path fix = extracted.resolve("upgrades/fix-config");
        assertEquals("echo fixed", Files.readString(fix.resolve("patch.sh")));
        assertEquals("fix-config", objectMapper.readTree(fix.resolve("manifest.json").toFile()).get("id").asText());

        Path appUpdate = extracted.resolve("upgrades/app-update-1.0.0");
        assertEquals("app archive", Files.readString(appUpdate.resolve("demo-1.0.0.tar.gz")));
        JsonNode appManifest = objectMapper.readTree(appUpdate.resolve("manifest.json").toFile());
        JsonNode directive = appManifest.get("files").get(0);
        assertEquals("demo-1.0.0.tar.gz", directive.get("path").asText());
        assertTrue(directive.get("explode").asBoolean());
        assertEquals("AppUpdate", appManifest.get("metadata").get("Type").asText());
        assertNull(appManifest.get("kind"));
        assertNull(appManifest.get("sourceArchive"));
    }

    @Test
    void secondRequestIsServedFromCache() throws IOException {
        addStandardUpgrade("fix-config", "patch.sh", "echo fixed");
        Path first = builder.buildUpgradePackage("Demo", AppVersion.parse("0.9.0"), false, null).orElseThrow();

        // a rebuild would now fail on the missing source
        FileTrees.deleteQuietly(upgradeRoot.resolve("fix-config"));
        Path second = builder.buildUpgradePackage("Demo", AppVersion.parse("0.9.0"), false, null).orElseThrow();

        assertEquals(first, second);
    }

    @Test
    void missingSourceFailsWithoutLeavingPartialState() throws IOException {
        writeManifest("ghost.json", "{ \"id\": \"ghost\", \"storage\": { \"path\": \"ghost\" } }");

        assertThrows(SourceMissingException.class,
                () -> builder.buildUpgradePackage("Demo", AppVersion.parse("0.9.0"), false, null));

        assertTrue(list(demo.resolve(PackageCache.CACHE_FOLDER)).isEmpty());
        assertTrue(list(root.resolve("scratch")).isEmpty());
    }

    @Test
    void unwritableCacheFallsBack() throws IOException {
        // a dangling link where the cache folder should be
        Files.createSymbolicLink(demo.resolve(PackageCache.CACHE_FOLDER), root.resolve("nowhere"));

        Path archive = builder.buildUpgradePackage("Demo", AppVersion.parse("0.9.0"), false, null).orElseThrow();

        assertEquals(root.resolve("fallback/Demo"), archive.getParent());
        assertTrue(Files.isRegularFile(archive));

        Path again = builder.buildUpgradePackage("Demo", AppVersion.parse("0.9.0"), false, null).orElseThrow();
        assertEquals(archive, again);
    }

    @Test
    void upToDateClientGetsNoPackage() throws IOException {
        assertTrue(builder.buildUpgradePackage("Demo", AppVersion.parse("1.0.0"), false, null).isEmpty());
    }

    @Test
    void selfUpdateIsStagedForTheInstaller() throws IOException {
        Path updater = Files.createDirectories(root.resolve("apps/updater"));
        Files.writeString(updater.resolve("updater-2.1.0.tar.gz"), "new updater");

        Path archive = builder.buildUpgradePackage("Demo", AppVersion.parse("1.0.0"), false, "2.0.0").orElseThrow();
        Path extracted = root.resolve("extracted");
        tarCodec.extractTarGz(archive, extracted);

        Path selfUpdate = extracted.resolve("upgrades/updater-self-update-2.1.0");
        assertEquals("new updater", Files.readString(selfUpdate.resolve("updater-2.1.0.tar.gz")));
        JsonNode manifest = objectMapper.readTree(selfUpdate.resolve("manifest.json").toFile());
        JsonNode directive = manifest.get("files").get(0);
        assertEquals("/opt/updater/pending-update/updater-2.1.0", directive.get("target").asText());
        assertEquals(11L, directive.get("size").asLong());
        assertEquals("UpdaterSelfUpdate", manifest.get("metadata").get("Type").asText());
    }

    @Test
    void updaterArchiveChangedAfterResolutionIsRejected() throws IOException {
        Path updater = Files.createDirectories(root.resolve("apps/updater"));
        Path archive = Files.writeString(updater.resolve("updater-2.1.0.tar.gz"), "new updater");
        UpgradeManifest selfUpdate = UpgradeManifest.builder()
                .id("updater-self-update-2.1.0")
                .version("2.1.0")
                .kind(UpgradeKind.SELF_UPDATE)
                .sourceArchive(archive)
                .files(new ArrayList<>(List.of(FileDirective.builder()
                        .path("updater-2.1.0.tar.gz")
                        .size(Files.size(archive))
                        .build())))
                .build();

        Files.writeString(archive, "new updater, rebuilt in place");
        Path dest = root.resolve("staging");

        IntegrityMismatchException e = assertThrows(IntegrityMismatchException.class,
                () -> builder.stageSelfUpdate(selfUpdate, dest));
        assertTrue(e.getMessage().contains("expected 11 bytes"));
    }

    @Test
    void cancelledBuildLeavesNoTraces() throws IOException {
        addStandardUpgrade("fix-config", "patch.sh", "echo fixed");

        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedIOException.class,
                    () -> builder.buildUpgradePackage("Demo", AppVersion.parse("0.9.0"), false, null));
        } finally {
            Thread.interrupted();
        }

        assertEquals(List.of(), list(demo.resolve(PackageCache.CACHE_FOLDER)));
        assertEquals(List.of(), list(root.resolve("fallback")));
        assertEquals(List.of(), list(root.resolve("scratch")));

        Path archive = builder.buildUpgradePackage("Demo", AppVersion.parse("0.9.0"), false, null).orElseThrow();
        assertTrue(Files.isRegularFile(archive));
    }

    @Test
    void fingerprintIgnoresUpgradeOrder() {
        UpgradeManifest a = UpgradeManifest.builder().id("a").build();
        UpgradeManifest b = UpgradeManifest.builder().id("b").build();
        AppVersion client = AppVersion.parse("1.0.0");

        String fingerprint = PackageBuilder.fingerprint(client, List.of(a, b));

        assertEquals(fingerprint, PackageBuilder.fingerprint(client, List.of(b, a)));
        assertNotEquals(fingerprint, PackageBuilder.fingerprint(AppVersion.parse("1.0.1"), List.of(a, b)));
        assertTrue(fingerprint.matches("upgrade-1\\.0\\.0-[0-9a-f]{32}"));
    }

    @Test
    void concurrentRequestsShareOneBuild() throws Exception {
        addStandardUpgrade("fix-config", "patch.sh", "echo fixed");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Path>> calls = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                calls.add(() -> builder.buildUpgradePackage("Demo", AppVersion.parse("0.9.0"), false, null).orElseThrow());
            }
            List<Path> results = new ArrayList<>();
            for (Future<Path> future : pool.invokeAll(calls)) {
                results.add(future.get());
            }

            assertEquals(1, results.stream().distinct().count());
            List<String> cached = list(demo.resolve(PackageCache.CACHE_FOLDER));
            assertEquals(1, cached.size());
            assertTrue(cached.get(0).endsWith(".tar.gz"));
        } finally {
            pool.shutdownNow();
        }
    }

    private void addStandardUpgrade(String id, String fileName, String content) throws IOException {
        Path source = Files.createDirectories(upgradeRoot.resolve(id));
        Files.writeString(source.resolve(fileName), content);
        writeManifest(id + ".json", "{ \"id\": \"" + id + "\", \"priority\": 1, \"storage\": { \"type\": \"local\", \"path\": \"" + id + "\" } }");
    }

    private void writeManifest(String name, String json) throws IOException {
        Path dir = Files.createDirectories(demo.resolve(ManifestRepository.MANIFESTS_FOLDER));
        Files.writeString(dir.resolve(name), json);
    }

    private static List<String> list(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
        }
    }
}
