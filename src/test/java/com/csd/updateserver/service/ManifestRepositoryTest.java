package com.csd.updateserver.service;

import com.csd.updateserver.model.UpgradeKind;
import com.csd.updateserver.model.UpgradeManifest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ManifestRepositoryTest {

    @TempDir
    Path appFolder;

    private final ManifestRepository repository = new ManifestRepository(new ObjectMapper());

    @Test
    void missingDirectoryYieldsNothing() {
        assertTrue(repository.loadForApp(appFolder).isEmpty());
    }

    @Test
    void readsEveryField() throws IOException {
        writeManifest("fix-config.json", """
                {
                  "id": "fix-config",
                  "name": "Fix config",
                  "description": "Rewrites the broken config",
                  "version": "1.0.0",
                  "type": "Config",
                  "appliesTo": { "minVersion": "1.0.0", "maxVersion": "2.0.0", "excludeVersions": ["1.5.0"] },
                  "targetVersion": "1.2.0",
                  "priority": 5,
                  "dependencies": ["base"],
                  "conflicts": ["legacy-config"],
                  "storage": { "type": "local", "path": "fix-config" },
                  "files": [ { "path": "app.conf", "target": "conf", "required": true, "size": 42, "runOrder": 1 } ],
                  "postInstallScript": "systemctl restart app",
                  "checksum": { "algorithm": "sha256", "value": "abc" },
                  "metadata": { "Owner": "ops" },
                  "somethingNew": true
                }
                """);

        List<UpgradeManifest> manifests = repository.loadForApp(appFolder);

        assertEquals(1, manifests.size());
        UpgradeManifest manifest = manifests.get(0);
        assertEquals("fix-config", manifest.getId());
        assertEquals(5, manifest.getPriority());
        assertEquals(List.of("base"), manifest.getDependencies());
        assertEquals(List.of("legacy-config"), manifest.getConflicts());
        assertEquals("2.0.0", manifest.getAppliesTo().getMaxVersion());
        assertEquals("fix-config", manifest.getStorage().getPath());
        assertEquals(42L, manifest.totalFileSize());
        assertEquals("ops", manifest.getMetadata().get("Owner"));
        assertEquals(UpgradeKind.STANDARD, manifest.getKind());
    }

    @Test
    void badFilesAreSkippedWithoutFailingTheBatch() throws IOException {
        writeManifest("a-broken.json", "{ not json");
        writeManifest("b-no-id.json", "{ \"name\": \"nameless\" }");
        writeManifest("c-bad-version.json", "{ \"id\": \"bad\", \"targetVersion\": \"soon\" }");
        writeManifest("d-good.json", "{ \"id\": \"good\" }");
        writeManifest("notes.txt", "{ \"id\": \"ignored\" }");

        List<UpgradeManifest> manifests = repository.loadForApp(appFolder);

        assertEquals(List.of("good"), ids(manifests));
        assertNotNull(manifests.get(0).getDependencies());
        assertNotNull(manifests.get(0).getFiles());
    }

    @Test
    void idsThatWouldLeaveTheUpgradesFolderAreSkipped() throws IOException {
        writeManifest("a.json", "{ \"id\": \"../escape\" }");
        writeManifest("b.json", "{ \"id\": \"nested/id\" }");
        writeManifest("c.json", "{ \"id\": \"back\\\\slash\" }");
        writeManifest("d.json", "{ \"id\": \".\" }");
        writeManifest("e.json", "{ \"id\": \"fix-config_v2.1\" }");

        assertEquals(List.of("fix-config_v2.1"), ids(repository.loadForApp(appFolder)));
    }

    @Test
    void folderNameCheck() {
        assertTrue(ManifestRepository.isSafeFolderName("fix-config"));
        assertTrue(ManifestRepository.isSafeFolderName("v1.2.3"));
        assertFalse(ManifestRepository.isSafeFolderName(".."));
        assertFalse(ManifestRepository.isSafeFolderName("a/../b"));
        assertFalse(ManifestRepository.isSafeFolderName("a\\b"));
        assertFalse(ManifestRepository.isSafeFolderName("."));
    }

    @Test
    void duplicateIdsKeepTheFirstFileByName() throws IOException {
        writeManifest("1-first.json", "{ \"id\": \"dup\", \"priority\": 1 }");
        writeManifest("2-second.json", "{ \"id\": \"dup\", \"priority\": 2 }");

        List<UpgradeManifest> manifests = repository.loadForApp(appFolder);

        assertEquals(1, manifests.size());
        assertEquals(1, manifests.get(0).getPriority());
    }

    @Test
    void nullListsAreNormalised() throws IOException {
        writeManifest("nulls.json", "{ \"id\": \"nulls\", \"dependencies\": null, \"files\": null }");

        UpgradeManifest manifest = repository.loadForApp(appFolder).get(0);

        assertTrue(manifest.getDependencies().isEmpty());
        assertTrue(manifest.getFiles().isEmpty());
    }

    private void writeManifest(String name, String json) throws IOException {
        Path dir = Files.createDirectories(appFolder.resolve(ManifestRepository.MANIFESTS_FOLDER));
        Files.writeString(dir.resolve(name), json);
    }

    private static List<String> ids(List<UpgradeManifest> manifests) {
        return manifests.stream().map(UpgradeManifest::getId).collect(Collectors.toList());
    }
}
