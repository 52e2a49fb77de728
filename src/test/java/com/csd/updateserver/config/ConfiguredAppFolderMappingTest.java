package com.csd.updateserver.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ConfiguredAppFolderMappingTest {

    @Test
    void bindsBothMapsFromProperties() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("update-server.app-names[Demo]", "demo-folder")
                .withProperty("update-server.app-folder-names[Demo]", "demo-app");

        ConfiguredAppFolderMapping mapping = new ConfiguredAppFolderMapping(environment);

        assertEquals(Optional.of("demo-folder"), mapping.folderFor("Demo"));
        assertEquals(Optional.of("demo-app"), mapping.deviceFolderFor("Demo"));
        assertTrue(mapping.folderFor("Other").isEmpty());
    }

    @Test
    void missingPropertiesMeanNoMappings() {
        ConfiguredAppFolderMapping mapping = new ConfiguredAppFolderMapping(new MockEnvironment());

        assertTrue(mapping.folderFor("Demo").isEmpty());
        assertTrue(mapping.deviceFolderFor("Demo").isEmpty());
    }
}
