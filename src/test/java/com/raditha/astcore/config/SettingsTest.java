package com.raditha.astcore.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SettingsTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        Settings.clear();
    }

    @AfterEach
    void tearDown() {
        Settings.clear();
    }

    @Test
    void testLoadConfigMap_ClasspathDefaults() throws IOException {
        Settings.loadConfigMap();
        Object nested = Settings.getProperty("astcore");
        assertInstanceOf(Map.class, nested);
        assertEquals("cpp", ((Map<?, ?>) nested).get("language"));
        assertEquals(4, ((Map<?, ?>) nested).get("worker_threads"));
    }

    @Test
    void testLoadConfigMap_FileReplacesPreviousContent() throws IOException {
        Settings.setProperty("stale", "value");
        Settings.loadConfigMap(new File("src/test/resources/astcore-test.yml"));

        assertNull(Settings.getProperty("stale"));
        assertEquals(Boolean.FALSE, Settings.getProperty("warnings"));
        assertEquals("c", ((Map<?, ?>) Settings.getProperty("astcore")).get("language"));
    }

    @Test
    void testLoadConfigMap_EmptyFile() throws IOException {
        Path empty = Files.writeString(tempDir.resolve("empty.yml"), "");
        Settings.setProperty("x", 1);
        Settings.loadConfigMap(empty.toFile());
        assertNull(Settings.getProperty("x"));
    }

    @Test
    void testLoadConfigMap_RootMustBeMapping() throws IOException {
        Path list = Files.writeString(tempDir.resolve("list.yml"), "- a\n- b\n");
        assertThrows(IllegalArgumentException.class, () -> Settings.loadConfigMap(list.toFile()));
    }

    @Test
    void testLoadConfigMap_MissingFile() {
        assertThrows(IOException.class, () -> Settings.loadConfigMap(tempDir.resolve("absent.yml").toFile()));
    }

    @Test
    void testSetProperty_NullRemoves() {
        Settings.setProperty("key", "value");
        assertEquals("value", Settings.getProperty("key"));
        Settings.setProperty("key", null);
        assertNull(Settings.getProperty("key"));
    }
}
