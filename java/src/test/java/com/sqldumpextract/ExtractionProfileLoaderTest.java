package com.sqldumpextract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExtractionProfileLoaderTest {

    private static Path profiles() throws URISyntaxException {
        return Path.of(ExtractionProfileLoaderTest.class.getResource("/profiles.yaml").toURI());
    }

    @Test
    void load_namedProfile_readsAllSettings() throws Exception {
        ExtractionProfile profile = ExtractionProfileLoader.load(profiles(), "default");

        assertEquals("jsonl", profile.format());
        assertEquals("ISO-8859-1", profile.charset());
        assertEquals(List.of("ingredients"), profile.tables());
        assertEquals(25, profile.max_warnings());
        assertEquals(1024, profile.sqlite().cache_kb());
        assertEquals(0, profile.sqlite().mmap_mb());
        assertEquals(2, profile.sqlite().batch());
    }

    @Test
    void load_emptyProfile_keepsDefaults() throws Exception {
        ExtractionProfile profile = ExtractionProfileLoader.load(profiles(), "bare");

        assertNull(profile.format());
        assertTrue(profile.tables().isEmpty());
        assertEquals(ExtractionOptions.DEFAULT_MAX_WARNINGS, profile.max_warnings());
        assertEquals(1000, profile.sqlite().batch());
    }

    @Test
    void load_unknownProfile_listsAvailableOnes() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ExtractionProfileLoader.load(profiles(), "nightly"));
        assertTrue(ex.getMessage().contains("available: [bare, default]"));
    }

    @Test
    void load_invalidYaml_throwsIOException(@TempDir Path tmpDir) throws Exception {
        Path file = tmpDir.resolve("bad.yaml");
        Files.writeString(file, "profiles:\n  x:\n    max_warnings: lots\n");

        assertThrows(IOException.class, () -> ExtractionProfileLoader.load(file));
    }

    @Test
    void load_emptyFile_hasNoProfiles(@TempDir Path tmpDir) throws Exception {
        Path file = tmpDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertTrue(ExtractionProfileLoader.load(file).getProfiles().isEmpty());
    }
}
