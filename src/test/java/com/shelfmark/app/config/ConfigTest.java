package com.shelfmark.app.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @Test
    void dataDirComesFromSystemProperty() {
        // Set by Surefire in pom.xml.
        String configured = System.getProperty("shelfmark.dataDir");
        assertNotNull(configured, "Tests expect shelfmark.dataDir to be set by Surefire");

        Path dataDir = Config.getDataDir();
        assertEquals(Path.of(configured), dataDir);
        assertTrue(Config.getDbFilePath().startsWith(dataDir));
        assertTrue(Config.getDbUrl().startsWith("jdbc:sqlite:"));
        assertTrue(Config.getDbUrl().endsWith("catalog.db"));
    }

    @Test
    void thumbnailDirDefaultsUnderDataDir_andRelativeOverrideIsResolvedAgainstIt() {
        assertEquals(Config.getDataDir().resolve("thumbnails"), Config.getThumbnailDir());

        System.setProperty("shelfmark.thumbnailDir", "previews");
        try {
            assertEquals(Config.getDataDir().resolve("previews"), Config.getThumbnailDir());
        } finally {
            System.clearProperty("shelfmark.thumbnailDir");
        }
    }
}
