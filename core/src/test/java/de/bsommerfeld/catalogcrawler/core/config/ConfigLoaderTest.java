package de.bsommerfeld.catalogcrawler.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigLoader(new ObjectMapper());
    }

    @Test
    void load_shouldReadAllSections() throws Exception {
        Path file = write("""
                {
                  "forum": {
                    "category-url": "https://forum.test/forums/games.2/",
                    "max-attempts": 5,
                    "cookies": [ { "name": "xf_user", "value": "abc" } ]
                  },
                  "catalog": {
                    "api-url": "https://catalog.test/v1",
                    "api-key": "secret",
                    "existing-page-size": 500
                  },
                  "crawl": {
                    "delay-between-requests-seconds": 0.5,
                    "batch-size": 4,
                    "detail-workers": 2
                  }
                }
                """);

        CrawlerConfig config = loader.load(file);

        assertEquals("https://forum.test/forums/games.2/", config.getForum().getCategoryUrl());
        assertEquals(5, config.getForum().getMaxAttempts());
        assertEquals(1, config.getForum().getCookies().size());
        assertEquals("xf_user", config.getForum().getCookies().get(0).getName());
        assertEquals("f95zone.to", config.getForum().getCookies().get(0).getDomain());
        assertEquals("https://catalog.test/v1", config.getCatalog().getApiUrl());
        assertEquals("secret", config.getCatalog().getApiKey());
        assertEquals(500, config.getCatalog().getExistingPageSize());
        assertEquals(500, config.getCrawl().getDelayMillis());
        assertEquals(4, config.getCrawl().getBatchSize());
        assertEquals(2, config.getCrawl().getDetailWorkers());
    }

    @Test
    void load_shouldKeepDefaultsForMissingSections() throws Exception {
        Path file = write("""
                { "catalog": { "api-url": "https://catalog.test/v1", "api-key": "k" } }
                """);

        CrawlerConfig config = loader.load(file);

        assertEquals("https://f95zone.to", config.getForum().getBaseUrl());
        assertEquals(10, config.getCrawl().getBatchSize());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws Exception {
        Path file = write("""
                { "catalog": { "api-url": "https://c.test", "api-key": "k", "legacy": true }, "extra": 1 }
                """);

        assertDoesNotThrow(() -> loader.load(file));
    }

    @Test
    void load_shouldFailForMissingFile() {
        var ex = assertThrows(ConfigException.class, () -> loader.load(tempDir.resolve("absent.json")));
        assertTrue(ex.getMessage().contains("not found"));
    }

    @Test
    void load_shouldFailForMalformedJson() throws Exception {
        Path file = write("{ \"catalog\": ");

        var ex = assertThrows(ConfigException.class, () -> loader.load(file));
        assertTrue(ex.getMessage().startsWith("Invalid JSON"));
    }

    @Test
    void load_shouldRequireApiKey() throws Exception {
        Path file = write("""
                { "catalog": { "api-url": "https://c.test" } }
                """);

        var ex = assertThrows(ConfigException.class, () -> loader.load(file));
        assertEquals("catalog.api-key is required", ex.getMessage());
    }

    @Test
    void load_shouldRejectNonPositiveBatchSize() throws Exception {
        Path file = write("""
                { "catalog": { "api-url": "https://c.test", "api-key": "k" }, "crawl": { "batch-size": 0 } }
                """);

        var ex = assertThrows(ConfigException.class, () -> loader.load(file));
        assertTrue(ex.getMessage().contains("crawl.batch-size"));
    }

    @Test
    void load_shouldRejectZeroTimeout() throws Exception {
        Path file = write("""
                { "catalog": { "api-url": "https://c.test", "api-key": "k" }, "forum": { "timeout-seconds": 0 } }
                """);

        var ex = assertThrows(ConfigException.class, () -> loader.load(file));
        assertEquals("forum.timeout-seconds must be positive, was 0", ex.getMessage());
    }

    @Test
    void resolveConfigPath_shouldPreferExplicitPath() {
        assertEquals(Path.of("/etc/crawler.json"), ConfigLoader.resolveConfigPath("/etc/crawler.json"));
    }

    @Test
    void resolveConfigPath_shouldFallBackToConfigJson() {
        Path resolved = ConfigLoader.resolveConfigPath(null);
        assertEquals(ConfigLoader.CONFIG_FILE_NAME, resolved.getFileName().toString());
    }

    private Path write(String json) throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, json);
        return file;
    }
}
