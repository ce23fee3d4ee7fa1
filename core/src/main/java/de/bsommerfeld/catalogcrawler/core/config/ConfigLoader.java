package de.bsommerfeld.catalogcrawler.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.catalogcrawler.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads {@link CrawlerConfig} from a JSON file and rejects configurations
 * the crawler cannot run with.
 *
 * <h3>Lookup order</h3>
 * <ol>
 * <li>an explicit path (the {@code --config} option)</li>
 * <li>{@code config.json} in the working directory</li>
 * <li>{@code config.json} in the user's app data directory</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String APP_NAME = "catalog-crawler";
    public static final String CONFIG_FILE_NAME = "config.json";

    private final ObjectMapper mapper;

    public ConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Picks the config file according to the lookup order. The returned path
     * may not exist; {@link #load(Path)} reports that.
     */
    public static Path resolveConfigPath(String explicitPath) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            return Paths.get(explicitPath);
        }
        Path local = Paths.get(CONFIG_FILE_NAME);
        if (Files.exists(local)) {
            return local;
        }
        return StorageUtils.getAppDataDir(APP_NAME).resolve(CONFIG_FILE_NAME);
    }

    public CrawlerConfig load(Path path) throws ConfigException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Config file " + path.toAbsolutePath() + " not found");
        }
        LOG.info("Loading configuration from: {}", path.toAbsolutePath());

        CrawlerConfig config;
        try {
            config = mapper.readValue(path.toFile(), CrawlerConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid JSON in config file " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Could not read config file " + path, e);
        }
        if (config == null) {
            throw new ConfigException("Config file " + path + " is empty");
        }
        validate(config);
        return config;
    }

    static void validate(CrawlerConfig config) throws ConfigException {
        CatalogConfig catalog = config.getCatalog();
        if (isBlank(catalog.getApiUrl())) {
            throw new ConfigException("catalog.api-url is required");
        }
        if (isBlank(catalog.getApiKey())) {
            throw new ConfigException("catalog.api-key is required");
        }
        requirePositive("catalog.existing-page-size", catalog.getExistingPageSize());
        requirePositive("forum.max-attempts", config.getForum().getMaxAttempts());
        requirePositive("crawl.batch-size", config.getCrawl().getBatchSize());
        requirePositive("crawl.detail-workers", config.getCrawl().getDetailWorkers());
        requirePositive("crawl.pages", config.getCrawl().getPages());
        requirePositive("crawl.start-page", config.getCrawl().getStartPage());
        requirePositive("forum.timeout-seconds", config.getForum().getTimeoutSeconds());
        requirePositive("catalog.timeout-seconds", catalog.getTimeoutSeconds());
        requirePositive("catalog.batch-timeout-seconds", catalog.getBatchTimeoutSeconds());
        if (config.getCrawl().getDelayBetweenRequestsSeconds() < 0) {
            throw new ConfigException("crawl.delay-between-requests-seconds must not be negative");
        }
    }

    private static void requirePositive(String key, long value) throws ConfigException {
        if (value <= 0) {
            throw new ConfigException(key + " must be positive, was " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
