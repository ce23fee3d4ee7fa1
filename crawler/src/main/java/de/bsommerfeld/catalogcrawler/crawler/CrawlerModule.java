package de.bsommerfeld.catalogcrawler.crawler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import de.bsommerfeld.catalogcrawler.catalog.CatalogClient;
import de.bsommerfeld.catalogcrawler.catalog.ExistingThreadSource;
import de.bsommerfeld.catalogcrawler.core.config.CatalogConfig;
import de.bsommerfeld.catalogcrawler.core.config.CrawlConfig;
import de.bsommerfeld.catalogcrawler.core.config.CrawlerConfig;
import de.bsommerfeld.catalogcrawler.core.config.ForumConfig;

/**
 * Guice wiring for a crawl run.
 *
 * <p>
 * The configuration is loaded before the injector exists so that a broken
 * config file ends the process with a clear message instead of a
 * provisioning error. Components bind to themselves through their
 * {@code @Singleton} annotations.
 */
public class CrawlerModule extends AbstractModule {

    private final CrawlerConfig config;
    private final ObjectMapper mapper;

    public CrawlerModule(CrawlerConfig config, ObjectMapper mapper) {
        this.config = config;
        this.mapper = mapper;
    }

    @Override
    protected void configure() {
        bind(CrawlerConfig.class).toInstance(config);

        // Sections, so components only see what they use
        bind(ForumConfig.class).toInstance(config.getForum());
        bind(CatalogConfig.class).toInstance(config.getCatalog());
        bind(CrawlConfig.class).toInstance(config.getCrawl());

        bind(ObjectMapper.class).toInstance(mapper);
        bind(ExistingThreadSource.class).to(CatalogClient.class);
    }
}
