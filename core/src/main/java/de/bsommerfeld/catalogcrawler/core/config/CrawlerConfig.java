package de.bsommerfeld.catalogcrawler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the crawler configuration file. Each section maps to one JSON
 * object; missing sections fall back to their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlerConfig {

    @JsonProperty("forum")
    private ForumConfig forum = new ForumConfig();

    @JsonProperty("catalog")
    private CatalogConfig catalog = new CatalogConfig();

    @JsonProperty("crawl")
    private CrawlConfig crawl = new CrawlConfig();

    public ForumConfig getForum() {
        return forum;
    }

    public CatalogConfig getCatalog() {
        return catalog;
    }

    public CrawlConfig getCrawl() {
        return crawl;
    }
}
