package de.bsommerfeld.catalogcrawler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Crawl pacing and limits. Command-line options override these per run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlConfig {

    @JsonProperty("delay-between-requests-seconds")
    private double delayBetweenRequestsSeconds = 2.0;

    @JsonProperty("batch-size")
    private int batchSize = 10;

    @JsonProperty("pages")
    private int pages = 1;

    @JsonProperty("start-page")
    private int startPage = 1;

    /** Upper bound on listed threads per run, 0 means unlimited. */
    @JsonProperty("max-threads")
    private int maxThreads = 0;

    @JsonProperty("detail-workers")
    private int detailWorkers = 1;

    public double getDelayBetweenRequestsSeconds() {
        return delayBetweenRequestsSeconds;
    }

    public void setDelayBetweenRequestsSeconds(double delayBetweenRequestsSeconds) {
        this.delayBetweenRequestsSeconds = delayBetweenRequestsSeconds;
    }

    public long getDelayMillis() {
        return Math.round(delayBetweenRequestsSeconds * 1000);
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getPages() {
        return pages;
    }

    public int getStartPage() {
        return startPage;
    }

    public int getMaxThreads() {
        return maxThreads;
    }

    public int getDetailWorkers() {
        return detailWorkers;
    }

    public void setDetailWorkers(int detailWorkers) {
        this.detailWorkers = detailWorkers;
    }
}
