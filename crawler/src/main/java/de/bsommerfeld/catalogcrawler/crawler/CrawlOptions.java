package de.bsommerfeld.catalogcrawler.crawler;

import de.bsommerfeld.catalogcrawler.core.config.CrawlConfig;

/**
 * Effective parameters of one crawl run: the {@code crawl} config section
 * with command-line overrides applied.
 *
 * @param startPage     first listing page, 1-based
 * @param pages         number of listing pages, ignored when {@code infinite}
 * @param infinite      page until a listing page brings no new thread
 * @param maxThreads    cap on listed threads, 0 for no cap
 * @param batchSize     records per catalog request
 * @param delayMillis   politeness delay after every forum request
 * @param detailWorkers concurrent detail fetches, 1 for sequential
 */
public record CrawlOptions(
        int startPage,
        int pages,
        boolean infinite,
        int maxThreads,
        int batchSize,
        long delayMillis,
        int detailWorkers) {

    public CrawlOptions {
        if (startPage < 1) {
            throw new IllegalArgumentException("startPage must be at least 1, was " + startPage);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, was " + batchSize);
        }
        if (detailWorkers < 1) {
            throw new IllegalArgumentException("detailWorkers must be at least 1, was " + detailWorkers);
        }
    }

    public static CrawlOptions from(CrawlConfig config, CommandLineArgs args) {
        return new CrawlOptions(
                args.startPage() != null ? args.startPage() : config.getStartPage(),
                args.pages() != null ? args.pages() : config.getPages(),
                args.infinite(),
                args.maxThreads() != null ? args.maxThreads() : config.getMaxThreads(),
                args.batchSize() != null ? args.batchSize() : config.getBatchSize(),
                config.getDelayMillis(),
                config.getDetailWorkers());
    }

    /** Whether listing page number {@code index} (0-based) is within range. */
    boolean includesPage(int index) {
        return infinite || index < pages;
    }
}
