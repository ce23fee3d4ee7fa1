package de.bsommerfeld.catalogcrawler.crawler;

import java.util.List;

/**
 * Counters of a finished crawl run.
 *
 * @param listed       threads read from the listing pages
 * @param duplicates   threads skipped because the catalog already has them
 *                     or they were listed twice
 * @param processed    threads whose detail page was attempted
 * @param succeeded    records the catalog confirmed
 * @param failedTitles titles of threads that could not be fetched, parsed
 *                     or delivered
 */
public record CrawlReport(int listed, int duplicates, int processed, int succeeded, List<String> failedTitles) {

    static final int FAILED_PREVIEW = 10;

    public CrawlReport {
        failedTitles = List.copyOf(failedTitles);
    }

    public int failed() {
        return failedTitles.size();
    }

    /** At most {@value #FAILED_PREVIEW} failed titles, for the summary log. */
    public List<String> failedPreview() {
        return failedTitles.subList(0, Math.min(FAILED_PREVIEW, failedTitles.size()));
    }
}
