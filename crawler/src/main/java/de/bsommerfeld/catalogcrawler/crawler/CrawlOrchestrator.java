package de.bsommerfeld.catalogcrawler.crawler;

import com.google.common.collect.Lists;
import com.google.inject.Singleton;
import de.bsommerfeld.catalogcrawler.catalog.CatalogClient;
import de.bsommerfeld.catalogcrawler.catalog.ThreadIdCache;
import de.bsommerfeld.catalogcrawler.core.config.CatalogConfig;
import de.bsommerfeld.catalogcrawler.core.config.ForumConfig;
import de.bsommerfeld.catalogcrawler.core.domain.GameRecord;
import de.bsommerfeld.catalogcrawler.core.domain.ParseResult;
import de.bsommerfeld.catalogcrawler.core.domain.SyncResult;
import de.bsommerfeld.catalogcrawler.core.domain.ThreadSummary;
import de.bsommerfeld.catalogcrawler.core.util.Sleeper;
import de.bsommerfeld.catalogcrawler.forum.FetchException;
import de.bsommerfeld.catalogcrawler.forum.ForumUrls;
import de.bsommerfeld.catalogcrawler.forum.ListingParser;
import de.bsommerfeld.catalogcrawler.forum.PageFetcher;
import de.bsommerfeld.catalogcrawler.forum.ThreadDetailParser;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one crawl run from the listing pages to the catalog.
 *
 * <pre>
 * seed      ThreadIdCache ← catalog existing-threads
 * listing   page N..N+k  → PageFetcher → ListingParser → summaries
 * filter    drop cached ids and repeats, cap at maxThreads
 * batches   claim → PageFetcher → ThreadDetailParser → GameRecord
 *           → CatalogClient.sendBatch → cache / release claims
 * report    counters + failed titles
 * </pre>
 *
 * <h3>Politeness</h3>
 * Every forum request, listing or detail, successful or not, is followed by
 * the configured delay. With several detail workers each worker waits after
 * its own request.
 *
 * <h3>Failures</h3>
 * Nothing that happens to a single page or thread ends the run. Unavailable
 * listing pages are skipped. In unbounded mode the listing ends only after
 * {@link #MAX_LISTING_FAILURES_IN_ROW} of them in a row. Threads that fail
 * to fetch, parse or deliver end up in the report's failed list and are
 * retried by the next run since they never enter the cache.
 *
 * <h3>Stopping</h3>
 * {@link #requestStop()} is safe to call from any thread (the JVM shutdown
 * hook does). No further page or batch is started afterwards; work already
 * dispatched completes.
 */
@Singleton
public class CrawlOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlOrchestrator.class);

    /** Unbounded listing gives up after this many unavailable pages in a row. */
    static final int MAX_LISTING_FAILURES_IN_ROW = 3;

    private final ForumConfig forumConfig;
    private final CatalogConfig catalogConfig;
    private final PageFetcher fetcher;
    private final ListingParser listingParser;
    private final ThreadDetailParser detailParser;
    private final ThreadIdCache cache;
    private final CatalogClient catalog;
    private final Sleeper sleeper;

    private volatile boolean stopRequested;

    @Inject
    public CrawlOrchestrator(ForumConfig forumConfig, CatalogConfig catalogConfig, PageFetcher fetcher,
            ListingParser listingParser, ThreadDetailParser detailParser, ThreadIdCache cache,
            CatalogClient catalog) {
        this(forumConfig, catalogConfig, fetcher, listingParser, detailParser, cache, catalog, Sleeper.THREAD);
    }

    CrawlOrchestrator(ForumConfig forumConfig, CatalogConfig catalogConfig, PageFetcher fetcher,
            ListingParser listingParser, ThreadDetailParser detailParser, ThreadIdCache cache,
            CatalogClient catalog, Sleeper sleeper) {
        this.forumConfig = forumConfig;
        this.catalogConfig = catalogConfig;
        this.fetcher = fetcher;
        this.listingParser = listingParser;
        this.detailParser = detailParser;
        this.cache = cache;
        this.catalog = catalog;
        this.sleeper = sleeper;
    }

    /**
     * Asks a running crawl to wind down after the work in flight.
     */
    public void requestStop() {
        if (!stopRequested) {
            LOG.info("Stop requested, finishing current work...");
        }
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * Executes a full crawl with the given options.
     */
    public CrawlReport run(CrawlOptions options) {
        cache.load(catalog, catalogConfig.getExistingPageSize());

        List<ThreadSummary> listed = collectListings(options);
        List<ThreadSummary> capped = options.maxThreads() > 0 && listed.size() > options.maxThreads()
                ? listed.subList(0, options.maxThreads())
                : listed;

        List<ThreadSummary> candidates = new ArrayList<>();
        Set<String> queued = new HashSet<>();
        int duplicates = 0;
        for (ThreadSummary thread : capped) {
            if (cache.contains(thread.threadId()) || !queued.add(thread.threadId())) {
                duplicates++;
            } else {
                candidates.add(thread);
            }
        }
        LOG.info("Listed {} threads, {} already known, {} to process", listed.size(), duplicates,
                candidates.size());

        RunState state = new RunState();
        ExecutorService pool = options.detailWorkers() > 1
                ? Executors.newFixedThreadPool(options.detailWorkers(), workerFactory())
                : null;
        try {
            int batchNumber = 0;
            for (List<ThreadSummary> batch : Lists.partition(candidates, options.batchSize())) {
                if (stopRequested) {
                    LOG.info("Stopping before batch {}", batchNumber + 1);
                    break;
                }
                batchNumber++;
                LOG.info("Processing batch {} ({} threads)", batchNumber, batch.size());
                processBatch(batch, options, pool, state);
            }
        } finally {
            if (pool != null) {
                shutdown(pool);
            }
        }

        CrawlReport report = new CrawlReport(listed.size(), duplicates + state.skippedClaims,
                state.processed, state.succeeded, state.failedTitles);
        logSummary(report);
        return report;
    }

    // =====================================================================
    // Listing phase
    // =====================================================================

    private List<ThreadSummary> collectListings(CrawlOptions options) {
        List<ThreadSummary> listed = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int failedInRow = 0;

        for (int index = 0; options.includesPage(index); index++) {
            if (stopRequested) {
                LOG.info("Stopping listing phase");
                break;
            }
            int page = options.startPage() + index;
            String url = ForumUrls.listingPageUrl(forumConfig.getCategoryUrl(), page);
            LOG.info("Fetching listing page {}: {}", page, url);

            List<ThreadSummary> threads;
            try {
                threads = listingParser.parse(fetcher.fetch(url));
            } catch (FetchException e) {
                LOG.warn("Skipping listing page {}: {}", page, e.getMessage());
                failedInRow++;
                if (options.infinite() && failedInRow >= MAX_LISTING_FAILURES_IN_ROW) {
                    LOG.warn("{} listing pages in a row unavailable, end of listing", failedInRow);
                    break;
                }
                continue;
            } finally {
                politeness(options);
            }
            failedInRow = 0;

            int fresh = 0;
            for (ThreadSummary thread : threads) {
                listed.add(thread);
                if (seen.add(thread.threadId())) {
                    fresh++;
                }
            }
            LOG.info("Page {}: {} threads ({} new)", page, threads.size(), fresh);

            if (options.infinite() && fresh == 0) {
                LOG.info("Page {} brought no new threads, end of listing", page);
                break;
            }
        }
        return listed;
    }

    // =====================================================================
    // Detail phase
    // =====================================================================

    private void processBatch(List<ThreadSummary> batch, CrawlOptions options, ExecutorService pool,
            RunState state) {
        Map<ThreadSummary, Future<ParseResult<GameRecord>>> dispatched = new LinkedHashMap<>();
        List<ThreadSummary> claimedThreads = new ArrayList<>();
        for (ThreadSummary thread : batch) {
            if (!cache.claim(thread.threadId())) {
                LOG.debug("Thread {} already claimed or known, skipping", thread.threadId());
                state.skippedClaims++;
                continue;
            }
            claimedThreads.add(thread);
            if (pool != null) {
                dispatched.put(thread, pool.submit(() -> processThread(thread, options)));
            }
        }

        List<GameRecord> records = new ArrayList<>();
        for (ThreadSummary thread : claimedThreads) {
            state.processed++;
            ParseResult<GameRecord> result = pool != null
                    ? await(thread, dispatched.get(thread))
                    : processSafely(thread, options);

            if (result.isParsed()) {
                records.add(result.value().orElseThrow());
            } else {
                LOG.warn("Failed to process '{}': {}", thread.title(), result.reason().orElse("unknown"));
                state.failedTitles.add(thread.title());
                cache.release(thread.threadId());
            }
        }

        if (records.isEmpty()) {
            return;
        }

        SyncResult sync = catalog.sendBatch(records);
        Set<String> synced = new HashSet<>(sync.syncedThreadIds());
        state.succeeded += sync.delivered();
        state.failedTitles.addAll(sync.failedTitles());
        for (GameRecord record : records) {
            if (!synced.contains(record.threadId())) {
                cache.release(record.threadId());
            }
        }
        if (sync.degraded()) {
            LOG.warn("Batch delivered individually: {} of {} records accepted", sync.delivered(), records.size());
        }
    }

    private ParseResult<GameRecord> processThread(ThreadSummary thread, CrawlOptions options) {
        LOG.info("Processing: {}", thread.title());
        String html;
        try {
            html = fetcher.fetch(thread.threadUrl());
        } catch (FetchException e) {
            return ParseResult.skipped("fetch failed: " + e.getMessage());
        } finally {
            politeness(options);
        }
        return detailParser.parse(html, thread);
    }

    private ParseResult<GameRecord> processSafely(ThreadSummary thread, CrawlOptions options) {
        try {
            return processThread(thread, options);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error on {}", thread.threadUrl(), e);
            return ParseResult.skipped("unexpected error: " + e.getMessage());
        }
    }

    private ParseResult<GameRecord> await(ThreadSummary thread, Future<ParseResult<GameRecord>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestStop();
            future.cancel(true);
            return ParseResult.skipped("interrupted");
        } catch (ExecutionException e) {
            LOG.error("Worker failed on {}", thread.threadUrl(), e.getCause());
            return ParseResult.skipped("worker error: " + e.getCause());
        }
    }

    private void politeness(CrawlOptions options) {
        if (options.delayMillis() <= 0) {
            return;
        }
        try {
            sleeper.sleep(options.delayMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestStop();
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "detail-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static void logSummary(CrawlReport report) {
        LOG.info("Crawl finished: {} listed, {} duplicates, {} processed, {} succeeded, {} failed",
                report.listed(), report.duplicates(), report.processed(), report.succeeded(), report.failed());
        if (report.failed() > 0) {
            LOG.warn("Failed threads{}:", report.failed() > CrawlReport.FAILED_PREVIEW
                    ? " (first " + CrawlReport.FAILED_PREVIEW + ")"
                    : "");
            report.failedPreview().forEach(title -> LOG.warn("  - {}", title));
        }
    }

    /** Mutable counters of a run, confined to the calling thread. */
    private static final class RunState {
        int processed;
        int succeeded;
        int skippedClaims;
        final List<String> failedTitles = new ArrayList<>();
    }
}
