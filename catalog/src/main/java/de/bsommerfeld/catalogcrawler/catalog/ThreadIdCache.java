package de.bsommerfeld.catalogcrawler.catalog;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory set of thread ids already present in the catalog.
 *
 * <p>
 * Seeded once per run from the catalog by {@link #load}, then only grows as
 * records are confirmed. Nothing is persisted; the next run rebuilds it.
 *
 * <h3>Claims</h3>
 * With several detail workers a thread must not be fetched twice while it
 * is in flight. {@link #claim} marks an id as taken; the claim ends with
 * {@link #insert} once the catalog confirmed the record, or with
 * {@link #release} when processing failed and a later run may retry it.
 */
@Singleton
public class ThreadIdCache {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadIdCache.class);

    private final Set<String> known = ConcurrentHashMap.newKeySet();
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    /**
     * Pages through {@code source} and adds every id. Stops at the first
     * short page. A failing page ends the load early and keeps what was
     * read so far; the crawl then runs with a partial cache.
     *
     * @return number of ids read from the source
     */
    public int load(ExistingThreadSource source, int pageSize) {
        LOG.info("Loading existing thread ids from catalog...");
        int loaded = 0;
        int offset = 0;
        try {
            while (true) {
                List<String> page = source.fetchPage(pageSize, offset);
                for (String id : page) {
                    if (id != null) {
                        known.add(id);
                    }
                }
                loaded += page.size();
                offset += page.size();
                if (page.size() < pageSize) {
                    break;
                }
            }
        } catch (CatalogException | RuntimeException e) {
            LOG.warn("Could not load all existing thread ids (got {} so far): {}", loaded, e.getMessage());
        }
        LOG.info("Loaded {} existing thread ids.", known.size());
        return loaded;
    }

    public boolean contains(String threadId) {
        return threadId != null && known.contains(threadId);
    }

    /**
     * Records a thread as present in the catalog and ends its claim.
     * {@code null} is ignored.
     */
    public void insert(String threadId) {
        if (threadId == null) {
            return;
        }
        known.add(threadId);
        claimed.remove(threadId);
    }

    /**
     * Atomically marks a thread as in flight.
     *
     * @return {@code false} if the thread is already in the catalog or
     *         claimed by someone else
     */
    public boolean claim(String threadId) {
        if (threadId == null || known.contains(threadId)) {
            return false;
        }
        return claimed.add(threadId);
    }

    public void release(String threadId) {
        if (threadId != null) {
            claimed.remove(threadId);
        }
    }

    public boolean isClaimed(String threadId) {
        return threadId != null && claimed.contains(threadId);
    }

    public int size() {
        return known.size();
    }
}
