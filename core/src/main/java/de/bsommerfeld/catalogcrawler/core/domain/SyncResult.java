package de.bsommerfeld.catalogcrawler.core.domain;

import java.util.List;

/**
 * Outcome of one synchronization call against the catalog.
 *
 * @param created         records the catalog created
 * @param skipped         records the catalog already had
 * @param syncedThreadIds ids of records the catalog confirmed
 * @param failedTitles    titles of records that could not be delivered
 * @param degraded        {@code true} if the batch call failed and records
 *                        were sent one by one
 */
public record SyncResult(
        int created,
        int skipped,
        List<String> syncedThreadIds,
        List<String> failedTitles,
        boolean degraded) {

    public SyncResult {
        syncedThreadIds = List.copyOf(syncedThreadIds);
        failedTitles = List.copyOf(failedTitles);
    }

    public static SyncResult empty() {
        return new SyncResult(0, 0, List.of(), List.of(), false);
    }

    /** Number of records that reached the catalog, created or skipped. */
    public int delivered() {
        return syncedThreadIds.size();
    }
}
