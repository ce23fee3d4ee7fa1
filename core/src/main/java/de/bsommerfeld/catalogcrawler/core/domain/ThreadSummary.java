package de.bsommerfeld.catalogcrawler.core.domain;

import java.util.List;

/**
 * One thread as it appears on a category listing page, before its detail
 * page has been fetched.
 *
 * @param threadId    numeric id taken from the thread URL path, the dedup key
 * @param threadUrl   absolute thread URL
 * @param title       raw listing title (prefix labels excluded)
 * @param author      thread starter, {@code "Unknown"} if absent
 * @param authorUrl   absolute profile URL, empty if absent
 * @param replies     reply count, 0 if absent
 * @param views       view count, 0 if absent
 * @param rating      average rating 0.0–5.0, 0.0 if unrated
 * @param ratingCount number of ratings, 0 if unrated
 * @param prefixes    prefix labels in display order (engine, status, ...)
 */
public record ThreadSummary(
        String threadId,
        String threadUrl,
        String title,
        String author,
        String authorUrl,
        int replies,
        int views,
        double rating,
        int ratingCount,
        List<String> prefixes) {

    public ThreadSummary {
        prefixes = prefixes == null ? List.of() : List.copyOf(prefixes);
    }
}
