package de.bsommerfeld.catalogcrawler.forum;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL conventions of the XenForo forum: listing pagination and thread ids.
 */
public final class ForumUrls {

    /** {@code threads/<slug>.<id>}, the id is the stable dedup key. */
    private static final Pattern THREAD_ID = Pattern.compile("threads/[^/]+\\.(\\d+)");

    private ForumUrls() {
    }

    /**
     * Extracts the numeric thread id from a thread URL.
     *
     * @return the id, or empty if the URL path does not follow the
     *         {@code threads/<slug>.<id>} pattern
     */
    public static Optional<String> extractThreadId(String threadUrl) {
        if (threadUrl == null) {
            return Optional.empty();
        }
        Matcher m = THREAD_ID.matcher(threadUrl);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * Returns the URL of a category listing page. Page 1 is the category URL
     * itself, later pages append {@code page-N}.
     */
    public static String listingPageUrl(String categoryUrl, int page) {
        if (page <= 1) {
            return categoryUrl;
        }
        String base = categoryUrl.endsWith("/") ? categoryUrl : categoryUrl + "/";
        return base + "page-" + page;
    }
}
