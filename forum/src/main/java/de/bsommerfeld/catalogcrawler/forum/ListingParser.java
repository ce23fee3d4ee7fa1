package de.bsommerfeld.catalogcrawler.forum;

import com.google.inject.Singleton;
import de.bsommerfeld.catalogcrawler.core.config.ForumConfig;
import de.bsommerfeld.catalogcrawler.core.domain.ParseResult;
import de.bsommerfeld.catalogcrawler.core.domain.ThreadSummary;
import jakarta.inject.Inject;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one category listing page into {@link ThreadSummary} entries, in
 * display order.
 *
 * <h3>Item structure</h3>
 *
 * <pre>
 * div.structItem--thread
 *   ├ a.labelLink*                 prefix labels (engine, status)
 *   ├ a[data-tp-primary=on]        title + thread URL
 *   ├ a.username                   author
 *   ├ span.ratingStars[title]      "4.50 star(s)"
 *   ├ span.ratingStarsRow-text     "87 Votes"
 *   └ div.structItem-cell--meta
 *       └ dl.pairs (dt[title=Replies|Views], dd)
 * </pre>
 *
 * Every field except the primary link is optional and defaults to 0 / empty.
 * Items whose URL carries no thread id are dropped since they could never be
 * deduplicated; ids on the ignore list (pinned announcements) are dropped as
 * well. A malformed item is logged and skipped without affecting its
 * siblings.
 */
@Singleton
public class ListingParser {

    private static final Logger LOG = LoggerFactory.getLogger(ListingParser.class);

    private static final Pattern RATING = Pattern.compile("([\\d.]+)\\s+star");
    private static final Pattern DIGITS = Pattern.compile("(\\d+)");
    private static final Pattern COMPACT_COUNT = Pattern.compile("([\\d.]+)\\s*([KkMm]?)");

    private final String baseUrl;
    private final Set<String> ignoredThreadIds;

    @Inject
    public ListingParser(ForumConfig config) {
        this.baseUrl = config.getBaseUrl();
        this.ignoredThreadIds = Set.copyOf(config.getIgnoredThreadIds());
    }

    /**
     * Parses all thread items of a listing page.
     *
     * @return summaries in document order, never {@code null}
     */
    public List<ThreadSummary> parse(String html) {
        Document doc = Jsoup.parse(html, baseUrl);
        List<ThreadSummary> threads = new ArrayList<>();

        for (Element item : doc.select("div.structItem--thread")) {
            ParseResult<ThreadSummary> result = parseItem(item);
            result.value().ifPresentOrElse(threads::add,
                    () -> LOG.debug("Skipping listing item: {}", result.reason().orElse("")));
        }
        return threads;
    }

    private ParseResult<ThreadSummary> parseItem(Element item) {
        try {
            Element titleLink = item.selectFirst("a[data-tp-primary=on]");
            if (titleLink == null) {
                return ParseResult.skipped("no primary link");
            }

            String threadUrl = resolve(titleLink, "href");
            String title = titleLink.text().trim();

            Optional<String> threadId = ForumUrls.extractThreadId(threadUrl);
            if (threadId.isEmpty()) {
                return ParseResult.skipped("no thread id in " + threadUrl);
            }
            if (ignoredThreadIds.contains(threadId.get())) {
                LOG.info("Skipping ignored thread: {} (ID: {})", title, threadId.get());
                return ParseResult.skipped("ignored thread " + threadId.get());
            }

            Element authorLink = item.selectFirst("a.username");
            String author = authorLink != null ? authorLink.text().trim() : "Unknown";
            String authorUrl = authorLink != null ? resolve(authorLink, "href") : "";

            int replies = 0;
            int views = 0;
            for (Element pair : item.select("div.structItem-cell--meta dl.pairs")) {
                Element dt = pair.selectFirst("dt");
                Element dd = pair.selectFirst("dd");
                if (dt == null || dd == null) {
                    continue;
                }
                String label = dt.hasAttr("title") ? dt.attr("title") : dt.text();
                if (label.contains("Replies")) {
                    replies = parseCount(dd.text());
                } else if (label.contains("Views")) {
                    views = parseCount(dd.text());
                }
            }

            double rating = 0.0;
            Element stars = item.selectFirst("span.ratingStars");
            if (stars != null) {
                Matcher m = RATING.matcher(stars.attr("title"));
                if (m.find()) {
                    rating = Double.parseDouble(m.group(1));
                }
            }

            int ratingCount = 0;
            Element ratingText = item.selectFirst("span.ratingStarsRow-text");
            if (ratingText != null) {
                Matcher m = DIGITS.matcher(ratingText.text());
                if (m.find()) {
                    ratingCount = Integer.parseInt(m.group(1));
                }
            }

            List<String> prefixes = new ArrayList<>();
            for (Element label : item.select("a.labelLink")) {
                prefixes.add(label.text().trim());
            }

            return ParseResult.parsed(new ThreadSummary(threadId.get(), threadUrl, title, author, authorUrl,
                    replies, views, rating, ratingCount, prefixes));
        } catch (RuntimeException e) {
            LOG.error("Error parsing thread item", e);
            return ParseResult.skipped("malformed item: " + e.getMessage());
        }
    }

    /**
     * Parses a displayed counter. Thousands separators are dropped and the
     * compact suffixes XenForo uses for large numbers are expanded
     * ({@code 12K} → 12000, {@code 1.2M} → 1200000).
     *
     * @throws NumberFormatException if the text holds no number
     */
    static int parseCount(String text) {
        String cleaned = text.trim().replace(",", "");
        if (cleaned.isEmpty()) {
            return 0;
        }
        Matcher m = COMPACT_COUNT.matcher(cleaned);
        if (!m.matches()) {
            throw new NumberFormatException("Not a count: " + text);
        }
        String suffix = m.group(2).toUpperCase(Locale.ROOT);
        if (suffix.isEmpty()) {
            return Integer.parseInt(m.group(1));
        }
        double multiplier = suffix.equals("K") ? 1_000 : 1_000_000;
        return (int) Math.round(Double.parseDouble(m.group(1)) * multiplier);
    }

    private static String resolve(Element element, String attribute) {
        String absolute = element.absUrl(attribute);
        return absolute.isEmpty() ? element.attr(attribute) : absolute;
    }
}
