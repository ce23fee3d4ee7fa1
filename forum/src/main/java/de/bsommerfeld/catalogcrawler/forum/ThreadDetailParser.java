package de.bsommerfeld.catalogcrawler.forum;

import com.google.inject.Singleton;
import de.bsommerfeld.catalogcrawler.core.config.CatalogConfig;
import de.bsommerfeld.catalogcrawler.core.config.ForumConfig;
import de.bsommerfeld.catalogcrawler.core.domain.GameRecord;
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
import java.util.Map;

/**
 * Builds a {@link GameRecord} from a thread page and the listing summary
 * that led to it.
 *
 * <h3>Required structure</h3>
 * The title ({@code h1.p-title-value}), the first post
 * ({@code article.message-body}) and its content wrapper
 * ({@code div.bbWrapper}). A page lacking any of them is skipped.
 *
 * <h3>Best effort</h3>
 * Everything else (version, metadata lines, spoilers, download links,
 * images) is optional and extracted independently. All text patterns run
 * against the plain-text rendering taken before the image pipeline touches
 * the tree.
 */
@Singleton
public class ThreadDetailParser {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadDetailParser.class);

    private final String baseUrl;
    private final ContentImageNormalizer imageNormalizer;

    @Inject
    public ThreadDetailParser(ForumConfig forumConfig, CatalogConfig catalogConfig) {
        this.baseUrl = forumConfig.getBaseUrl();
        this.imageNormalizer = new ContentImageNormalizer(
                forumConfig.getAttachmentHost(), catalogConfig.getImageProxyEndpoint());
    }

    /**
     * Parses one thread page. Never throws for malformed input.
     *
     * @param html    raw page body
     * @param summary listing entry of the thread, its fields are carried
     *                over into the record
     */
    public ParseResult<GameRecord> parse(String html, ThreadSummary summary) {
        try {
            return parseDocument(Jsoup.parse(html, baseUrl), summary);
        } catch (RuntimeException e) {
            LOG.error("Error parsing thread {}", summary.threadUrl(), e);
            return ParseResult.skipped("parser error: " + e.getMessage());
        }
    }

    private ParseResult<GameRecord> parseDocument(Document doc, ThreadSummary summary) {
        Element titleNode = doc.selectFirst("h1.p-title-value");
        if (titleNode == null) {
            return skip(summary, "no title element");
        }
        Element post = doc.selectFirst("article.message-body");
        if (post == null) {
            return skip(summary, "no first post");
        }
        Element content = post.selectFirst("div.bbWrapper");
        if (content == null) {
            return skip(summary, "no content wrapper");
        }

        TitleParser.ParsedTitle title = TitleParser.parse(titleNode);
        String plainText = HtmlText.plainText(content);

        List<String> categories = new ArrayList<>(title.categories());
        categories.addAll(MetadataExtractor.inferPlatforms(plainText));

        GameRecord.Builder builder = GameRecord.builder(summary)
                .title(title.title())
                .version(title.version())
                .developer(title.developer())
                .categories(categories)
                .tags(extractTags(doc));

        Map<String, String> fields = MetadataExtractor.extractFields(plainText);
        fields.forEach(builder::metadata);
        MetadataExtractor.extractGenreFromLabel(content).ifPresent(genre -> builder.metadata("genre", genre));

        MetadataExtractor.extractOverview(plainText).ifPresent(builder::overview);
        MetadataExtractor.extractDeveloperUrl(content).ifPresent(builder::developerUrl);
        MetadataExtractor.extractSpoilerAfterLabel(content, "Changelog:").ifPresent(builder::changelog);
        MetadataExtractor.extractSpoilerAfterLabel(content, "Installation:").ifPresent(builder::installation);

        builder.downloadLinks(DownloadLinkExtractor.extract(content));

        ContentImageNormalizer.NormalizedImages images = imageNormalizer.normalize(content);
        builder.images(images.images())
                .featuredImage(images.featuredImage())
                .content(content.outerHtml());

        GameRecord record = builder.build();
        LOG.debug("Parsed thread {}: {} (version '{}', {} images, {} download links)", summary.threadId(),
                record.title(), record.version(), record.images().size(), record.downloadLinks().size());
        return ParseResult.parsed(record);
    }

    private static List<String> extractTags(Document doc) {
        List<String> tags = new ArrayList<>();
        for (Element tag : doc.select("span.js-tagList a.tagItem")) {
            String text = tag.text().trim();
            if (!text.isEmpty()) {
                tags.add(text);
            }
        }
        return tags;
    }

    private static ParseResult<GameRecord> skip(ThreadSummary summary, String reason) {
        LOG.warn("Skipping thread {}: {}", summary.threadUrl(), reason);
        return ParseResult.skipped(reason);
    }
}
