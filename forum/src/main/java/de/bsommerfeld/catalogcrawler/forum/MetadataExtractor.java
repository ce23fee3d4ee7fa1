package de.bsommerfeld.catalogcrawler.forum;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the free-text metadata block out of the first post.
 *
 * <p>
 * Authors follow a loose template ({@code Release Date: 2024-01-15},
 * {@code OS: Windows, Linux}, ...) with one field per line. Each field has
 * its own {@link ExtractionRule}; rules are independent, so a missing or
 * mangled line only loses that field.
 */
public final class MetadataExtractor {

    /** Known platforms in the order they are appended to the categories. */
    static final List<String> PLATFORMS = ImmutableList.of("Windows", "Linux", "Mac", "Android", "iOS");

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    /** Wire field name to rule, in evaluation order. */
    static final Map<String, ExtractionRule> RULES = ImmutableMap.<String, ExtractionRule>builder()
            .put("thread_updated", ExtractionRule.of("^\\s*Thread Updated[:\\s]+(\\d{4}-\\d{2}-\\d{2})"))
            .put("release_date", ExtractionRule.of("^\\s*Release Date[:\\s]+(\\d{4}-\\d{2}-\\d{2})"))
            .put("censored", ExtractionRule.of("^\\s*Censored[:\\s]+([^\\n]+)"))
            .put("os_platforms", ExtractionRule.of("^\\s*OS[:\\s]+([^\\n]+)"))
            .put("language", ExtractionRule.of("^\\s*Language[:\\s]+([^\\n]+)"))
            .put("genre", ExtractionRule.of("^\\s*Genre[:\\s]+([^\\n]+)"))
            .build();

    private static final Pattern OVERVIEW = Pattern.compile(
            "Overview[:\\s]+(.*?)(?=\\n\\n|Thread Updated|Release Date|Developer|\\z)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern OS_LINE = Pattern.compile("^\\s*OS[:\\s]", Pattern.CASE_INSENSITIVE);

    private MetadataExtractor() {
    }

    /**
     * A line pattern with one capture group plus a post-processing step
     * applied to the captured value.
     */
    record ExtractionRule(Pattern pattern, UnaryOperator<String> postProcess) {

        static ExtractionRule of(String regex) {
            return new ExtractionRule(Pattern.compile(regex, FLAGS), String::trim);
        }

        Optional<String> apply(String text) {
            Matcher m = pattern.matcher(text);
            if (!m.find()) {
                return Optional.empty();
            }
            String value = postProcess.apply(m.group(1));
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        }
    }

    /**
     * Evaluates every rule against the plain text of the post.
     *
     * @return the fields that were found, in rule order
     */
    public static Map<String, String> extractFields(String plainText) {
        Map<String, String> fields = new LinkedHashMap<>();
        RULES.forEach((field, rule) -> rule.apply(plainText).ifPresent(value -> fields.put(field, value)));
        return fields;
    }

    /**
     * Text after the {@code Overview} label up to the first blank line, the
     * next well-known label or the end of the post.
     */
    public static Optional<String> extractOverview(String plainText) {
        Matcher m = OVERVIEW.matcher(plainText);
        if (!m.find()) {
            return Optional.empty();
        }
        String overview = m.group(1).trim();
        return overview.isEmpty() ? Optional.empty() : Optional.of(overview);
    }

    /**
     * Platforms named on the first {@code OS} line of the post, in
     * {@link #PLATFORMS} order.
     */
    public static List<String> inferPlatforms(String plainText) {
        List<String> platforms = new ArrayList<>();
        for (String line : plainText.split("\n")) {
            if (!OS_LINE.matcher(line).find()) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            for (String platform : PLATFORMS) {
                if (lower.contains(platform.toLowerCase(Locale.ROOT))) {
                    platforms.add(platform);
                }
            }
            break;
        }
        return platforms;
    }

    /**
     * Reads the genre list written inline after a {@code <b>Genre:</b>}
     * label. Siblings are collected until the next bold label, line break
     * or block element.
     */
    public static Optional<String> extractGenreFromLabel(Element content) {
        Optional<Element> label = HtmlText.findBoldLabel(content, "Genre:");
        if (label.isEmpty()) {
            return Optional.empty();
        }

        List<String> parts = new ArrayList<>();
        for (Node sibling = label.get().nextSibling(); sibling != null; sibling = sibling.nextSibling()) {
            String text;
            if (sibling instanceof Element element) {
                if (element.isBlock() || "b".equals(element.normalName()) || "br".equals(element.normalName())) {
                    break;
                }
                text = element.text().trim();
            } else if (sibling instanceof TextNode textNode) {
                text = textNode.text().trim();
            } else {
                continue;
            }
            if (!text.isEmpty() && !text.equals(":")) {
                parts.add(text);
            }
        }

        String genre = String.join(" ", parts).trim();
        return genre.isEmpty() ? Optional.empty() : Optional.of(genre);
    }

    /**
     * The first link after the {@code Developer:} label, as an absolute URL.
     */
    public static Optional<String> extractDeveloperUrl(Element content) {
        return HtmlText.findBoldLabel(content, "Developer:")
                .flatMap(label -> HtmlText.findNext(content, label, e -> "a".equals(e.normalName()) && e.hasAttr("href")))
                .map(link -> {
                    String absolute = link.absUrl("href");
                    return absolute.isEmpty() ? link.attr("href") : absolute;
                })
                .filter(url -> !url.isBlank());
    }

    /**
     * Text of the first spoiler block following a bold label, e.g. the
     * changelog behind {@code <b>Changelog:</b>}. The toggle button is not
     * part of the text when the block has a content element.
     */
    public static Optional<String> extractSpoilerAfterLabel(Element content, String label) {
        return HtmlText.findBoldLabel(content, label)
                .flatMap(bold -> HtmlText.findNext(content, bold,
                        e -> "div".equals(e.normalName()) && e.hasClass("bbCodeSpoiler")))
                .map(spoiler -> {
                    Element body = spoiler.selectFirst("div.bbCodeSpoiler-content");
                    return HtmlText.plainText(body != null ? body : spoiler).trim();
                })
                .filter(text -> !text.isEmpty());
    }
}
