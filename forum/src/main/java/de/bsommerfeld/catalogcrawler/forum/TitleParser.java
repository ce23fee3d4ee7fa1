package de.bsommerfeld.catalogcrawler.forum;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a thread title such as {@code "[Ren'Py] [Completed] Game Name [v1.2.3] [DevCo]"}
 * into its parts.
 *
 * <h3>Rules</h3>
 * <ol>
 * <li>Label spans ({@code span.label}, {@code span.pre-renpy}) become
 * categories and are removed from the title.</li>
 * <li>The version is the first bracket group that starts with an optional
 * {@code v} followed by a digit or dot.</li>
 * <li>The developer is the last bracket group, unless it is the version
 * itself.</li>
 * </ol>
 *
 * The equality check in rule 3 is all there is to tell them apart, so a
 * developer named like a version number is not recognized.
 */
public final class TitleParser {

    private static final Pattern VERSION = Pattern.compile("\\[v?([\\d.]+[^\\]]*)\\]");
    private static final Pattern LAST_BRACKET = Pattern.compile("\\[([^\\]]+)\\](?!.*\\[)");

    private TitleParser() {
    }

    /**
     * Components of a thread title. {@code version} and {@code developer}
     * are empty strings when not present.
     */
    public record ParsedTitle(String title, String version, String developer, List<String> categories) {

        public ParsedTitle {
            categories = List.copyOf(categories);
        }
    }

    /**
     * Parses the title node of a thread page.
     */
    public static ParsedTitle parse(Element titleNode) {
        String fullTitle = titleNode.text().replace('\u00A0', ' ').trim();
        List<String> categories = new ArrayList<>();
        String cleanTitle = fullTitle;

        for (Element label : titleNode.select("span.label, span.pre-renpy")) {
            String text = label.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            categories.add(text);
            cleanTitle = cleanTitle.replace(text, "").trim();
        }

        return parse(cleanTitle, categories);
    }

    /**
     * Parses a title that has already been stripped of its labels.
     */
    public static ParsedTitle parse(String cleanTitle, List<String> categories) {
        String version = "";
        Matcher versionMatcher = VERSION.matcher(cleanTitle);
        if (versionMatcher.find()) {
            version = versionMatcher.group(1).trim();
        }

        String developer = "";
        Matcher devMatcher = LAST_BRACKET.matcher(cleanTitle);
        if (devMatcher.find()) {
            String candidate = devMatcher.group(1).trim();
            if (!candidate.equals(version)) {
                developer = candidate;
            }
        }

        String title = cleanTitle;
        if (!version.isEmpty()) {
            title = title.replace("[v" + version + "]", "").replace("[" + version + "]", "");
        }
        if (!developer.isEmpty()) {
            title = title.replace("[" + developer + "]", "");
        }

        return new ParsedTitle(title.trim(), version, developer, categories);
    }
}
