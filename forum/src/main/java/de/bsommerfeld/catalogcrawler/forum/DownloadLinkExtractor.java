package de.bsommerfeld.catalogcrawler.forum;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import de.bsommerfeld.catalogcrawler.core.domain.DownloadLink;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the download section of a post and lists its file-hoster links.
 *
 * <p>
 * The section starts at the first text mentioning {@code DOWNLOAD}; its
 * enclosing block is scanned for links to known hosters. Each link's
 * visible text is the hoster name ({@code MEGA}, {@code PIXELDRAIN}). The
 * platform comes from the label written before the links on the same line,
 * e.g. {@code <b>Win/Linux</b>: <a>MEGA</a> - <a>GOFILE</a>}.
 */
public final class DownloadLinkExtractor {

    static final List<String> HOSTING_PATTERNS = ImmutableList.of(
            "mega.nz", "pixeldrain", "gofile", "anonfiles", "workupload",
            "mediafire", "uploadhaven", "mixdrop", "krakenfiles", "dropbox",
            "drive.google", "nopy.to", "wetransfer", "sendspace", "buzzheavier",
            "uploadnow", "f95zone.to/masked", "catbox.moe", "datanodes.to");

    /** Forum navigation texts that end up next to links in badly formatted posts. */
    static final ImmutableSet<String> UI_CHROME = ImmutableSet.of(
            "REACTIONS", "MEMBERS", "LOGIN", "REGISTER", "FORUMS", "TAGS");

    private static final Pattern DOWNLOAD_MARKER = Pattern.compile("DOWNLOAD", Pattern.CASE_INSENSITIVE);
    private static final List<String> PLATFORM_MARKERS = ImmutableList.of("Win", "Mac", "Linux", "Android");

    private DownloadLinkExtractor() {
    }

    /**
     * Extracts the download links of a post body.
     *
     * @return links in document order, empty if the post has no download
     *         section
     */
    public static List<DownloadLink> extract(Element content) {
        Optional<TextNode> marker = HtmlText.findTextNode(content, text -> DOWNLOAD_MARKER.matcher(text).find());
        if (marker.isEmpty()) {
            return List.of();
        }

        Element section = blockContainer(marker.get(), content);
        List<DownloadLink> links = new ArrayList<>();

        for (Element link : section.select("a[href]")) {
            String href = link.attr("href");
            if (!isHostingLink(href)) {
                continue;
            }
            String text = link.text().trim();
            if (text.length() < 2 || UI_CHROME.contains(text.toUpperCase(Locale.ROOT))) {
                continue;
            }
            links.add(new DownloadLink(findPlatform(link, section), text.toUpperCase(Locale.ROOT), href));
        }
        return links;
    }

    static boolean isHostingLink(String href) {
        String lower = href.toLowerCase(Locale.ROOT);
        for (String host : HOSTING_PATTERNS) {
            if (lower.contains(host)) {
                return true;
            }
        }
        return false;
    }

    private static Element blockContainer(TextNode marker, Element content) {
        Element current = marker.parent() instanceof Element markerParent ? markerParent : content;
        while (current != content && !current.isBlock()) {
            Element parent = current.parent();
            if (parent == null) {
                return content;
            }
            current = parent;
        }
        return current;
    }

    private static String findPlatform(Element link, Element section) {
        for (Element sibling = link.previousElementSibling(); sibling != null;
             sibling = sibling.previousElementSibling()) {
            if ("br".equals(sibling.normalName())) {
                break;
            }
            String text = sibling.text();
            if (mentionsPlatform(text)) {
                return text.trim();
            }
        }

        Element parent = link.parent();
        if (parent != null && parent != section && mentionsPlatform(parent.ownText())) {
            return parent.ownText().trim();
        }
        return "";
    }

    private static boolean mentionsPlatform(String text) {
        for (String marker : PLATFORM_MARKERS) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
