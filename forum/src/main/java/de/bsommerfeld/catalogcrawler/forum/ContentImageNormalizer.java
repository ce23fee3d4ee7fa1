package de.bsommerfeld.catalogcrawler.forum;

import org.jsoup.nodes.Element;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Prepares the images of a post body for publication.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li><b>collect</b>: the gallery URL list is taken before anything in the
 * tree changes, using {@code data-src} where {@code src} is only a lazy-load
 * placeholder</li>
 * <li><b>deduplicate</b>: repeated images (the forum renders a lazy copy
 * and a {@code <noscript>} copy) are removed, the surviving element gets
 * its real URL in {@code src}</li>
 * <li><b>proxy</b>: attachment images are pointed at the catalog's image
 * proxy since the attachment host refuses hotlinking</li>
 * </ol>
 *
 * The content element is modified in place.
 */
public class ContentImageNormalizer {

    private static final String THUMB_SEGMENT = "/thumb/";

    private final String attachmentHost;
    private final String proxyEndpoint;

    public ContentImageNormalizer(String attachmentHost, String proxyEndpoint) {
        this.attachmentHost = attachmentHost;
        this.proxyEndpoint = proxyEndpoint;
    }

    /**
     * Result of {@link #normalize}: the distinct gallery URLs and the
     * featured image, which is {@code null} when there are none.
     */
    public record NormalizedImages(List<String> images, String featuredImage) {

        public NormalizedImages {
            images = List.copyOf(images);
        }
    }

    /**
     * Runs the whole pipeline on {@code content}.
     */
    public NormalizedImages normalize(Element content) {
        List<String> images = collectImages(content);
        deduplicate(content);
        rewriteToProxy(content);
        return new NormalizedImages(images, images.isEmpty() ? null : images.get(0));
    }

    /**
     * Full-resolution URLs of all {@code img.bbImage} elements, in document
     * order and without repeats.
     */
    public List<String> collectImages(Element content) {
        Set<String> urls = new LinkedHashSet<>();
        for (Element img : content.select("img.bbImage")) {
            String src = img.attr("src");
            if (src.isEmpty() || isPlaceholder(src)) {
                src = img.attr("data-src");
            }
            if (src.startsWith("http://") || src.startsWith("https://")) {
                urls.add(fullResolution(src));
            }
        }
        return new ArrayList<>(urls);
    }

    /**
     * Keeps the first {@code img} per effective source and removes the rest.
     * A kept lazy image has its {@code data-src} promoted to {@code src}.
     * Running it twice changes nothing the second time.
     */
    public void deduplicate(Element content) {
        Set<String> seen = new HashSet<>();
        for (Element img : content.select("img")) {
            String effective = img.hasAttr("data-src") ? img.attr("data-src") : img.attr("src");
            if (effective.isEmpty()) {
                continue;
            }
            if (!seen.add(effective)) {
                img.remove();
                continue;
            }
            if (img.hasAttr("data-src")) {
                img.attr("src", img.attr("data-src"));
                img.removeClass("lazyload");
                img.removeAttr("data-src");
            }
        }
    }

    /**
     * Points every attachment-hosted image at the image proxy. Sources that
     * already go through the proxy are left alone.
     */
    public void rewriteToProxy(Element content) {
        for (Element img : content.select("img")) {
            String src = img.attr("src");
            if (src.startsWith(proxyEndpoint) || !src.contains(attachmentHost)) {
                continue;
            }
            String encoded = URLEncoder.encode(fullResolution(src), StandardCharsets.UTF_8);
            img.attr("src", proxyEndpoint + "?url=" + encoded);
        }
    }

    private static boolean isPlaceholder(String src) {
        return src.startsWith("data:image") || src.contains("svg+xml");
    }

    private static String fullResolution(String url) {
        return url.replace(THUMB_SEGMENT, "/");
    }
}
