package de.bsommerfeld.catalogcrawler.forum;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Text and navigation helpers over jsoup trees.
 *
 * <p>
 * jsoup's {@link Element#text()} collapses all whitespace into single
 * spaces, which destroys the line structure the metadata patterns rely on
 * ({@code Release Date: ...} is one line of a post). {@link #plainText}
 * keeps it instead.
 */
public final class HtmlText {

    private HtmlText() {
    }

    /**
     * Renders an element as plain text with line structure preserved.
     *
     * <ul>
     * <li>source text is kept verbatim, including its newlines</li>
     * <li>{@code <br>} becomes a newline, unless the source already breaks
     * the line right after it</li>
     * <li>block elements start and end on their own line</li>
     * </ul>
     * Non-breaking spaces are turned into regular spaces.
     */
    public static String plainText(Element root) {
        StringBuilder sb = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode text) {
                    sb.append(text.getWholeText());
                } else if (node instanceof Element element) {
                    if ("br".equals(element.normalName())) {
                        if (!followedBySourceNewline(element)) {
                            sb.append('\n');
                        }
                    } else if (element != root && element.isBlock()) {
                        ensureLineBreak(sb);
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node != root && node instanceof Element element && element.isBlock()) {
                    ensureLineBreak(sb);
                }
            }
        }, root);
        return sb.toString().replace('\u00A0', ' ').replace("\r", "");
    }

    /**
     * Finds the first element after {@code start} in document order that
     * matches {@code predicate}. Descendants of {@code start} count as
     * "after". The search is limited to {@code root}'s subtree.
     */
    public static Optional<Element> findNext(Element root, Element start, Predicate<Element> predicate) {
        Elements all = root.getAllElements();
        boolean passedStart = false;
        for (Element element : all) {
            if (passedStart && predicate.test(element)) {
                return Optional.of(element);
            }
            if (element == start) {
                passedStart = true;
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first {@code <b>} whose text contains {@code label},
     * ignoring case. Post authors write labels as {@code <b>Genre:</b>} or
     * {@code <b>Genre</b>:}, only the first form is matched when the colon
     * is part of {@code label}.
     */
    public static Optional<Element> findBoldLabel(Element root, String label) {
        String needle = label.toLowerCase(Locale.ROOT);
        for (Element bold : root.select("b")) {
            if (bold.text().toLowerCase(Locale.ROOT).contains(needle)) {
                return Optional.of(bold);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first text node in document order whose text matches.
     */
    public static Optional<TextNode> findTextNode(Element root, Predicate<String> predicate) {
        TextNode[] found = new TextNode[1];
        NodeTraversor.traverse((node, depth) -> {
            if (found[0] == null && node instanceof TextNode text && predicate.test(text.getWholeText())) {
                found[0] = text;
            }
        }, root);
        return Optional.ofNullable(found[0]);
    }

    private static boolean followedBySourceNewline(Element br) {
        Node next = br.nextSibling();
        return next instanceof TextNode text && text.getWholeText().startsWith("\n");
    }

    private static void ensureLineBreak(StringBuilder sb) {
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
    }
}
