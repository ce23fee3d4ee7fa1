package de.bsommerfeld.catalogcrawler.forum;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HtmlTextTest {

    private static Element body(String html) {
        return Jsoup.parse("<div id=\"root\">" + html + "</div>").getElementById("root");
    }

    @Test
    void plainText_shouldRenderBreaksAsNewlines() {
        assertEquals("a\nb", HtmlText.plainText(body("a<br>b")));
    }

    @Test
    void plainText_shouldNotDoubleSourceNewlineAfterBreak() {
        assertEquals("a\nb", HtmlText.plainText(body("a<br>\nb")));
    }

    @Test
    void plainText_shouldPutBlocksOnOwnLines() {
        assertEquals("intro\nblock\noutro", HtmlText.plainText(body("intro<div>block</div>outro")));
    }

    @Test
    void plainText_shouldKeepInlineElementsOnLine() {
        assertEquals("Release Date: 2024-01-01", HtmlText.plainText(body("<b>Release Date</b>: 2024-01-01")));
    }

    @Test
    void plainText_shouldReplaceNonBreakingSpaces() {
        assertEquals("a b", HtmlText.plainText(body("a&nbsp;b")));
    }

    @Test
    void findBoldLabel_shouldIgnoreCase() {
        Element root = body("<b>x</b><b>GENRE:</b>");

        assertEquals("GENRE:", HtmlText.findBoldLabel(root, "Genre:").orElseThrow().text());
    }

    @Test
    void findNext_shouldSearchAfterStartInDocumentOrder() {
        Element root = body("<a id=\"one\"></a><b id=\"start\"></b><p><a id=\"two\"></a></p>");
        Element start = root.getElementById("start");

        Element next = HtmlText.findNext(root, start, e -> e.normalName().equals("a")).orElseThrow();

        assertEquals("two", next.id());
    }

    @Test
    void findTextNode_shouldReturnFirstMatch() {
        Element root = body("<p>nothing</p><span>Download here</span><b>download</b>");

        assertEquals("Download here", HtmlText.findTextNode(root, t -> t.toLowerCase().contains("download"))
                .orElseThrow().text());
    }
}
