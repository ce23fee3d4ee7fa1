package de.bsommerfeld.catalogcrawler.forum;

import de.bsommerfeld.catalogcrawler.core.domain.DownloadLink;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DownloadLinkExtractorTest {

    private static Element wrapper(String inner) {
        return Jsoup.parse("<div class=\"bbWrapper\">" + inner + "</div>").selectFirst("div.bbWrapper");
    }

    @Test
    void extract_shouldReturnEmptyWithoutDownloadSection() {
        Element content = wrapper("<a href=\"https://mega.nz/file/x\">MEGA</a>");

        assertTrue(DownloadLinkExtractor.extract(content).isEmpty());
    }

    @Test
    void extract_shouldKeepKnownHostsOnly() {
        Element content = wrapper("<div><b>Download</b><br>"
                + "<a href=\"https://mega.nz/file/x\">MEGA</a> - "
                + "<a href=\"https://example.com/file\">MIRROR</a> - "
                + "<a href=\"https://DRIVE.GOOGLE.com/file/d/1\">GDRIVE</a></div>");

        List<DownloadLink> links = DownloadLinkExtractor.extract(content);

        assertEquals(2, links.size());
        assertEquals("MEGA", links.get(0).host());
        assertEquals("GDRIVE", links.get(1).host());
    }

    @Test
    void extract_shouldDropUiChromeAndShortTexts() {
        Element content = wrapper("<div><b>DOWNLOAD</b><br>"
                + "<a href=\"https://f95zone.to/masked/1\">Reactions</a>"
                + "<a href=\"https://f95zone.to/masked/2\">tags</a>"
                + "<a href=\"https://f95zone.to/masked/3\">1</a>"
                + "<a href=\"https://f95zone.to/masked/4\">Workupload</a></div>");

        List<DownloadLink> links = DownloadLinkExtractor.extract(content);

        assertEquals(List.of(new DownloadLink("", "WORKUPLOAD", "https://f95zone.to/masked/4")), links);
    }

    @Test
    void extract_shouldTakePlatformFromLabelOnSameLine() {
        Element content = wrapper("<div><b>DOWNLOAD</b><br>"
                + "<b>Win</b>: <a href=\"https://mega.nz/a\">MEGA</a> - <a href=\"https://gofile.io/a\">GOFILE</a><br>"
                + "<b>Android</b>: <a href=\"https://mega.nz/b\">MEGA</a><br>"
                + "<a href=\"https://mega.nz/c\">MEGA</a></div>");

        List<DownloadLink> links = DownloadLinkExtractor.extract(content);

        assertEquals(4, links.size());
        assertEquals("Win", links.get(0).platform());
        assertEquals("Win", links.get(1).platform());
        assertEquals("Android", links.get(2).platform());
        assertEquals("", links.get(3).platform());
    }

    @Test
    void extract_shouldUseParentTextAsPlatform() {
        Element content = wrapper("<div><span>DOWNLOAD</span>"
                + "<p>Linux: <a href=\"https://pixeldrain.com/u/1\">Pixeldrain</a></p></div>");

        List<DownloadLink> links = DownloadLinkExtractor.extract(content);

        assertEquals(List.of(new DownloadLink("Linux:", "PIXELDRAIN", "https://pixeldrain.com/u/1")), links);
    }

    @Test
    void extract_shouldLimitSearchToBlockAroundMarker() {
        Element content = wrapper("<div><a href=\"https://mega.nz/early\">EARLY</a></div>"
                + "<div><b>DOWNLOAD</b> <a href=\"https://mega.nz/late\">LATE</a></div>");

        List<DownloadLink> links = DownloadLinkExtractor.extract(content);

        assertEquals(1, links.size());
        assertEquals("https://mega.nz/late", links.get(0).url());
    }

    @Test
    void isHostingLink_shouldMatchCaseInsensitively() {
        assertTrue(DownloadLinkExtractor.isHostingLink("https://WWW.MEDIAFIRE.COM/file/x"));
        assertFalse(DownloadLinkExtractor.isHostingLink("https://f95zone.to/threads/x.1/"));
    }
}
