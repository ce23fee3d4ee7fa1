package de.bsommerfeld.catalogcrawler.core.domain;

/**
 * A file-hoster link from the download section of a thread.
 *
 * @param platform platform hint found next to the link, empty if none
 * @param host     link text upper-cased (usually the hoster name)
 * @param url      link target
 */
public record DownloadLink(String platform, String host, String url) {
}
