package de.bsommerfeld.catalogcrawler.forum;

/**
 * Thrown when a page stays unavailable after all retry attempts. Callers
 * treat the page or thread as unavailable and move on.
 */
public class FetchException extends Exception {

    private final String url;

    public FetchException(String url, Throwable lastCause) {
        super("Failed to fetch " + url, lastCause);
        this.url = url;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message + ": " + url, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
