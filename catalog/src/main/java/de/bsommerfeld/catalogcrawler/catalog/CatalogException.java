package de.bsommerfeld.catalogcrawler.catalog;

/**
 * A catalog request that did not succeed. Carries the HTTP status and the
 * response body when the server answered at all; {@code -1} and
 * {@code null} for transport failures.
 */
public class CatalogException extends Exception {

    private final int statusCode;
    private final String responseBody;

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    public CatalogException(String message, int statusCode, String responseBody) {
        super(message + " (HTTP " + statusCode + ")");
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
