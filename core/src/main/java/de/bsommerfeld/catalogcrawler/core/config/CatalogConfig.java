package de.bsommerfeld.catalogcrawler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Remote catalog endpoint and credentials.
 *
 * <p>
 * {@code api-url} is the base all catalog routes hang off
 * ({@code existing-threads}, {@code create-post}, {@code create-batch},
 * {@code image-proxy}). Older configs pointed it at the {@code create-post}
 * route itself; that suffix is stripped so both forms work.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogConfig {

    private static final String LEGACY_SUFFIX = "/create-post";

    @JsonProperty("api-url")
    private String apiUrl;

    @JsonProperty("api-key")
    private String apiKey;

    @JsonProperty("existing-page-size")
    private int existingPageSize = 2000;

    @JsonProperty("timeout-seconds")
    private long timeoutSeconds = 30;

    @JsonProperty("batch-timeout-seconds")
    private long batchTimeoutSeconds = 60;

    /** Returns the normalized base URL without trailing slash or legacy route. */
    public String getApiUrl() {
        if (apiUrl == null) {
            return null;
        }
        String url = apiUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        if (url.endsWith(LEGACY_SUFFIX)) {
            url = url.substring(0, url.length() - LEGACY_SUFFIX.length());
        }
        return url;
    }

    public void setApiUrl(String apiUrl) {
        this.apiUrl = apiUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public int getExistingPageSize() {
        return existingPageSize;
    }

    public void setExistingPageSize(int existingPageSize) {
        this.existingPageSize = existingPageSize;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public long getBatchTimeoutSeconds() {
        return batchTimeoutSeconds;
    }

    /** Endpoint that serves forum attachments through the catalog's own host. */
    public String getImageProxyEndpoint() {
        return getApiUrl() + "/image-proxy";
    }
}
