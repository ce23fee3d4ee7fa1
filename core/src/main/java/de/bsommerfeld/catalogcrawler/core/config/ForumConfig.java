package de.bsommerfeld.catalogcrawler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Source forum parameters: where the listings live, how requests identify
 * themselves and how hard the fetcher retries.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForumConfig {

    static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    @JsonProperty("base-url")
    private String baseUrl = "https://f95zone.to";

    @JsonProperty("category-url")
    private String categoryUrl = "https://f95zone.to/forums/games.2/";

    @JsonProperty("attachment-host")
    private String attachmentHost = "attachments.f95zone.to";

    @JsonProperty("user-agent")
    private String userAgent = DEFAULT_USER_AGENT;

    @JsonProperty("timeout-seconds")
    private long timeoutSeconds = 30;

    @JsonProperty("max-attempts")
    private int maxAttempts = 3;

    @JsonProperty("backoff-base-millis")
    private long backoffBaseMillis = 1000;

    /** Announcement and rules threads pinned to the category. */
    @JsonProperty("ignored-thread-ids")
    private List<String> ignoredThreadIds = new ArrayList<>(List.of("137266", "50885", "21333"));

    @JsonProperty("cookies")
    private List<CookieConfig> cookies = new ArrayList<>();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getCategoryUrl() {
        return categoryUrl;
    }

    public void setCategoryUrl(String categoryUrl) {
        this.categoryUrl = categoryUrl;
    }

    public String getAttachmentHost() {
        return attachmentHost;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBackoffBaseMillis() {
        return backoffBaseMillis;
    }

    public void setBackoffBaseMillis(long backoffBaseMillis) {
        this.backoffBaseMillis = backoffBaseMillis;
    }

    public List<String> getIgnoredThreadIds() {
        return ignoredThreadIds;
    }

    public List<CookieConfig> getCookies() {
        return cookies;
    }

    public void setCookies(List<CookieConfig> cookies) {
        this.cookies = cookies;
    }
}
