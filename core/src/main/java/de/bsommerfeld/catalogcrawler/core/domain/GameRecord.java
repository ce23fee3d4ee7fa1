package de.bsommerfeld.catalogcrawler.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalized catalog entry built from a thread page. This is exactly what
 * gets posted to the catalog, serialized with snake_case keys.
 *
 * <p>
 * All listing fields of the originating {@link ThreadSummary} are carried
 * over; {@code title} is replaced by the normalized game title with prefix
 * labels, version and developer brackets removed.
 *
 * <p>
 * Optional text fields ({@code overview}, {@code changelog},
 * metadata lines, ...) are {@code null} when the thread does not contain
 * them and are left out of the JSON. Instances are immutable; use
 * {@link #builder(ThreadSummary)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"thread_id", "thread_url", "title", "version", "developer"})
public final class GameRecord {

    private final String threadId;
    private final String threadUrl;
    private final String title;
    private final String author;
    private final String authorUrl;
    private final int replies;
    private final int views;
    private final double rating;
    private final int ratingCount;
    private final List<String> prefixes;

    private final String version;
    private final String developer;
    private final String developerUrl;
    private final List<String> categories;
    private final List<String> tags;
    private final String content;
    private final String overview;
    private final String changelog;
    private final String installation;

    private final String releaseDate;
    private final String threadUpdated;
    private final String censored;
    private final String osPlatforms;
    private final String language;
    private final String genre;

    private final List<DownloadLink> downloadLinks;
    private final List<String> images;
    private final String featuredImage;

    private GameRecord(Builder b) {
        this.threadId = b.summary.threadId();
        this.threadUrl = b.summary.threadUrl();
        this.title = b.title != null ? b.title : b.summary.title();
        this.author = b.summary.author();
        this.authorUrl = b.summary.authorUrl();
        this.replies = b.summary.replies();
        this.views = b.summary.views();
        this.rating = b.summary.rating();
        this.ratingCount = b.summary.ratingCount();
        this.prefixes = b.summary.prefixes();

        this.version = b.version;
        this.developer = b.developer;
        this.developerUrl = b.developerUrl;
        this.categories = List.copyOf(b.categories);
        this.tags = List.copyOf(b.tags);
        this.content = b.content;
        this.overview = b.overview;
        this.changelog = b.changelog;
        this.installation = b.installation;

        this.releaseDate = b.releaseDate;
        this.threadUpdated = b.threadUpdated;
        this.censored = b.censored;
        this.osPlatforms = b.osPlatforms;
        this.language = b.language;
        this.genre = b.genre;

        this.downloadLinks = List.copyOf(b.downloadLinks);
        this.images = List.copyOf(b.images);
        this.featuredImage = b.featuredImage;
    }

    public static Builder builder(ThreadSummary summary) {
        return new Builder(summary);
    }

    @JsonProperty("thread_id")
    public String threadId() {
        return threadId;
    }

    @JsonProperty("thread_url")
    public String threadUrl() {
        return threadUrl;
    }

    @JsonProperty("title")
    public String title() {
        return title;
    }

    @JsonProperty("author")
    public String author() {
        return author;
    }

    @JsonProperty("author_url")
    public String authorUrl() {
        return authorUrl;
    }

    @JsonProperty("replies")
    public int replies() {
        return replies;
    }

    @JsonProperty("views")
    public int views() {
        return views;
    }

    @JsonProperty("rating")
    public double rating() {
        return rating;
    }

    @JsonProperty("rating_count")
    public int ratingCount() {
        return ratingCount;
    }

    @JsonProperty("prefixes")
    public List<String> prefixes() {
        return prefixes;
    }

    @JsonProperty("version")
    public String version() {
        return version;
    }

    @JsonProperty("developer")
    public String developer() {
        return developer;
    }

    @JsonProperty("developer_url")
    public String developerUrl() {
        return developerUrl;
    }

    @JsonProperty("categories")
    public List<String> categories() {
        return categories;
    }

    @JsonProperty("tags")
    public List<String> tags() {
        return tags;
    }

    @JsonProperty("content")
    public String content() {
        return content;
    }

    @JsonProperty("overview")
    public String overview() {
        return overview;
    }

    @JsonProperty("changelog")
    public String changelog() {
        return changelog;
    }

    @JsonProperty("installation")
    public String installation() {
        return installation;
    }

    @JsonProperty("release_date")
    public String releaseDate() {
        return releaseDate;
    }

    @JsonProperty("thread_updated")
    public String threadUpdated() {
        return threadUpdated;
    }

    @JsonProperty("censored")
    public String censored() {
        return censored;
    }

    @JsonProperty("os_platforms")
    public String osPlatforms() {
        return osPlatforms;
    }

    @JsonProperty("language")
    public String language() {
        return language;
    }

    @JsonProperty("genre")
    public String genre() {
        return genre;
    }

    @JsonProperty("download_links")
    public List<DownloadLink> downloadLinks() {
        return downloadLinks;
    }

    @JsonProperty("images")
    public List<String> images() {
        return images;
    }

    @JsonProperty("featured_image")
    public String featuredImage() {
        return featuredImage;
    }

    /**
     * Tells the catalog to reference images by URL instead of importing
     * them. Only set when there is a featured image to show.
     */
    @JsonProperty("use_external_images")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean useExternalImages() {
        return featuredImage != null;
    }

    @Override
    public String toString() {
        return "GameRecord[" + threadId + ", " + title + ", " + version + "]";
    }

    /**
     * Mutable accumulator used by the thread parser. Every setter is
     * optional; unset text fields stay {@code null}, unset lists stay empty.
     */
    public static final class Builder {

        private final ThreadSummary summary;

        private String title;
        private String version = "";
        private String developer = "";
        private String developerUrl;
        private final List<String> categories = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private String content;
        private String overview;
        private String changelog;
        private String installation;

        private String releaseDate;
        private String threadUpdated;
        private String censored;
        private String osPlatforms;
        private String language;
        private String genre;

        private final List<DownloadLink> downloadLinks = new ArrayList<>();
        private final List<String> images = new ArrayList<>();
        private String featuredImage;

        private Builder(ThreadSummary summary) {
            this.summary = summary;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder developer(String developer) {
            this.developer = developer;
            return this;
        }

        public Builder developerUrl(String developerUrl) {
            this.developerUrl = developerUrl;
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories.addAll(categories);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags.addAll(tags);
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder overview(String overview) {
            this.overview = overview;
            return this;
        }

        public Builder changelog(String changelog) {
            this.changelog = changelog;
            return this;
        }

        public Builder installation(String installation) {
            this.installation = installation;
            return this;
        }

        /**
         * Sets one of the free-text metadata fields by its wire name.
         *
         * @throws IllegalArgumentException for names that are not metadata
         *                                  fields
         */
        public Builder metadata(String field, String value) {
            switch (field) {
                case "release_date" -> releaseDate = value;
                case "thread_updated" -> threadUpdated = value;
                case "censored" -> censored = value;
                case "os_platforms" -> osPlatforms = value;
                case "language" -> language = value;
                case "genre" -> genre = value;
                default -> throw new IllegalArgumentException("Unknown metadata field: " + field);
            }
            return this;
        }

        public Builder downloadLinks(List<DownloadLink> downloadLinks) {
            this.downloadLinks.addAll(downloadLinks);
            return this;
        }

        public Builder images(List<String> images) {
            this.images.addAll(images);
            return this;
        }

        public Builder featuredImage(String featuredImage) {
            this.featuredImage = featuredImage;
            return this;
        }

        public GameRecord build() {
            return new GameRecord(this);
        }
    }
}
