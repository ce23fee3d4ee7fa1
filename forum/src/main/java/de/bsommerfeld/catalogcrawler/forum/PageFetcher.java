package de.bsommerfeld.catalogcrawler.forum;

import com.google.inject.Singleton;
import de.bsommerfeld.catalogcrawler.core.config.CookieConfig;
import de.bsommerfeld.catalogcrawler.core.config.ForumConfig;
import de.bsommerfeld.catalogcrawler.core.util.Sleeper;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Collectors;

/**
 * Fetches forum pages over HTTP with bounded exponential-backoff retry.
 *
 * <h3>Retry policy</h3>
 * Transport failures and non-2xx responses are retried up to
 * {@code forum.max-attempts} attempts in total. Between attempts the caller's
 * thread sleeps {@code backoff-base-millis * 2^attempt} (1 s, 2 s, ... with
 * the default base). When every attempt failed a {@link FetchException}
 * carrying the last cause is thrown; the crawl treats that page as
 * unavailable and continues.
 *
 * <h3>Session</h3>
 * Every request carries the configured browser User-Agent and, if cookies
 * are configured, a {@code Cookie} header. Logged-in sessions see unmasked
 * download links.
 *
 * <p>
 * Instances hold no mutable state and may be shared between workers.
 */
@Singleton
public class PageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PageFetcher.class);

    private final ForumConfig config;
    private final HttpClient httpClient;
    private final Sleeper sleeper;
    private final String cookieHeader;

    @Inject
    public PageFetcher(ForumConfig config) {
        this(config, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .build(), Sleeper.THREAD);
    }

    PageFetcher(ForumConfig config, HttpClient httpClient, Sleeper sleeper) {
        this.config = config;
        this.httpClient = httpClient;
        this.sleeper = sleeper;
        this.cookieHeader = buildCookieHeader(config);
    }

    /**
     * Downloads the body of {@code url} as a string.
     *
     * @throws FetchException if every attempt failed, the URL is malformed
     *                        or the thread was interrupted while waiting
     */
    public String fetch(String url) throws FetchException {
        HttpRequest request;
        try {
            request = buildRequest(url);
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, "Malformed URL", e);
        }

        int maxAttempts = config.getMaxAttempts();
        Exception lastCause = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    return response.body();
                }
                lastCause = new IOException("HTTP " + status + " for " + url);
            } catch (IOException e) {
                lastCause = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(url, "Fetch interrupted", e);
            }

            LOG.warn("Attempt {} failed for {}: {}", attempt + 1, url, lastCause.getMessage());
            if (attempt < maxAttempts - 1) {
                backoff(url, attempt);
            }
        }

        LOG.error("Failed to fetch {} after {} attempts", url, maxAttempts);
        throw new FetchException(url, lastCause);
    }

    private void backoff(String url, int attempt) throws FetchException {
        long delay = config.getBackoffBaseMillis() * (1L << attempt);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "Fetch interrupted", e);
        }
    }

    private HttpRequest buildRequest(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("User-Agent", config.getUserAgent())
                .GET();
        if (!cookieHeader.isEmpty()) {
            builder.header("Cookie", cookieHeader);
        }
        return builder.build();
    }

    /**
     * Joins the configured cookies into a single header value. Cookies
     * without a name are dropped.
     */
    static String buildCookieHeader(ForumConfig config) {
        if (config.getCookies() == null) {
            return "";
        }
        return config.getCookies().stream()
                .filter(c -> c.getName() != null && !c.getName().isBlank())
                .map(PageFetcher::formatCookie)
                .collect(Collectors.joining("; "));
    }

    private static String formatCookie(CookieConfig cookie) {
        return cookie.getName() + "=" + (cookie.getValue() != null ? cookie.getValue() : "");
    }
}
