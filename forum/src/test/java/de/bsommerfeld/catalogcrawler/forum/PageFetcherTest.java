package de.bsommerfeld.catalogcrawler.forum;

import de.bsommerfeld.catalogcrawler.core.config.CookieConfig;
import de.bsommerfeld.catalogcrawler.core.config.ForumConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PageFetcherTest {

    private MockWebServer server;
    private ForumConfig config;
    private List<Long> sleeps;
    private PageFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        config = new ForumConfig();
        config.setMaxAttempts(3);
        config.setBackoffBaseMillis(100);
        config.setCookies(List.of(new CookieConfig("xf_user", "abc"), new CookieConfig("xf_session", "def")));

        sleeps = new ArrayList<>();
        fetcher = new PageFetcher(config, HttpClient.newHttpClient(), sleeps::add);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void fetch_shouldReturnBodyOnSuccess() throws Exception {
        server.enqueue(new MockResponse().setBody("<html>ok</html>"));

        assertEquals("<html>ok</html>", fetcher.fetch(server.url("/forums/games.2/").toString()));
        assertEquals(1, server.getRequestCount());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void fetch_shouldSendUserAgentAndCookies() throws Exception {
        server.enqueue(new MockResponse().setBody("ok"));

        fetcher.fetch(server.url("/threads/a.1/").toString());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("GET", request.getMethod());
        assertTrue(request.getHeader("User-Agent").startsWith("Mozilla/5.0"));
        assertEquals("xf_user=abc; xf_session=def", request.getHeader("Cookie"));
    }

    @Test
    void fetch_shouldRecoverAfterServerError() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setBody("recovered"));

        assertEquals("recovered", fetcher.fetch(server.url("/page").toString()));
        assertEquals(2, server.getRequestCount());
        assertEquals(List.of(100L), sleeps);
    }

    @Test
    void fetch_shouldThrowAfterMaxAttempts() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
        }
        String url = server.url("/page").toString();

        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(url));

        assertEquals(url, e.getUrl());
        assertNotNull(e.getCause());
        assertTrue(e.getCause().getMessage().contains("503"));
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void fetch_shouldBackOffExponentiallyWithoutSleepingAfterLastAttempt() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }

        assertThrows(FetchException.class, () -> fetcher.fetch(server.url("/page").toString()));

        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    void fetch_shouldRejectMalformedUrl() {
        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch("not a url"));
        assertTrue(e.getMessage().startsWith("Malformed URL"));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void fetch_shouldStopWhenInterruptedDuringBackoff() {
        server.enqueue(new MockResponse().setResponseCode(500));
        PageFetcher interrupted = new PageFetcher(config, HttpClient.newHttpClient(), millis -> {
            throw new InterruptedException("stop");
        });

        try {
            assertThrows(FetchException.class, () -> interrupted.fetch(server.url("/page").toString()));
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals(1, server.getRequestCount());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void buildCookieHeader_shouldBeEmptyWithoutCookies() {
        ForumConfig plain = new ForumConfig();
        assertEquals("", PageFetcher.buildCookieHeader(plain));
    }

    @Test
    void buildCookieHeader_shouldSkipNamelessCookies() {
        ForumConfig cfg = new ForumConfig();
        cfg.setCookies(List.of(new CookieConfig("", "x"), new CookieConfig("a", "1")));
        assertEquals("a=1", PageFetcher.buildCookieHeader(cfg));
    }
}
