package de.bsommerfeld.catalogcrawler.catalog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ThreadIdCacheTest {

    private ThreadIdCache cache;
    private ExistingThreadSource source;

    @BeforeEach
    void setUp() {
        cache = new ThreadIdCache();
        source = mock(ExistingThreadSource.class);
    }

    // -- load --

    @Test
    void load_shouldPageUntilShortPage() throws Exception {
        when(source.fetchPage(2, 0)).thenReturn(List.of("1", "2"));
        when(source.fetchPage(2, 2)).thenReturn(List.of("3", "4"));
        when(source.fetchPage(2, 4)).thenReturn(List.of("5"));

        assertEquals(5, cache.load(source, 2));

        assertEquals(5, cache.size());
        assertTrue(cache.contains("5"));
        verify(source, times(3)).fetchPage(anyInt(), anyInt());
    }

    @Test
    void load_shouldStopOnEmptyPage() throws Exception {
        when(source.fetchPage(2, 0)).thenReturn(List.of("1", "2"));
        when(source.fetchPage(2, 2)).thenReturn(List.of());

        assertEquals(2, cache.load(source, 2));
        verify(source, times(2)).fetchPage(anyInt(), anyInt());
    }

    @Test
    void load_shouldKeepPartialResultOnFailure() throws Exception {
        when(source.fetchPage(2, 0)).thenReturn(List.of("1", "2"));
        when(source.fetchPage(2, 2)).thenThrow(new CatalogException("down", 502, "Bad Gateway"));

        assertEquals(2, cache.load(source, 2));
        assertTrue(cache.contains("1"));
        assertTrue(cache.contains("2"));
    }

    @Test
    void load_shouldSurviveRuntimeFailure() throws Exception {
        when(source.fetchPage(anyInt(), anyInt())).thenThrow(new IllegalStateException("boom"));

        assertEquals(0, cache.load(source, 100));
        assertEquals(0, cache.size());
    }

    // -- insert / contains --

    @Test
    void insert_shouldIgnoreNull() {
        cache.insert(null);

        assertEquals(0, cache.size());
        assertFalse(cache.contains(null));
    }

    @Test
    void insert_shouldEndClaim() {
        assertTrue(cache.claim("7"));

        cache.insert("7");

        assertFalse(cache.isClaimed("7"));
        assertTrue(cache.contains("7"));
    }

    // -- claim / release --

    @Test
    void claim_shouldRefuseKnownIds() {
        cache.insert("1");

        assertFalse(cache.claim("1"));
    }

    @Test
    void claim_shouldRefuseSecondClaimUntilReleased() {
        assertTrue(cache.claim("9"));
        assertFalse(cache.claim("9"));

        cache.release("9");

        assertTrue(cache.claim("9"));
        assertFalse(cache.contains("9"));
    }

    @Test
    void claim_shouldGrantExactlyOneOfConcurrentClaims() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        try {
            Future<?>[] futures = new Future<?>[threads];
            for (int i = 0; i < threads; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    if (cache.claim("42")) {
                        granted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, granted.get());
    }
}
