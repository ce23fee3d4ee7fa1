package de.bsommerfeld.catalogcrawler.crawler;

import de.bsommerfeld.catalogcrawler.core.config.CrawlConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CrawlOptionsTest {

    @Test
    void from_shouldTakeConfiguredValuesWithoutOptions() {
        CrawlConfig config = new CrawlConfig();
        config.setBatchSize(25);
        config.setDetailWorkers(4);
        config.setDelayBetweenRequestsSeconds(1.5);

        CrawlOptions options = CrawlOptions.from(config, CommandLineArgs.parse(new String[0]));

        assertEquals(1, options.startPage());
        assertEquals(1, options.pages());
        assertFalse(options.infinite());
        assertEquals(0, options.maxThreads());
        assertEquals(25, options.batchSize());
        assertEquals(1500, options.delayMillis());
        assertEquals(4, options.detailWorkers());
    }

    @Test
    void from_shouldPreferCommandLineValues() {
        CommandLineArgs args = CommandLineArgs.parse(new String[] {
                "--pages", "4", "--start-page", "3", "--max-threads", "50", "--batch-size", "5", "--infinite" });

        CrawlOptions options = CrawlOptions.from(new CrawlConfig(), args);

        assertEquals(3, options.startPage());
        assertEquals(4, options.pages());
        assertTrue(options.infinite());
        assertEquals(50, options.maxThreads());
        assertEquals(5, options.batchSize());
        assertEquals(2000, options.delayMillis());
    }

    @Test
    void from_shouldFallBackToConfigForMissingOptions() {
        CrawlConfig config = new CrawlConfig();
        config.setBatchSize(7);

        CrawlOptions options = CrawlOptions.from(config, CommandLineArgs.parse(new String[] { "--pages", "2" }));

        assertEquals(2, options.pages());
        assertEquals(7, options.batchSize());
        assertEquals(1, options.startPage());
    }

    @Test
    void constructor_shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new CrawlOptions(0, 1, false, 0, 10, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new CrawlOptions(1, 1, false, 0, 0, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new CrawlOptions(1, 1, false, 0, 10, 0, 0));
    }

    @Test
    void includesPage_shouldHonorPageCountUnlessInfinite() {
        CrawlOptions bounded = new CrawlOptions(1, 2, false, 0, 10, 0, 1);
        CrawlOptions infinite = new CrawlOptions(1, 2, true, 0, 10, 0, 1);

        assertTrue(bounded.includesPage(1));
        assertFalse(bounded.includesPage(2));
        assertTrue(infinite.includesPage(100));
    }
}
