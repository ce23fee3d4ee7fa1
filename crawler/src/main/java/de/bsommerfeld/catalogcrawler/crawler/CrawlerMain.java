package de.bsommerfeld.catalogcrawler.crawler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.catalogcrawler.core.config.ConfigException;
import de.bsommerfeld.catalogcrawler.core.config.ConfigLoader;
import de.bsommerfeld.catalogcrawler.core.config.CrawlerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point.
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@code 0}: the run completed, individual thread failures included</li>
 * <li>{@code 1}: the configuration could not be loaded</li>
 * <li>{@code 2}: invalid command-line options</li>
 * </ul>
 *
 * A JVM shutdown (Ctrl+C) asks the running crawl to stop and waits for the
 * batch in flight before the process exits.
 */
public final class CrawlerMain {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlerMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG = 1;
    static final int EXIT_USAGE = 2;

    private static final long SHUTDOWN_GRACE_MILLIS = 60_000;

    private CrawlerMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CommandLineArgs cli;
        try {
            cli = CommandLineArgs.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.print(CommandLineArgs.USAGE);
            return EXIT_USAGE;
        }
        if (cli.help()) {
            System.out.print(CommandLineArgs.USAGE);
            return EXIT_OK;
        }

        ObjectMapper mapper = new ObjectMapper();
        CrawlerConfig config;
        try {
            Path configPath = ConfigLoader.resolveConfigPath(cli.configPath());
            config = new ConfigLoader(mapper).load(configPath);
        } catch (ConfigException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG;
        }

        CrawlOptions options = CrawlOptions.from(config.getCrawl(), cli);
        LOG.info("Starting crawl: pages {}{}, batch size {}, {} detail worker(s)", options.startPage(),
                options.infinite() ? "+ (until exhausted)" : "-" + (options.startPage() + options.pages() - 1),
                options.batchSize(), options.detailWorkers());

        Injector injector = Guice.createInjector(new CrawlerModule(config, mapper));
        CrawlOrchestrator orchestrator = injector.getInstance(CrawlOrchestrator.class);

        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            orchestrator.requestStop();
            try {
                finished.await(SHUTDOWN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "crawl-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            orchestrator.run(options);
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
        return EXIT_OK;
    }

    /**
     * The hook must go before {@code System.exit}, which would otherwise
     * run it and wait for the exiting thread.
     */
    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM already shutting down, hook stays registered");
        }
    }
}
