package de.bsommerfeld.catalogcrawler.crawler;

/**
 * Parsed command line. Numeric options are {@code null} when not given, so
 * the configured value applies.
 */
public record CommandLineArgs(
        String configPath,
        Integer pages,
        Integer startPage,
        Integer maxThreads,
        Integer batchSize,
        boolean infinite,
        boolean help) {

    static final String USAGE = """
            Usage: catalog-crawler [options]
              --config PATH      configuration file (default: ./config.json, then app data dir)
              --pages N          number of listing pages to crawl
              --start-page N     first listing page (default 1)
              --max-threads N    process at most N listed threads (0 = all)
              --batch-size N     records per catalog request
              --infinite         keep paging until the listing runs dry or the process is stopped
              --help             show this help
            """;

    /**
     * Parses {@code args}.
     *
     * @throws IllegalArgumentException on unknown options, missing values or
     *                                  out-of-range numbers
     */
    public static CommandLineArgs parse(String[] args) {
        String configPath = null;
        Integer pages = null;
        Integer startPage = null;
        Integer maxThreads = null;
        Integer batchSize = null;
        boolean infinite = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> configPath = value(args, ++i, arg);
                case "--pages" -> pages = positive(value(args, ++i, arg), arg);
                case "--start-page" -> startPage = positive(value(args, ++i, arg), arg);
                case "--max-threads" -> maxThreads = nonNegative(value(args, ++i, arg), arg);
                case "--batch-size" -> batchSize = positive(value(args, ++i, arg), arg);
                case "--infinite" -> infinite = true;
                case "--help", "-h" -> help = true;
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return new CommandLineArgs(configPath, pages, startPage, maxThreads, batchSize, infinite, help);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int positive(String raw, String option) {
        int value = number(raw, option);
        if (value < 1) {
            throw new IllegalArgumentException(option + " must be at least 1, was " + value);
        }
        return value;
    }

    private static int nonNegative(String raw, String option) {
        int value = number(raw, option);
        if (value < 0) {
            throw new IllegalArgumentException(option + " must not be negative, was " + value);
        }
        return value;
    }

    private static int number(String raw, String option) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects a number, got '" + raw + "'", e);
        }
    }
}
