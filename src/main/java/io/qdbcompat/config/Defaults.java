package io.qdbcompat.config;

import java.net.URI;
import java.time.Duration;

/**
 * Default harness configuration values.
 */
public final class Defaults {

    private Defaults() {
        // Utility class
    }

    // QuestDB Image
    public static final String IMAGE_REPOSITORY = "questdb/questdb";
    public static final int HTTP_PORT = 9000;
    public static final int ILP_PORT = 9009;

    // Release Catalog
    public static final URI RELEASES_API = URI.create("https://api.github.com");
    public static final String RELEASES_REPOSITORY = "questdb/questdb";
    public static final int RELEASES_PAGE_LIMIT = 100;
    public static final int LAST_N = 1;
    public static final int LIST_COUNT = 30;
    public static final int EXPLICIT_VERSION_WINDOW = 30;

    // Timeouts
    public static final Duration STARTUP_TIMEOUT = Duration.ofMinutes(2);
    public static final Duration AWAIT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration QUERY_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration CATALOG_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration POLL_INTERVAL = Duration.ofMillis(50);
}
