package io.qdbcompat.config;

import io.qdbcompat.poll.FailurePolicy;
import io.qdbcompat.poll.RetryPoller;
import io.qdbcompat.run.MatrixPolicy;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable harness settings.
 *
 * <p>Values start from {@link Defaults} and can be overridden with system properties:
 * <ul>
 *   <li>{@code questdb.compat.awaitTimeoutMs} - how long a scenario waits for rows (default: 5000)</li>
 *   <li>{@code questdb.compat.pollIntervalMs} - pause between poll attempts (default: 50)</li>
 *   <li>{@code questdb.compat.queryTimeoutMs} - HTTP timeout of a single query (default: 1000)</li>
 *   <li>{@code questdb.compat.startupTimeoutMs} - how long an instance may take to start (default: 120000)</li>
 *   <li>{@code questdb.compat.image} - Docker repository of the QuestDB images (default: questdb/questdb)</li>
 *   <li>{@code questdb.compat.releasesApi} - GitHub API root (default: https://api.github.com)</li>
 *   <li>{@code questdb.compat.explicitVersionWindow} - releases searched for explicit versions (default: 30)</li>
 *   <li>{@code questdb.compat.failurePolicy} - {@code retry} or {@code fail_fast} (default: retry)</li>
 *   <li>{@code questdb.compat.matrixPolicy} - {@code abort_on_first_failure} or {@code continue}</li>
 * </ul>
 * The {@code GITHUB_TOKEN} environment variable, when set, authenticates catalog requests.
 */
public final class HarnessSettings {

    public static final String PREFIX = "questdb.compat.";

    private final Duration awaitTimeout;
    private final Duration pollInterval;
    private final Duration queryTimeout;
    private final Duration startupTimeout;
    private final Duration catalogTimeout;
    private final String imageRepository;
    private final URI releasesApi;
    private final String releasesRepository;
    private final String githubToken;
    private final int explicitVersionWindow;
    private final FailurePolicy failurePolicy;
    private final MatrixPolicy matrixPolicy;

    private HarnessSettings(Builder builder) {
        this.awaitTimeout = positive(builder.awaitTimeout, "awaitTimeout");
        this.pollInterval = positive(builder.pollInterval, "pollInterval");
        this.queryTimeout = positive(builder.queryTimeout, "queryTimeout");
        this.startupTimeout = positive(builder.startupTimeout, "startupTimeout");
        this.catalogTimeout = positive(builder.catalogTimeout, "catalogTimeout");
        this.imageRepository = Objects.requireNonNull(builder.imageRepository, "imageRepository");
        this.releasesApi = Objects.requireNonNull(builder.releasesApi, "releasesApi");
        this.releasesRepository = Objects.requireNonNull(builder.releasesRepository, "releasesRepository");
        this.githubToken = builder.githubToken;
        if (builder.explicitVersionWindow < 1) {
            throw new IllegalArgumentException("explicitVersionWindow must be at least 1");
        }
        this.explicitVersionWindow = builder.explicitVersionWindow;
        this.failurePolicy = Objects.requireNonNull(builder.failurePolicy, "failurePolicy");
        this.matrixPolicy = Objects.requireNonNull(builder.matrixPolicy, "matrixPolicy");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HarnessSettings defaults() {
        return builder().build();
    }

    /**
     * Loads settings from the JVM system properties and environment.
     */
    public static HarnessSettings fromSystemProperties() {
        return from(System.getProperties(), System.getenv());
    }

    /**
     * Loads settings from the given properties and environment.
     *
     * @throws IllegalArgumentException if a property holds an invalid value
     */
    public static HarnessSettings from(Properties properties, Map<String, String> environment) {
        Builder builder = builder();
        String value;
        if ((value = property(properties, "awaitTimeoutMs")) != null) {
            builder.awaitTimeout(millis("awaitTimeoutMs", value));
        }
        if ((value = property(properties, "pollIntervalMs")) != null) {
            builder.pollInterval(millis("pollIntervalMs", value));
        }
        if ((value = property(properties, "queryTimeoutMs")) != null) {
            builder.queryTimeout(millis("queryTimeoutMs", value));
        }
        if ((value = property(properties, "startupTimeoutMs")) != null) {
            builder.startupTimeout(millis("startupTimeoutMs", value));
        }
        if ((value = property(properties, "image")) != null) {
            builder.imageRepository(value);
        }
        if ((value = property(properties, "releasesApi")) != null) {
            try {
                builder.releasesApi(URI.create(value));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid " + PREFIX + "releasesApi: " + value, e);
            }
        }
        if ((value = property(properties, "explicitVersionWindow")) != null) {
            builder.explicitVersionWindow(intNumber("explicitVersionWindow", value));
        }
        if ((value = property(properties, "failurePolicy")) != null) {
            builder.failurePolicy(enumValue(FailurePolicy.class, "failurePolicy", value));
        }
        if ((value = property(properties, "matrixPolicy")) != null) {
            builder.matrixPolicy(enumValue(MatrixPolicy.class, "matrixPolicy", value));
        }
        builder.githubToken(environment.get("GITHUB_TOKEN"));
        return builder.build();
    }

    private static String property(Properties properties, String name) {
        String value = properties.getProperty(PREFIX + name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static long number(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + PREFIX + name + ": " + value, e);
        }
    }

    private static int intNumber(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + PREFIX + name + ": " + value, e);
        }
    }

    private static Duration millis(String name, String value) {
        long ms = number(name, value);
        if (ms <= 0) {
            throw new IllegalArgumentException("Invalid " + PREFIX + name + ": must be positive, got " + value);
        }
        return Duration.ofMillis(ms);
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String name, String value) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + PREFIX + name + ": " + value, e);
        }
    }

    private static Duration positive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    /**
     * Creates a poller using the configured interval and failure policy.
     */
    public RetryPoller newPoller() {
        return new RetryPoller(pollInterval, failurePolicy);
    }

    public Builder toBuilder() {
        return new Builder()
                .awaitTimeout(awaitTimeout)
                .pollInterval(pollInterval)
                .queryTimeout(queryTimeout)
                .startupTimeout(startupTimeout)
                .catalogTimeout(catalogTimeout)
                .imageRepository(imageRepository)
                .releasesApi(releasesApi)
                .releasesRepository(releasesRepository)
                .githubToken(githubToken)
                .explicitVersionWindow(explicitVersionWindow)
                .failurePolicy(failurePolicy)
                .matrixPolicy(matrixPolicy);
    }

    public Duration getAwaitTimeout() {
        return awaitTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public Duration getStartupTimeout() {
        return startupTimeout;
    }

    public Duration getCatalogTimeout() {
        return catalogTimeout;
    }

    public String getImageRepository() {
        return imageRepository;
    }

    public URI getReleasesApi() {
        return releasesApi;
    }

    public String getReleasesRepository() {
        return releasesRepository;
    }

    /**
     * Gets the GitHub API token, or {@code null} if none is configured.
     */
    public String getGithubToken() {
        return githubToken;
    }

    public int getExplicitVersionWindow() {
        return explicitVersionWindow;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public MatrixPolicy getMatrixPolicy() {
        return matrixPolicy;
    }

    /**
     * Builder for {@link HarnessSettings}, pre-filled with {@link Defaults}.
     */
    public static final class Builder {

        private Duration awaitTimeout = Defaults.AWAIT_TIMEOUT;
        private Duration pollInterval = Defaults.POLL_INTERVAL;
        private Duration queryTimeout = Defaults.QUERY_TIMEOUT;
        private Duration startupTimeout = Defaults.STARTUP_TIMEOUT;
        private Duration catalogTimeout = Defaults.CATALOG_TIMEOUT;
        private String imageRepository = Defaults.IMAGE_REPOSITORY;
        private URI releasesApi = Defaults.RELEASES_API;
        private String releasesRepository = Defaults.RELEASES_REPOSITORY;
        private String githubToken;
        private int explicitVersionWindow = Defaults.EXPLICIT_VERSION_WINDOW;
        private FailurePolicy failurePolicy = FailurePolicy.RETRY;
        private MatrixPolicy matrixPolicy = MatrixPolicy.ABORT_ON_FIRST_FAILURE;

        private Builder() {
        }

        public Builder awaitTimeout(Duration awaitTimeout) {
            this.awaitTimeout = awaitTimeout;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
            return this;
        }

        public Builder startupTimeout(Duration startupTimeout) {
            this.startupTimeout = startupTimeout;
            return this;
        }

        public Builder catalogTimeout(Duration catalogTimeout) {
            this.catalogTimeout = catalogTimeout;
            return this;
        }

        public Builder imageRepository(String imageRepository) {
            this.imageRepository = imageRepository;
            return this;
        }

        public Builder releasesApi(URI releasesApi) {
            this.releasesApi = releasesApi;
            return this;
        }

        public Builder releasesRepository(String releasesRepository) {
            this.releasesRepository = releasesRepository;
            return this;
        }

        public Builder githubToken(String githubToken) {
            this.githubToken = githubToken;
            return this;
        }

        public Builder explicitVersionWindow(int explicitVersionWindow) {
            this.explicitVersionWindow = explicitVersionWindow;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder matrixPolicy(MatrixPolicy matrixPolicy) {
            this.matrixPolicy = matrixPolicy;
            return this;
        }

        public HarnessSettings build() {
            return new HarnessSettings(this);
        }
    }
}
