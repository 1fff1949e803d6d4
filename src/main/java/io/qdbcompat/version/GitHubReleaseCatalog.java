package io.qdbcompat.version;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import io.qdbcompat.config.Defaults;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads QuestDB releases from the GitHub REST API, newest first.
 *
 * <p>Drafts, pre-releases and tags that are not plain versions are skipped. Pages are fetched
 * until enough releases are collected or GitHub returns an empty page.
 */
public final class GitHubReleaseCatalog implements ReleaseCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(GitHubReleaseCatalog.class);

    static final int MAX_PAGE_SIZE = Defaults.RELEASES_PAGE_LIMIT;

    private final HttpClient httpClient;
    private final URI apiBase;
    private final String repository;
    private final String imageRepository;
    private final String token;
    private final Duration timeout;

    /**
     * Creates a catalog.
     *
     * @param apiBase GitHub API root, e.g. {@code https://api.github.com}
     * @param repository {@code owner/name} of the QuestDB repository
     * @param imageRepository Docker repository the release tags are published under
     * @param token optional API token, may be {@code null}
     * @param timeout per-request timeout
     */
    public GitHubReleaseCatalog(URI apiBase, String repository, String imageRepository, String token,
            Duration timeout) {
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
        this.apiBase = Objects.requireNonNull(apiBase, "apiBase");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.imageRepository = Objects.requireNonNull(imageRepository, "imageRepository");
        this.token = token;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public List<ReleaseArtifact> latest(int count) throws InterruptedException {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1: " + count);
        }
        int pageSize = Math.min(count, MAX_PAGE_SIZE);
        List<ReleaseArtifact> releases = new ArrayList<>(count);

        for (int page = 1; releases.size() < count; page++) {
            DocumentContext document = fetchPage(page, pageSize);
            List<Object> entries = document.read("$");
            if (entries.isEmpty()) {
                break;
            }
            List<String> tags = document.read("$[?(@.draft == false && @.prerelease == false)].tag_name");
            for (String tag : tags) {
                if (releases.size() == count) {
                    break;
                }
                try {
                    releases.add(ReleaseArtifact.forTag(imageRepository, tag));
                } catch (IllegalArgumentException e) {
                    LOG.debug("Skipping release tag {}: {}", tag, e.getMessage());
                }
            }
            if (entries.size() < pageSize) {
                break;
            }
        }

        LOG.info("Found {} releases of {} (requested {})", releases.size(), repository, count);
        return releases;
    }

    private DocumentContext fetchPage(int page, int pageSize) throws InterruptedException {
        URI uri = URI.create(stripSlash(apiBase.toString()) + "/repos/" + repository
                + "/releases?per_page=" + pageSize + "&page=" + page);
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/vnd.github+json")
                .GET();
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "Bearer " + token);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CatalogException("Could not list releases from " + uri, e);
        }
        if (response.statusCode() != 200) {
            throw new CatalogException(
                    "Failed to list releases. Status: " + response.statusCode() + ", Body: " + response.body());
        }

        try {
            DocumentContext document = JsonPath.parse(response.body());
            if (!(document.json() instanceof List)) {
                throw new CatalogException("Expected a JSON array of releases from " + uri + ": " + response.body());
            }
            return document;
        } catch (InvalidJsonException | IllegalArgumentException e) {
            throw new CatalogException("Could not parse releases from " + uri + ": " + response.body(), e);
        }
    }

    private static String stripSlash(String base) {
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
