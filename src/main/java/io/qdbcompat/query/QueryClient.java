package io.qdbcompat.query;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Issues single queries against a QuestDB HTTP {@code /exec} endpoint.
 *
 * <p>Each call is one HTTP exchange. There is no caching and no retry; callers that need to wait
 * for data wrap queries in a {@link ConsistencyCheck}.
 */
public final class QueryClient {

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Duration requestTimeout;

    /**
     * Creates a client for the endpoint at {@code baseUri}, e.g. {@code http://localhost:9000}.
     *
     * @param baseUri scheme, host and port of the HTTP server
     * @param requestTimeout connect and response timeout per query
     */
    public QueryClient(URI baseUri, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(requestTimeout)
                        .build(),
                baseUri,
                requestTimeout);
    }

    QueryClient(HttpClient httpClient, URI baseUri, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    public URI getBaseUri() {
        return baseUri;
    }

    /**
     * Runs a query and parses the result.
     *
     * @param sql SQL text
     * @return parsed columns and dataset
     * @throws TransportException if the server could not be reached, or answered a status other
     *         than 200 without an error document
     * @throws MalformedResponseException if the body is not a query result
     * @throws QueryErrorException if the server reported an error for the query, whatever the status
     * @throws InterruptedException if interrupted while waiting for the response
     */
    public QueryResponse query(String sql) throws InterruptedException {
        Objects.requireNonNull(sql, "sql");
        HttpRequest request = HttpRequest.newBuilder()
                .uri(execUri(sql))
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransportException(sql, "Could not query " + baseUri + ": " + e, e);
        }

        if (response.statusCode() != 200) {
            throw errorResponse(sql, response);
        }
        return QueryResponse.parse(sql, response.body());
    }

    // QuestDB answers failed queries with 400 and an error document.
    private static QueryException errorResponse(String sql, HttpResponse<String> response) {
        TransportException transportError = new TransportException(sql, response.statusCode(), response.body());
        try {
            QueryResponse.parse(sql, response.body());
        } catch (QueryErrorException e) {
            return e;
        } catch (MalformedResponseException e) {
            transportError.addSuppressed(e);
        }
        return transportError;
    }

    private URI execUri(String sql) {
        String base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/exec?query=" + URLEncoder.encode(sql, StandardCharsets.UTF_8));
    }
}
