package io.qdbcompat.testutil;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Minimal HTTP server answering every request with scripted responses, in order. The last
 * response is repeated once the script runs out.
 */
public final class StubHttpServer implements AutoCloseable {

    private final HttpServer server;
    private final Deque<Response> script = new ArrayDeque<>();
    private final List<HttpExchangeRecord> requests = new CopyOnWriteArrayList<>();

    private StubHttpServer(HttpServer server) {
        this.server = server;
    }

    /**
     * Starts a server on a free loopback port.
     */
    public static StubHttpServer start() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        StubHttpServer stub = new StubHttpServer(server);
        server.createContext("/", stub::handle);
        server.start();
        return stub;
    }

    public URI getBaseUri() {
        return URI.create("http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort());
    }

    /**
     * Queues a 200 response with the given body.
     */
    public StubHttpServer respond(String body) {
        return respond(200, body);
    }

    public synchronized StubHttpServer respond(int status, String body) {
        script.addLast(new Response(status, body));
        return this;
    }

    public List<HttpExchangeRecord> getRequests() {
        return requests;
    }

    private void handle(HttpExchange exchange) throws IOException {
        Map<String, String> headers = exchange.getRequestHeaders().entrySet().stream()
                .collect(Collectors.toMap(
                        e -> e.getKey().toLowerCase(Locale.ROOT),
                        e -> e.getValue().get(0),
                        (a, b) -> a));
        requests.add(new HttpExchangeRecord(exchange.getRequestURI(), headers));
        Response response = next();
        byte[] body = response.body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status, body.length == 0 ? -1 : body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private synchronized Response next() {
        if (script.isEmpty()) {
            return new Response(404, "");
        }
        return script.size() > 1 ? script.pollFirst() : script.peekFirst();
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private static final class Response {
        private final int status;
        private final String body;

        private Response(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }

    /**
     * A received request: its URI and headers, header names lower-cased.
     */
    public static final class HttpExchangeRecord {

        private final URI uri;
        private final Map<String, String> headers;

        HttpExchangeRecord(URI uri, Map<String, String> headers) {
            this.uri = uri;
            this.headers = headers;
        }

        public URI getUri() {
            return uri;
        }

        public String getHeader(String name) {
            return headers.get(name.toLowerCase(Locale.ROOT));
        }
    }
}
