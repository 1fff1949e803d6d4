package io.qdbcompat.query;

import io.qdbcompat.testutil.StubHttpServer;
import io.qdbcompat.testutil.TestConstants;
import java.net.ServerSocket;
import java.net.URI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryClientTest {

    private StubHttpServer server;
    private QueryClient client;

    @BeforeEach
    void startServer() throws Exception {
        server = StubHttpServer.start();
        client = new QueryClient(server.getBaseUri(), TestConstants.REQUEST_TIMEOUT);
    }

    @AfterEach
    void stopServer() {
        server.close();
    }

    @Test
    void sendsEncodedQueryToExecEndpoint() throws Exception {
        server.respond(TestConstants.ONE_ROW);

        QueryResponse response = client.query("select * from 't'");

        Assertions.assertEquals(1, response.getRowCount());
        URI uri = server.getRequests().get(0).getUri();
        Assertions.assertEquals("/exec", uri.getPath());
        Assertions.assertEquals("query=select+*+from+'t'", uri.getQuery());
        Assertions.assertEquals("query=select+*+from+%27t%27", uri.getRawQuery());
    }

    @Test
    void non200StatusIsTransportError() {
        server.respond(500, "internal error");

        TransportException e = Assertions.assertThrows(TransportException.class, () -> client.query("select 1"));

        Assertions.assertEquals(500, e.getStatusCode());
        Assertions.assertTrue(e.getMessage().contains("internal error"), e.getMessage());
    }

    @Test
    void badRequestWithErrorDocumentIsQueryError() {
        server.respond(400, TestConstants.TABLE_MISSING);

        QueryErrorException e = Assertions.assertThrows(QueryErrorException.class,
                () -> client.query("select * from 't'"));

        Assertions.assertTrue(e.isTableMissing());
        Assertions.assertEquals("select * from 't'", e.getQuery());
    }

    @Test
    void refusedConnectionIsTransportError() throws Exception {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        QueryClient unreachable = new QueryClient(URI.create("http://127.0.0.1:" + freePort), TestConstants.REQUEST_TIMEOUT);

        TransportException e = Assertions.assertThrows(TransportException.class, () -> unreachable.query("select 1"));

        Assertions.assertEquals(-1, e.getStatusCode());
        Assertions.assertNotNull(e.getCause());
    }

    @Test
    void errorBodyIsQueryError() {
        server.respond(TestConstants.TABLE_MISSING);

        QueryErrorException e = Assertions.assertThrows(QueryErrorException.class,
                () -> client.query("select * from 't'"));

        Assertions.assertTrue(e.isTableMissing());
    }

    @Test
    void garbageBodyIsMalformed() {
        server.respond("not json at all {");

        MalformedResponseException e = Assertions.assertThrows(MalformedResponseException.class,
                () -> client.query("select 1"));

        Assertions.assertTrue(e.getMessage().contains("not json at all {"), e.getMessage());
    }
}
