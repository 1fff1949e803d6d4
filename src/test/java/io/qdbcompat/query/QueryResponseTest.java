package io.qdbcompat.query;

import io.qdbcompat.query.QueryResponse.Column;
import io.qdbcompat.testutil.TestConstants;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class QueryResponseTest {

    private static final String QUERY = "select * from 't'";

    @Test
    void parsesColumnsAndDataset() {
        QueryResponse response = QueryResponse.parse(QUERY, TestConstants.ONE_ROW);

        Assertions.assertEquals(
                List.of(Column.of("a", "SYMBOL"), Column.of("timestamp", "TIMESTAMP")),
                response.getColumns());
        Assertions.assertEquals(List.of(List.of("A", "2022-03-15T15:21:28.714369Z")), response.getDataset());
        Assertions.assertEquals(1, response.getRowCount());
        Assertions.assertEquals(QUERY, response.getQuery());
    }

    @Test
    void normalizesNumbers() {
        String body = "{\"columns\":[{\"name\":\"l\",\"type\":\"LONG\"},{\"name\":\"d\",\"type\":\"DOUBLE\"},"
                + "{\"name\":\"b\",\"type\":\"BOOLEAN\"}],\"dataset\":[[42,2.5,true],[9007199254740993,0.1,false]]}";

        QueryResponse response = QueryResponse.parse(QUERY, body);

        Assertions.assertEquals(List.of(42L, 2.5, true), response.getDataset().get(0));
        Assertions.assertEquals(List.of(9007199254740993L, 0.1, false), response.getDataset().get(1));
    }

    @Test
    void keepsNullValues() {
        String body = "{\"columns\":[{\"name\":\"a\",\"type\":\"STRING\"}],\"dataset\":[[null]]}";

        QueryResponse response = QueryResponse.parse(QUERY, body);

        Assertions.assertNull(response.getDataset().get(0).get(0));
    }

    @Test
    void dropsNamedColumnFromDataset() {
        QueryResponse response = QueryResponse.parse(QUERY, TestConstants.ONE_ROW);

        Assertions.assertEquals(List.of(List.of("A")), response.getDatasetWithout("timestamp"));
        Assertions.assertEquals(response.getDataset(), response.getDatasetWithout("missing"));
        Assertions.assertEquals(1, response.indexOf("timestamp"));
        Assertions.assertEquals(-1, response.indexOf("missing"));
    }

    @Test
    void errorFieldRaisesQueryError() {
        QueryErrorException e = Assertions.assertThrows(QueryErrorException.class,
                () -> QueryResponse.parse(QUERY, TestConstants.TABLE_MISSING));

        Assertions.assertEquals("table does not exist [table=t]", e.getError());
        Assertions.assertTrue(e.isTableMissing());
        Assertions.assertEquals(QUERY, e.getQuery());
    }

    @Test
    void otherErrorsAreNotMissingTables() {
        QueryErrorException e = Assertions.assertThrows(QueryErrorException.class,
                () -> QueryResponse.parse(QUERY, TestConstants.SYNTAX_ERROR));

        Assertions.assertFalse(e.isTableMissing());
    }

    @Test
    void invalidJsonIsMalformedAndQuotesPayload() {
        MalformedResponseException e = Assertions.assertThrows(MalformedResponseException.class,
                () -> QueryResponse.parse(QUERY, "<html>oops</html>"));

        Assertions.assertEquals("<html>oops</html>", e.getPayload());
        Assertions.assertTrue(e.getMessage().startsWith("Could not parse response: <html>oops</html>"), e.getMessage());
    }

    @Test
    void emptyBodyIsMalformed() {
        Assertions.assertThrows(MalformedResponseException.class, () -> QueryResponse.parse(QUERY, ""));
    }

    @Test
    void missingDatasetIsMalformed() {
        Assertions.assertThrows(MalformedResponseException.class,
                () -> QueryResponse.parse(QUERY, "{\"columns\":[{\"name\":\"a\",\"type\":\"SYMBOL\"}]}"));
        Assertions.assertThrows(MalformedResponseException.class,
                () -> QueryResponse.parse(QUERY, "[1,2,3]"));
    }

    @Test
    void columnThatIsNotAnObjectIsMalformed() {
        String body = "{\"columns\":[\"a\"],\"dataset\":[[1]]}";

        MalformedResponseException e = Assertions.assertThrows(MalformedResponseException.class,
                () -> QueryResponse.parse(QUERY, body));

        Assertions.assertEquals(body, e.getPayload());
        Assertions.assertTrue(e.getMessage().contains("column is not an object"), e.getMessage());
    }

    @Test
    void integersBeyondLongRangeAreKept() {
        String body = "{\"columns\":[{\"name\":\"n\",\"type\":\"LONG256\"}],"
                + "\"dataset\":[[18446744073709551616]]}";

        QueryResponse response = QueryResponse.parse(QUERY, body);

        Assertions.assertEquals(new BigInteger("18446744073709551616"), response.getDataset().get(0).get(0));
    }

    @Test
    void rowArityMustMatchColumns() {
        String body = "{\"columns\":[{\"name\":\"a\",\"type\":\"SYMBOL\"},{\"name\":\"b\",\"type\":\"LONG\"}],"
                + "\"dataset\":[[\"A\",1],[\"B\"]]}";

        MalformedResponseException e = Assertions.assertThrows(MalformedResponseException.class,
                () -> QueryResponse.parse(QUERY, body));

        Assertions.assertTrue(e.getMessage().contains("row has 1 values but there are 2 columns"), e.getMessage());
    }
}
