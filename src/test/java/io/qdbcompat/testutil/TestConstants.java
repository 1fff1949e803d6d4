package io.qdbcompat.testutil;

import java.time.Duration;

/**
 * Test configuration constants.
 */
public final class TestConstants {

    private TestConstants() {
        // Utility class
    }

    // QuestDB Image
    public static final String PINNED_RELEASE = "7.4.2";
    public static final String IMAGE_REPOSITORY = "questdb/questdb";

    // Timeouts
    public static final Duration SHORT_TIMEOUT = Duration.ofMillis(300);
    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration POLL_INTERVAL = Duration.ofMillis(20);
    public static final Duration TIMING_SLACK = Duration.ofMillis(500);

    // Query Responses
    public static final String ONE_ROW =
            "{\"query\":\"select * from 't'\",\"columns\":[{\"name\":\"a\",\"type\":\"SYMBOL\"},"
                    + "{\"name\":\"timestamp\",\"type\":\"TIMESTAMP\"}],"
                    + "\"dataset\":[[\"A\",\"2022-03-15T15:21:28.714369Z\"]],\"count\":1}";
    public static final String EMPTY_TABLE =
            "{\"query\":\"select * from 't'\",\"columns\":[{\"name\":\"a\",\"type\":\"SYMBOL\"},"
                    + "{\"name\":\"timestamp\",\"type\":\"TIMESTAMP\"}],\"dataset\":[],\"count\":0}";
    public static final String TABLE_MISSING =
            "{\"query\":\"select * from 't'\",\"error\":\"table does not exist [table=t]\",\"position\":14}";
    public static final String SYNTAX_ERROR =
            "{\"query\":\"select * frm 't'\",\"error\":\"unexpected token: frm\",\"position\":9}";
}
