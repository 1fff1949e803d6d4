package io.qdbcompat.suite;

import static io.qdbcompat.suite.ColumnTypes.BOOLEAN;
import static io.qdbcompat.suite.ColumnTypes.DOUBLE;
import static io.qdbcompat.suite.ColumnTypes.LONG;
import static io.qdbcompat.suite.ColumnTypes.SYMBOL;
import static io.qdbcompat.suite.ColumnTypes.TIMESTAMP;

import io.qdbcompat.poll.PollTimeoutException;
import io.qdbcompat.query.QueryResponse;
import io.qdbcompat.query.QueryResponse.Column;
import io.questdb.client.Sender;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;

/**
 * ILP ingestion scenarios.
 *
 * <p>Rows are written through the ILP sender and read back through the query endpoint. Unless a
 * scenario supplies its own timestamp, the server-assigned {@code timestamp} column is left out
 * of the dataset comparison.
 */
public final class IngestionScenarios {

    private IngestionScenarios() {
        // Utility class
    }

    static final String TIMESTAMP_COLUMN = "timestamp";

    static final ScenarioGate DUPLICATE_NAMES = ScenarioGate.above("6.1.2", "No support for duplicate column names.");
    static final ScenarioGate USER_TIMESTAMPS = ScenarioGate.above("6.0.7.1", "No support for user-provided timestamps.");
    static final ScenarioGate UNICODE = ScenarioGate.above("6.0.7.1", "No unicode support.");

    static final long EXPLICIT_TIMESTAMP_NANOS = 1647357688714369403L;
    static final int ROUND_TRIP_ROWS = 10;

    public static List<Scenario> all() {
        return List.of(
                Scenario.of("insert_three_rows", IngestionScenarios::insertThreeRows),
                Scenario.gated("repeated_symbol_and_column_names", DUPLICATE_NAMES,
                        IngestionScenarios::repeatedSymbolAndColumnNames),
                Scenario.gated("same_symbol_and_column_name", DUPLICATE_NAMES,
                        IngestionScenarios::sameSymbolAndColumnName),
                Scenario.of("single_symbol", IngestionScenarios::singleSymbol),
                Scenario.of("two_columns", IngestionScenarios::twoColumns),
                Scenario.of("mismatched_types_across_rows", IngestionScenarios::mismatchedTypesAcrossRows),
                Scenario.gated("explicit_timestamp", USER_TIMESTAMPS, IngestionScenarios::explicitTimestamp),
                Scenario.of("underscores", IngestionScenarios::underscores),
                Scenario.gated("funky_chars", UNICODE, IngestionScenarios::funkyChars),
                Scenario.of("many_rows_round_trip", IngestionScenarios::manyRowsRoundTrip));
    }

    static void insertThreeRows(ScenarioContext context) throws Exception {
        String table = context.uniqueTableName();
        try (Sender sender = context.newSender()) {
            for (int i = 0; i < 3; i++) {
                sender.table(table)
                        .symbol("name_a", "val_a")
                        .boolColumn("name_b", true)
                        .longColumn("name_c", 42)
                        .doubleColumn("name_d", 2.5)
                        .stringColumn("name_e", "val_b")
                        .atNow();
            }
        }

        QueryResponse response = context.getConsistencyCheck().awaitTable(table, 3, context.getAwaitTimeout());
        Assertions.assertEquals(
                List.of(
                        Column.of("name_a", SYMBOL),
                        Column.of("name_b", BOOLEAN),
                        Column.of("name_c", LONG),
                        Column.of("name_d", DOUBLE),
                        Column.of("name_e", ColumnTypes.stringType(context.getVersion())),
                        Column.of(TIMESTAMP_COLUMN, TIMESTAMP)),
                response.getColumns());

        List<Object> row = List.of("val_a", true, 42L, 2.5, "val_b");
        Assertions.assertEquals(List.of(row, row, row), response.getDatasetWithout(TIMESTAMP_COLUMN));
    }

    static void repeatedSymbolAndColumnNames(ScenarioContext context) throws Exception {
        String table = context.uniqueTableName();
        try (Sender sender = context.newSender()) {
            sender.table(table)
                    .symbol("a", "A")
                    .symbol("a", "B")
                    .boolColumn("b", false)
                    .stringColumn("b", "C")
                    .atNow();
        }

        QueryResponse response = context.awaitTable(table);
        Assertions.assertEquals(
                List.of(Column.of("a", SYMBOL), Column.of("b", BOOLEAN), Column.of(TIMESTAMP_COLUMN, TIMESTAMP)),
                response.getColumns());
        Assertions.assertEquals(List.of(List.of("A", false)), response.getDatasetWithout(TIMESTAMP_COLUMN));
    }

    static void sameSymbolAndColumnName(ScenarioContext context) throws Exception {
        String table = context.uniqueTableName();
        try (Sender sender = context.newSender()) {
            sender.table(table)
                    .symbol("a", "A")
                    .stringColumn("a", "B")
                    .atNow();
        }

        QueryResponse response = context.awaitTable(table);
        Assertions.assertEquals(
                List.of(Column.of("a", SYMBOL), Column.of(TIMESTAMP_COLUMN, TIMESTAMP)),
                response.getColumns());
        Assertions.assertEquals(List.of(List.of("A")), response.getDatasetWithout(TIMESTAMP_COLUMN));
    }

    static void singleSymbol(ScenarioContext context) throws Exception {
        String table = context.uniqueTableName();
        try (Sender sender = context.newSender()) {
            sender.table(table)
                    .symbol("a", "A")
                    .atNow();
        }

        QueryResponse response = context.awaitTable(table);
        Assertions.assertEquals(
                List.of(Column.of("a", SYMBOL), Column.of(TIMESTAMP_COLUMN, TIMESTAMP)),
                response.getColumns());
        Assertions.assertEquals(List.of(List.of("A")), response.getDatasetWithout(TIMESTAMP_COLUMN));
    }

    static void twoColumns(ScenarioContext context) throws Exception {
        String table = context.uniqueTableName();
        try (Sender sender = context.newSender()) {
            sender.table(table)
                    .stringColumn("a", "A")
                    .stringColumn("b", "B")
                    .atNow();
        }

        QueryResponse response = context.awaitTable(table);
        String stringType = ColumnTypes.stringType(context.getVersion());
        Assertions.assertEquals(
                List.of(Column.of("a", stringType), Column.of("b", stringType), Column.of(TIMESTAMP_COLUMN, TIMESTAMP)),
                response.getColumns());
        Assertions.assertEquals(List.of(List.of("A", "B")), response.getDatasetWithout(TIMESTAMP_COLUMN));
    }

    static void mismatchedTypesAcrossRows(ScenarioContext context) throws Exception {
        String table = context.uniqueTableName();
        try (Sender sender = context.newSender()) {
            sender.table(table)
                    .symbol("a", "A")
                    .atNow();
            sender.flush();
            sender.table(table)
                    .stringColumn("a", "B")
                    .atNow();
            sender.flush();
        }

        // Only the first row is ever visible.
        QueryResponse response = context.awaitTable(table);
        Assertions.assertEquals(
                List.of(Column.of("a", SYMBOL), Column.of(TIMESTAMP_COLUMN, TIMESTAMP)),
                response.getColumns());
        Assertions.assertEquals(List.of(List.of("A")), response.getDatasetWithout(TIMESTAMP_COLUMN));

        Assertions.assertThrows(PollTimeoutException.class,
                () -> context.getConsistencyCheck().awaitTable(table, 2, Duration.ofSeconds(1)),
                "second row with a conflicting type should be dropped");
    }

    static void explicitTimestamp(ScenarioContext context) throws Exception {
        String table = context.uniqueTableName();
        try (Sender sender = context.newSender()) {
            sender.table(table)
                    .symbol("a", "A")
                    .at(EXPLICIT_TIMESTAMP_NANOS, ChronoUnit.NANOS);
        }

        // The server keeps microseconds.
        String expectedTimestamp = Instant.ofEpochSecond(0, EXPLICIT_TIMESTAMP_NANOS)
                .truncatedTo(ChronoUnit.MICROS)
                .toString();

        QueryResponse response = context.awaitTable(table);
        Assertions.assertEquals(List.of(List.of("A", expectedTimestamp)), response.getDataset());
    }

    static void underscores(ScenarioContext context) throws Exception {
        String table = "_" + context.uniqueTableName() + "_";
        try (Sender sender = context.newSender()) {
            sender.table(table)
                    .symbol("_a_b_c_", "A")
                    .boolColumn("_d_e_f_", true)
                    .atNow();
        }

        QueryResponse response = context.awaitTable(table);
        Assertions.assertEquals(
                List.of(Column.of("_a_b_c_", SYMBOL), Column.of("_d_e_f_", BOOLEAN), Column.of(TIMESTAMP_COLUMN, TIMESTAMP)),
                response.getColumns());
        Assertions.assertEquals(List.of(List.of("A", true)), response.getDatasetWithout(TIMESTAMP_COLUMN));
    }

    static void funkyChars(ScenarioContext context) throws Exception {
        String table = context.uniqueTableName();
        String smilie = new String(Character.toChars(0x1F601));
        try (Sender sender = context.newSender()) {
            sender.table(table)
                    .symbol(smilie, smilie)
                    .atNow();
        }

        QueryResponse response = context.awaitTable(table);
        Assertions.assertEquals(
                List.of(Column.of(smilie, SYMBOL), Column.of(TIMESTAMP_COLUMN, TIMESTAMP)),
                response.getColumns());
        Assertions.assertEquals(List.of(List.of(smilie)), response.getDatasetWithout(TIMESTAMP_COLUMN));
    }

    static void manyRowsRoundTrip(ScenarioContext context) throws Exception {
        String table = context.uniqueTableName();
        List<List<Object>> expected = new ArrayList<>(ROUND_TRIP_ROWS);
        try (Sender sender = context.newSender()) {
            for (int i = 0; i < ROUND_TRIP_ROWS; i++) {
                sender.table(table)
                        .longColumn("seq", i)
                        .stringColumn("label", "row-" + i)
                        .atNow();
                expected.add(List.of((long) i, "row-" + i));
            }
        }

        QueryResponse response = context.getConsistencyCheck()
                .awaitTable(table, ROUND_TRIP_ROWS, context.getAwaitTimeout());
        Assertions.assertEquals(ROUND_TRIP_ROWS, response.getRowCount(), "row count");
        Assertions.assertEquals(expected, response.getDatasetWithout(TIMESTAMP_COLUMN));
    }
}
