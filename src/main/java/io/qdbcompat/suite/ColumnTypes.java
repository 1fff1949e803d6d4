package io.qdbcompat.suite;

import io.qdbcompat.version.Version;

/**
 * Column type names as the query endpoint reports them for ILP-created columns.
 */
public final class ColumnTypes {

    private ColumnTypes() {
        // Utility class
    }

    public static final String SYMBOL = "SYMBOL";
    public static final String BOOLEAN = "BOOLEAN";
    public static final String LONG = "LONG";
    public static final String DOUBLE = "DOUBLE";
    public static final String TIMESTAMP = "TIMESTAMP";

    private static final Version FIRST_VARCHAR_RELEASE = Version.of(8, 0, 0);

    /**
     * Gets the type of a column created from an ILP string field. QuestDB 8.0 switched new
     * string columns from {@code STRING} to {@code VARCHAR}.
     */
    public static String stringType(Version version) {
        return version.isAtLeast(FIRST_VARCHAR_RELEASE) ? "VARCHAR" : "STRING";
    }
}
