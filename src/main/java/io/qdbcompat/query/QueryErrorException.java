package io.qdbcompat.query;

import java.util.Locale;

/**
 * The server accepted the request and reported a query error in the response body.
 */
public class QueryErrorException extends QueryException {

    private final String error;

    public QueryErrorException(String query, String error) {
        super(query, error, null);
        this.error = error;
    }

    /**
     * Gets the error text reported by the server.
     */
    public String getError() {
        return error;
    }

    /**
     * Checks whether the server reported that the queried table does not exist (yet).
     */
    public boolean isTableMissing() {
        String text = error.toLowerCase(Locale.ROOT);
        return text.contains("table does not exist") || text.contains("table not found");
    }
}
