package io.qdbcompat.query;

/**
 * Base class for failures of a single query against the {@code /exec} endpoint.
 */
public abstract class QueryException extends RuntimeException {

    private final String query;

    protected QueryException(String query, String message, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    /**
     * Gets the SQL text that failed.
     */
    public String getQuery() {
        return query;
    }
}
