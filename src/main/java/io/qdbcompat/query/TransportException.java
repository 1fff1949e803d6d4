package io.qdbcompat.query;

/**
 * The HTTP exchange itself failed: no connection, timeout, I/O error or a non-200 status.
 */
public class TransportException extends QueryException {

    private final int statusCode;

    public TransportException(String query, String message, Throwable cause) {
        super(query, message, cause);
        this.statusCode = -1;
    }

    public TransportException(String query, int statusCode, String body) {
        super(query, "Error response " + statusCode + " from " + query + ": " + body, null);
        this.statusCode = statusCode;
    }

    /**
     * Gets the HTTP status, or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
