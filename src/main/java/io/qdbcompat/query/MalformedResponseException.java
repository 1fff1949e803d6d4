package io.qdbcompat.query;

/**
 * The endpoint answered 200 but the body is not a usable query result.
 */
public class MalformedResponseException extends QueryException {

    private final String payload;

    public MalformedResponseException(String query, String payload, String reason, Throwable cause) {
        super(query, "Could not parse response: " + payload + ": " + reason, cause);
        this.payload = payload;
    }

    /**
     * Gets the raw response body.
     */
    public String getPayload() {
        return payload;
    }
}
