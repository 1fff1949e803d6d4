package io.qdbcompat.query;

import io.qdbcompat.poll.FailurePolicy;
import io.qdbcompat.poll.ProbeResult;
import io.qdbcompat.poll.RetryPoller;
import java.time.Duration;
import java.util.Objects;

/**
 * Waits for ingested rows to become visible through the query endpoint.
 *
 * <p>ILP writes return before the rows are committed, and the table may not even exist when the
 * first query arrives. Query errors and short datasets are therefore treated as "not yet" until
 * the timeout. Under {@link FailurePolicy#FAIL_FAST} only a missing table is retried, any other
 * query error or an unparseable response ends the wait immediately.
 */
public final class ConsistencyCheck {

    private final QueryClient queryClient;
    private final RetryPoller poller;
    private final Duration defaultTimeout;

    public ConsistencyCheck(QueryClient queryClient, RetryPoller poller, Duration defaultTimeout) {
        this.queryClient = Objects.requireNonNull(queryClient, "queryClient");
        this.poller = Objects.requireNonNull(poller, "poller");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Waits until the table holds at least one row, using the default timeout.
     */
    public QueryResponse awaitTable(String tableName) throws InterruptedException {
        return awaitTable(tableName, 1, defaultTimeout);
    }

    /**
     * Waits until {@code select * from '<tableName>'} returns at least {@code minRows} rows.
     *
     * @param tableName table to query
     * @param minRows minimum number of rows, at least 1
     * @param timeout how long to keep polling
     * @return the first response with enough rows
     * @throws io.qdbcompat.poll.PollTimeoutException if the rows did not appear in time
     * @throws io.qdbcompat.poll.PollFailedException if a permanent error occurred under fail-fast
     * @throws InterruptedException if interrupted while polling
     */
    public QueryResponse awaitTable(String tableName, int minRows, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(tableName, "tableName");
        if (minRows < 1) {
            throw new IllegalArgumentException("minRows must be at least 1: " + minRows);
        }
        String sql = "select * from '" + tableName.replace("'", "''") + "'";
        return poller.poll("table '" + tableName + "' with " + minRows + " rows",
                () -> check(sql, minRows),
                timeout);
    }

    private ProbeResult<QueryResponse> check(String sql, int minRows) throws InterruptedException {
        QueryResponse response;
        try {
            response = queryClient.query(sql);
        } catch (QueryErrorException e) {
            if (poller.getFailurePolicy() == FailurePolicy.FAIL_FAST && !e.isTableMissing()) {
                return ProbeResult.permanentFailure(e);
            }
            return ProbeResult.notYet(e);
        } catch (TransportException e) {
            return ProbeResult.notYet(e);
        } catch (MalformedResponseException e) {
            return ProbeResult.permanentFailure(e);
        }

        if (response.getRowCount() < minRows) {
            return ProbeResult.notYet();
        }
        return ProbeResult.success(response);
    }
}
