package io.qdbcompat.suite;

import io.qdbcompat.fixture.Fixture;
import io.qdbcompat.query.ConsistencyCheck;
import io.qdbcompat.query.QueryResponse;
import io.qdbcompat.version.Version;
import io.questdb.client.Sender;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Everything a scenario needs to talk to the instance under test.
 *
 * <p>One context is built per version and handed to every scenario invocation.
 */
public final class ScenarioContext {

    private final Fixture fixture;
    private final ConsistencyCheck consistencyCheck;

    public ScenarioContext(Fixture fixture, ConsistencyCheck consistencyCheck) {
        this.fixture = Objects.requireNonNull(fixture, "fixture");
        this.consistencyCheck = Objects.requireNonNull(consistencyCheck, "consistencyCheck");
    }

    public Fixture getFixture() {
        return fixture;
    }

    public Version getVersion() {
        return fixture.getVersion();
    }

    public ConsistencyCheck getConsistencyCheck() {
        return consistencyCheck;
    }

    public Duration getAwaitTimeout() {
        return consistencyCheck.getDefaultTimeout();
    }

    /**
     * Opens a new ILP sender. Closing it flushes pending rows.
     */
    public Sender newSender() {
        return fixture.newSender();
    }

    /**
     * Waits for at least one row in the table using the default timeout.
     */
    public QueryResponse awaitTable(String tableName) throws InterruptedException {
        return consistencyCheck.awaitTable(tableName);
    }

    /**
     * Generates a table name no other scenario uses.
     */
    public String uniqueTableName() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
