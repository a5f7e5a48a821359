package io.agentfarm.storage;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One-time data migration tracked in {@code schema_migrations}. {@link #apply} runs inside
 * the same immediate transaction that records the marker row, so a failure leaves neither
 * the imported rows nor the marker behind.
 */
public interface SchemaMigration {
    String version();

    String description();

    void apply(Connection conn) throws SQLException;

    /**
     * Side effects outside the database, run only once the marker is committed.
     */
    default void afterCommit() {
    }
}
