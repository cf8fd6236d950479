/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.database;

import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.core.CancellationSignal;
import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.core.FatalPublishException;
import com.intuitivedesigns.tracekernel.core.PartialPublishException;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import com.intuitivedesigns.tracekernel.format.EventJson;
import com.intuitivedesigns.tracekernel.metrics.MetricsRuntime;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Writes events as rows of a relational table through a HikariCP pool.
 * <p>
 * One transaction per batch. If the driver reports a failed row, the transaction is rolled back and the
 * row index is surfaced as a {@link PartialPublishException} so the caller can drop it and retry the rest.
 */
public final class DatabaseSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(DatabaseSink.class);

    // Config keys (relative to sink.<name>.)
    public static final String KEY_URL = "jdbc.url";
    public static final String KEY_USERNAME = "jdbc.username";
    public static final String KEY_PASSWORD = "jdbc.password";
    public static final String KEY_POOL_SIZE = "jdbc.pool.size";
    public static final String KEY_TABLE = "table";
    public static final String KEY_INSTANCE = "instance";
    public static final String KEY_CREATE_TABLE = "create.table";

    private static final String DEFAULT_TABLE = "traces";
    private static final int DEFAULT_POOL_SIZE = 5;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}(\\.[A-Za-z_][A-Za-z0-9_]{0,62})?");

    static final String COLUMNS = "instance_name, provider_id, provider_name, event_id, event_keywords, level, opcode, task, "
            + "event_timestamp, version, formatted_message, payload, activity_id, related_activity_id, process_id, thread_id";

    private final String id;
    private final String instanceName;
    private final String table;
    private final DataSource dataSource;
    private final MetricsRuntime metrics;
    private final String insertSql;

    DatabaseSink(String id, String instanceName, String table, DataSource dataSource, MetricsRuntime metrics) {
        this.id = Objects.requireNonNull(id, "id");
        this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
        this.table = requireIdentifier(table);
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.metrics = (metrics == null) ? MetricsRuntime.NOOP : metrics;
        this.insertSql = "INSERT INTO " + this.table + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    }

    /**
     * @throws IllegalArgumentException if {@code jdbc.url} is missing or the table name is not a plain identifier
     */
    public static DatabaseSink fromConfig(String name, PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final String url = config.getString(KEY_URL, null);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Missing config: sink." + name + "." + KEY_URL);
        }
        final String table = requireIdentifier(config.getString(KEY_TABLE, DEFAULT_TABLE));

        final HikariConfig hikari = new HikariConfig();
        String jdbcUrl = url.trim();
        if (jdbcUrl.startsWith("jdbc:postgresql:") && !jdbcUrl.contains("reWriteBatchedInserts")) {
            jdbcUrl += (jdbcUrl.contains("?") ? "&" : "?") + "reWriteBatchedInserts=true";
        }
        hikari.setJdbcUrl(jdbcUrl);
        hikari.setUsername(config.getString(KEY_USERNAME, null));
        hikari.setPassword(config.getString(KEY_PASSWORD, null));
        hikari.setMaximumPoolSize(config.getInt(KEY_POOL_SIZE, DEFAULT_POOL_SIZE));
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(5000);
        hikari.setAutoCommit(false);
        hikari.setPoolName("tk-db-" + name);

        final HikariDataSource ds = new HikariDataSource(hikari);
        try {
            final DatabaseSink sink = new DatabaseSink(name, config.getString(KEY_INSTANCE, name), table, ds, metrics);
            if (config.getBoolean(KEY_CREATE_TABLE, false)) {
                sink.createTableIfMissing();
            }
            log.info("DatabaseSink [{}] active (table={}, pool={})", name, table, hikari.getMaximumPoolSize());
            return sink;
        } catch (SQLException | RuntimeException e) {
            ds.close();
            throw new IllegalStateException("Failed to prepare table " + table + " for sink [" + name + "]", e);
        }
    }

    @Override
    public int publish(List<TraceEvent> batch, CancellationSignal cancellation) throws Exception {
        if (batch.isEmpty()) return 0;
        final long start = System.nanoTime();

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
                for (TraceEvent event : batch) {
                    bind(stmt, event);
                    stmt.addBatch();
                }
                stmt.executeBatch();
                conn.commit();
            } catch (BatchUpdateException e) {
                rollbackQuietly(conn);
                final int failed = firstFailedIndex(e, batch.size());
                if (failed < 0) {
                    throw new FatalPublishException("Batch insert into " + table + " failed without a row index", e);
                }
                throw new PartialPublishException(failed, "Row " + failed + " rejected by " + table + ": " + e.getMessage(), e);
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn);
                throw e;
            }
        }

        metrics.timer("tracekernel.sink.database.latency", (System.nanoTime() - start) / 1_000_000, "sink", id);
        return batch.size();
    }

    @Override
    public boolean isTransient(Exception error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof SQLTransientException || t instanceof SQLRecoverableException) {
                return true;
            }
            // SQLSTATE class 08: connection exception
            if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("08")) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari) {
            hikari.close();
        }
        log.info("DatabaseSink [{}] closed.", id);
    }

    public String table() {
        return table;
    }

    void createTableIfMissing() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(createTableSql(table));
            conn.commit();
        }
    }

    static String createTableSql(String table) {
        return "CREATE TABLE IF NOT EXISTS " + requireIdentifier(table) + " ("
                + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                + "instance_name VARCHAR(1000) NOT NULL, "
                + "provider_id VARCHAR(36) NOT NULL, "
                + "provider_name VARCHAR(500) NOT NULL, "
                + "event_id INTEGER NOT NULL, "
                + "event_keywords BIGINT NOT NULL, "
                + "level INTEGER NOT NULL, "
                + "opcode INTEGER NOT NULL, "
                + "task INTEGER NOT NULL, "
                + "event_timestamp TIMESTAMP NOT NULL, "
                + "version INTEGER NOT NULL, "
                + "formatted_message VARCHAR(4000), "
                + "payload VARCHAR(65535), "
                + "activity_id VARCHAR(36), "
                + "related_activity_id VARCHAR(36), "
                + "process_id BIGINT, "
                + "thread_id BIGINT)";
    }

    // --- Helpers ---

    private void bind(PreparedStatement stmt, TraceEvent e) throws SQLException {
        stmt.setString(1, instanceName);
        stmt.setString(2, e.providerId().toString());
        stmt.setString(3, e.providerName());
        stmt.setInt(4, e.eventId());
        stmt.setLong(5, e.keywords());
        stmt.setInt(6, e.level().value());
        stmt.setInt(7, e.opcode());
        stmt.setInt(8, e.task());
        stmt.setTimestamp(9, Timestamp.from(e.timestamp()));
        stmt.setInt(10, e.version());
        setNullableString(stmt, 11, e.formattedMessage());
        stmt.setString(12, EventJson.payloadJson(e));
        setNullableString(stmt, 13, idOrNull(e.activityId()));
        setNullableString(stmt, 14, idOrNull(e.relatedActivityId()));
        stmt.setLong(15, e.processId());
        stmt.setLong(16, e.threadId());
    }

    private static void setNullableString(PreparedStatement stmt, int index, String value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value);
        }
    }

    private static String idOrNull(UUID id) {
        return (id == null || TraceEvent.EMPTY_ID.equals(id)) ? null : id.toString();
    }

    /**
     * Drivers either mark the failed row with {@link Statement#EXECUTE_FAILED} or stop at it, returning
     * counts for the rows before it only.
     */
    static int firstFailedIndex(BatchUpdateException e, int batchSize) {
        final int[] counts = e.getUpdateCounts();
        if (counts == null) return -1;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == Statement.EXECUTE_FAILED) {
                return i;
            }
        }
        return (counts.length < batchSize) ? counts.length : -1;
    }

    private void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed for sink [{}]: {}", id, e.toString());
        }
    }

    static String requireIdentifier(String table) {
        if (table == null || !IDENTIFIER.matcher(table.trim()).matches()) {
            throw new IllegalArgumentException("Invalid table name: '" + table + "'");
        }
        return table.trim();
    }
}
