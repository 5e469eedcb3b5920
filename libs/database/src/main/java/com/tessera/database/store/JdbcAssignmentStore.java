package com.tessera.database.store;

import com.tessera.authorization.StorageException;
import com.tessera.authorization.assignment.AddOutcome;
import com.tessera.authorization.assignment.Assignment;
import com.tessera.authorization.assignment.AssignmentStore;
import com.tessera.authorization.assignment.AuthorizationRule;
import com.tessera.authorization.assignment.RemoveOutcome;
import com.tessera.authorization.assignment.RuleType;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PostgreSQL implementation of {@link AssignmentStore} over the {@code authorization_rule} table.
 *
 * <p>Only {@link RuleType#ASSIGNMENT} rows are read or written. Inserts are idempotent through
 * {@code ON CONFLICT DO NOTHING} on the unique {@code (record_type, subject, role, tenant)} key.
 * Every statement carries the configured query timeout. Timeouts and connection-class failures are
 * reported as retryable {@link StorageException}s; nothing is retried here.
 */
public class JdbcAssignmentStore implements AssignmentStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAssignmentStore.class);

    static final String SELECT_ALL =
            "SELECT record_type, subject, role, tenant FROM authorization_rule ORDER BY id";

    static final String INSERT =
            """
            INSERT INTO authorization_rule (record_type, subject, role, tenant)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (record_type, subject, role, tenant) DO NOTHING
            """;

    static final String DELETE =
            "DELETE FROM authorization_rule WHERE record_type = ? AND subject = ? AND role = ? AND tenant = ?";

    static final String DELETE_ALL = "DELETE FROM authorization_rule WHERE record_type = ?";

    // SQLState class 08: connection exception
    private static final String CONNECTION_STATE_CLASS = "08";

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    public JdbcAssignmentStore(DataSource dataSource, Duration queryTimeout) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = (int) Math.max(1, queryTimeout.toSeconds());
    }

    @Override
    public Set<Assignment> load() {
        var assignments = new LinkedHashSet<Assignment>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SELECT_ALL)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String recordType = rs.getString("record_type");
                    Optional<RuleType> type = RuleType.fromValue(recordType);
                    if (type.isEmpty() || type.get() != RuleType.ASSIGNMENT) {
                        log.debug("Skipping non-assignment row of type '{}'", recordType);
                        continue;
                    }
                    assignments.add(
                            new Assignment(
                                    rs.getString("subject"), rs.getString("role"), rs.getString("tenant")));
                }
            }
        } catch (SQLException e) {
            throw storageFailure("Failed to load role assignments", e);
        }
        log.debug("Loaded {} assignment rows", assignments.size());
        return Collections.unmodifiableSet(assignments);
    }

    /** Replaces every stored assignment in one transaction; on failure the old rows stay. */
    @Override
    public void save(Collection<Assignment> assignments) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            SQLException failure = null;
            try {
                try (PreparedStatement delete = conn.prepareStatement(DELETE_ALL)) {
                    delete.setQueryTimeout(queryTimeoutSeconds);
                    delete.setString(1, RuleType.ASSIGNMENT.value());
                    delete.executeUpdate();
                }
                try (PreparedStatement insert = conn.prepareStatement(INSERT)) {
                    insert.setQueryTimeout(queryTimeoutSeconds);
                    for (Assignment assignment : assignments) {
                        bind(insert, AuthorizationRule.assignment(assignment));
                        insert.addBatch();
                    }
                    insert.executeBatch();
                }
                conn.commit();
            } catch (SQLException e) {
                failure = e;
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                restoreAutoCommit(conn, autoCommit, failure);
            }
        } catch (SQLException e) {
            throw storageFailure("Failed to save role assignments", e);
        }
        log.info("Saved {} role assignments", assignments.size());
    }

    @Override
    public AddOutcome add(AuthorizationRule rule) {
        if (!rule.isAssignment()) {
            log.debug("Ignoring add of non-assignment rule: {}", rule);
            return AddOutcome.IGNORED;
        }
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(INSERT)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            bind(stmt, rule);
            int inserted = stmt.executeUpdate();
            return inserted > 0 ? AddOutcome.ADDED : AddOutcome.ALREADY_EXISTED;
        } catch (SQLException e) {
            throw storageFailure("Failed to add role assignment", e);
        }
    }

    @Override
    public RemoveOutcome remove(AuthorizationRule rule) {
        if (!rule.isAssignment()) {
            log.debug("Ignoring remove of non-assignment rule: {}", rule);
            return RemoveOutcome.IGNORED;
        }
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(DELETE)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            bind(stmt, rule);
            int deleted = stmt.executeUpdate();
            return deleted > 0 ? RemoveOutcome.REMOVED : RemoveOutcome.NOT_FOUND;
        } catch (SQLException e) {
            throw storageFailure("Failed to remove role assignment", e);
        }
    }

    // ── Private Helpers ──

    private static void bind(PreparedStatement stmt, AuthorizationRule rule) throws SQLException {
        stmt.setString(1, rule.type().value());
        stmt.setString(2, rule.subject());
        stmt.setString(3, rule.role());
        stmt.setString(4, rule.tenant());
    }

    private static void rollbackQuietly(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private static void restoreAutoCommit(Connection conn, boolean autoCommit, SQLException failure)
            throws SQLException {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException restoreFailure) {
            if (failure == null) {
                throw restoreFailure;
            }
            failure.addSuppressed(restoreFailure);
        }
    }

    static boolean isRetryable(SQLException e) {
        if (e instanceof SQLTransientException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith(CONNECTION_STATE_CLASS);
    }

    private static StorageException storageFailure(String message, SQLException e) {
        boolean retryable = isRetryable(e);
        log.error("{} (sqlState={}, retryable={})", message, e.getSQLState(), retryable, e);
        return new StorageException(message, e, retryable);
    }
}
