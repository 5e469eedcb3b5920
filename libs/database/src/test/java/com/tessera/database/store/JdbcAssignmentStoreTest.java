package com.tessera.database.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tessera.authorization.StorageException;
import com.tessera.authorization.assignment.AddOutcome;
import com.tessera.authorization.assignment.Assignment;
import com.tessera.authorization.assignment.AuthorizationRule;
import com.tessera.authorization.assignment.RemoveOutcome;
import com.tessera.authorization.policy.PolicyFact;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcAssignmentStore")
class JdbcAssignmentStoreTest {

    private static final Assignment STUDENT = new Assignment("u1", "student", "acme");

    private DataSource dataSource;
    private Connection connection;
    private PreparedStatement statement;
    private JdbcAssignmentStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        store = new JdbcAssignmentStore(dataSource, Duration.ofSeconds(3));
    }

    @Nested
    @DisplayName("add()")
    class Add {

        @Test
        @DisplayName("inserts the assignment row with a query timeout")
        void inserts() throws SQLException {
            when(statement.executeUpdate()).thenReturn(1);

            assertThat(store.add(STUDENT)).isEqualTo(AddOutcome.ADDED);

            verify(connection).prepareStatement(JdbcAssignmentStore.INSERT);
            verify(statement).setQueryTimeout(3);
            verify(statement).setString(1, "assignment");
            verify(statement).setString(2, "u1");
            verify(statement).setString(3, "student");
            verify(statement).setString(4, "acme");
        }

        @Test
        @DisplayName("reports an existing row when the insert is a no-op")
        void alreadyExisted() throws SQLException {
            when(statement.executeUpdate()).thenReturn(0);

            assertThat(store.add(STUDENT)).isEqualTo(AddOutcome.ALREADY_EXISTED);
        }

        @Test
        @DisplayName("ignores policy rules without touching the database")
        void ignoresPolicy() {
            var rule = AuthorizationRule.policy(new PolicyFact("admin", "*", "*", "acme"));

            assertThat(store.add(rule)).isEqualTo(AddOutcome.IGNORED);
            verifyNoInteractions(dataSource);
        }

        @Test
        @DisplayName("a statement timeout becomes a retryable StorageException")
        void timeout() throws SQLException {
            when(statement.executeUpdate()).thenThrow(new SQLTimeoutException("canceling statement"));

            assertThatThrownBy(() -> store.add(STUDENT))
                    .isInstanceOf(StorageException.class)
                    .satisfies(e -> assertThat(((StorageException) e).retryable()).isTrue());
        }

        @Test
        @DisplayName("a constraint violation is not retryable")
        void constraintViolation() throws SQLException {
            when(statement.executeUpdate()).thenThrow(new SQLException("value too long", "22001"));

            assertThatThrownBy(() -> store.add(STUDENT))
                    .isInstanceOf(StorageException.class)
                    .satisfies(e -> assertThat(((StorageException) e).retryable()).isFalse());
        }
    }

    @Nested
    @DisplayName("remove()")
    class Remove {

        @Test
        @DisplayName("reports a deleted row")
        void removed() throws SQLException {
            when(statement.executeUpdate()).thenReturn(1);

            assertThat(store.remove(STUDENT)).isEqualTo(RemoveOutcome.REMOVED);
            verify(connection).prepareStatement(JdbcAssignmentStore.DELETE);
        }

        @Test
        @DisplayName("reports a missing row")
        void notFound() throws SQLException {
            when(statement.executeUpdate()).thenReturn(0);

            assertThat(store.remove(STUDENT)).isEqualTo(RemoveOutcome.NOT_FOUND);
        }

        @Test
        @DisplayName("ignores policy rules")
        void ignoresPolicy() {
            var rule = AuthorizationRule.policy(new PolicyFact("student", "assignment", "view", "acme"));

            assertThat(store.remove(rule)).isEqualTo(RemoveOutcome.IGNORED);
            verifyNoInteractions(dataSource);
        }

        @Test
        @DisplayName("an unreachable database is retryable")
        void unreachable() throws SQLException {
            when(dataSource.getConnection())
                    .thenThrow(new SQLTransientConnectionException("Connection is not available"));

            assertThatThrownBy(() -> store.remove(STUDENT))
                    .isInstanceOf(StorageException.class)
                    .satisfies(e -> assertThat(((StorageException) e).retryable()).isTrue());
        }
    }

    @Nested
    @DisplayName("load()")
    class Load {

        @Test
        @DisplayName("returns assignment rows and skips every other tag")
        void skipsNonAssignments() throws SQLException {
            ResultSet rs = mock(ResultSet.class);
            when(statement.executeQuery()).thenReturn(rs);
            when(rs.next()).thenReturn(true, true, true, false);
            when(rs.getString("record_type")).thenReturn("assignment", "policy", "g2");
            when(rs.getString("subject")).thenReturn("u1");
            when(rs.getString("role")).thenReturn("student");
            when(rs.getString("tenant")).thenReturn("acme");

            assertThat(store.load()).containsExactly(STUDENT);
            verify(statement).setQueryTimeout(3);
        }

        @Test
        @DisplayName("wraps read failures")
        void readFailure() throws SQLException {
            when(statement.executeQuery()).thenThrow(new SQLException("relation does not exist", "42P01"));

            assertThatThrownBy(() -> store.load())
                    .isInstanceOf(StorageException.class)
                    .hasMessage("Failed to load role assignments");
        }
    }

    @Nested
    @DisplayName("save()")
    class Save {

        @Test
        @DisplayName("deletes and reinserts inside one committed transaction")
        void commits() throws SQLException {
            when(connection.getAutoCommit()).thenReturn(true);

            store.save(List.of(STUDENT, new Assignment("u2", "admin", "other")));

            var order = inOrder(connection, statement);
            order.verify(connection).setAutoCommit(false);
            order.verify(connection).prepareStatement(JdbcAssignmentStore.DELETE_ALL);
            order.verify(statement).executeUpdate();
            order.verify(connection).prepareStatement(JdbcAssignmentStore.INSERT);
            order.verify(statement, times(2)).addBatch();
            order.verify(statement).executeBatch();
            order.verify(connection).commit();
            order.verify(connection).setAutoCommit(true);
            verify(connection, never()).rollback();
        }

        @Test
        @DisplayName("rolls back when the insert batch fails")
        void rollsBack() throws SQLException {
            when(statement.executeBatch()).thenThrow(new SQLException("batch failed", "23505"));

            assertThatThrownBy(() -> store.save(List.of(STUDENT)))
                    .isInstanceOf(StorageException.class)
                    .hasMessage("Failed to save role assignments");

            verify(connection).rollback();
            verify(connection, never()).commit();
        }

        @Test
        @DisplayName("keeps the batch failure when restoring auto-commit also fails")
        void restoreFailureIsSuppressed() throws SQLException {
            var batchFailure = new SQLException("batch failed", "23505");
            var restoreFailure = new SQLException("connection closed", "08003");
            when(connection.getAutoCommit()).thenReturn(true);
            when(statement.executeBatch()).thenThrow(batchFailure);
            doThrow(restoreFailure).when(connection).setAutoCommit(true);

            assertThatThrownBy(() -> store.save(List.of(STUDENT)))
                    .isInstanceOf(StorageException.class)
                    .hasCause(batchFailure)
                    .satisfies(e -> assertThat(e.getCause().getSuppressed()).containsExactly(restoreFailure));

            verify(connection).rollback();
        }
    }

    @Test
    @DisplayName("connection-class SQL states are retryable")
    void connectionStatesRetryable() {
        assertThat(JdbcAssignmentStore.isRetryable(new SQLException("refused", "08001"))).isTrue();
        assertThat(JdbcAssignmentStore.isRetryable(new SQLException("syntax", "42601"))).isFalse();
        assertThat(JdbcAssignmentStore.isRetryable(new SQLException("unknown"))).isFalse();
    }
}
