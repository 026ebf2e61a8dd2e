package de.mirkosertic.contactbench.store.jdbc;

import de.mirkosertic.contactbench.plan.QueryPlan;
import de.mirkosertic.contactbench.plan.QueryPlanBuilder;
import de.mirkosertic.contactbench.schema.ContactSchemaRegistry;
import de.mirkosertic.contactbench.schema.EntityType;
import de.mirkosertic.contactbench.store.StoreException;
import de.mirkosertic.contactbench.store.StoreQuery;
import de.mirkosertic.contactbench.store.StoreResult;
import de.mirkosertic.contactbench.store.StoreTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("JdbcContactStore Tests")
class JdbcContactStoreTest {

    private static final Duration TIMEOUT = Duration.ofMillis(1500);

    private final QueryPlanBuilder planBuilder = new QueryPlanBuilder(ContactSchemaRegistry.INSTANCE);

    private DataSource dataSource;
    private Connection connection;
    private Statement sessionStatement;
    private PreparedStatement countStatement;
    private PreparedStatement selectStatement;
    private ResultSet countResult;
    private ResultSet rowsResult;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        sessionStatement = mock(Statement.class);
        countStatement = mock(PreparedStatement.class);
        selectStatement = mock(PreparedStatement.class);
        countResult = mock(ResultSet.class);
        rowsResult = mock(ResultSet.class);

        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(sessionStatement);
        when(connection.prepareStatement(startsWith("SELECT COUNT(*)"))).thenReturn(countStatement);
        when(connection.prepareStatement(startsWith("SELECT a.id"))).thenReturn(selectStatement);
        when(countStatement.executeQuery()).thenReturn(countResult);
        when(selectStatement.executeQuery()).thenReturn(rowsResult);
    }

    private JdbcContactStore store(final SqlDialect dialect) {
        return new JdbcContactStore(dataSource, dialect, ContactSchemaRegistry.INSTANCE);
    }

    private QueryPlan addressPlan(final String page) throws Exception {
        return planBuilder.build(EntityType.ADDRESS, Map.of("page", page, "page_size", "10"));
    }

    private void givenCount(final long count) throws SQLException {
        when(countResult.next()).thenReturn(true, false);
        when(countResult.getLong(1)).thenReturn(count);
    }

    @Nested
    @DisplayName("Fetching")
    class Fetching {

        @Test
        @DisplayName("Should read the total and the rows of a page")
        void shouldReadPage() throws Exception {
            // Given
            givenCount(12);
            when(rowsResult.next()).thenReturn(true, false);
            when(rowsResult.getLong(1)).thenReturn(7L);
            when(rowsResult.getString(2)).thenReturn("Main Street");

            // When
            final StoreResult result;
            final int statements;
            try (StoreQuery<StoreResult> query = store(SqlDialect.POSTGRESQL).prepareFetch(addressPlan("1"), TIMEOUT)) {
                result = query.execute();
                statements = query.statementCount();
            }

            // Then
            assertThat(result.totalCount()).isEqualTo(12);
            assertThat(result.rows()).containsExactly(Map.of("id", 7L, "street", "Main Street"));
            assertThat(statements).isEqualTo(2);
            verify(connection).close();
        }

        @Test
        @DisplayName("Should skip the select for a page past the end")
        void shouldSkipSelectPastEnd() throws Exception {
            givenCount(5);

            try (StoreQuery<StoreResult> query = store(SqlDialect.POSTGRESQL).prepareFetch(addressPlan("2"), TIMEOUT)) {
                final StoreResult result = query.execute();

                assertThat(result.rows()).isEmpty();
                assertThat(result.totalCount()).isEqualTo(5);
                assertThat(query.statementCount()).isEqualTo(1);
            }
            verify(connection, never()).prepareStatement(startsWith("SELECT a.id"));
        }

        @Test
        @DisplayName("Should count with a single statement")
        void shouldCount() throws Exception {
            givenCount(42);

            try (StoreQuery<Long> query = store(SqlDialect.MYSQL).prepareCount(addressPlan("1"), TIMEOUT)) {
                assertThat(query.execute()).isEqualTo(42L);
                assertThat(query.statementCount()).isEqualTo(1);
            }
        }

        @Test
        @DisplayName("Should bind temporal values as JDBC types")
        void shouldConvertValues() {
            assertThat(JdbcContactStore.toJdbcValue(Instant.parse("2024-01-01T00:00:00Z")))
                    .isEqualTo(Timestamp.from(Instant.parse("2024-01-01T00:00:00Z")));
            assertThat(JdbcContactStore.toJdbcValue(LocalDate.of(1980, 5, 17))).isEqualTo(Date.valueOf("1980-05-17"));
            assertThat(JdbcContactStore.toJdbcValue("plain")).isEqualTo("plain");
        }
    }

    @Nested
    @DisplayName("Statement timeouts")
    class StatementTimeouts {

        @Test
        @DisplayName("Should set and reset the session timeout on PostgreSQL")
        void shouldApplySessionTimeout() throws Exception {
            givenCount(0);

            try (StoreQuery<Long> query = store(SqlDialect.POSTGRESQL).prepareCount(addressPlan("1"), TIMEOUT)) {
                query.execute();
            }

            verify(sessionStatement).execute("SET statement_timeout = 1500");
            verify(sessionStatement).execute("SET statement_timeout = DEFAULT");
            verify(countStatement, never()).setQueryTimeout(anyInt());
        }

        @Test
        @DisplayName("Should fall back to the JDBC query timeout without session support")
        void shouldUseQueryTimeout() throws Exception {
            givenCount(0);

            try (StoreQuery<Long> query = store(SqlDialect.GENERIC).prepareCount(addressPlan("1"), TIMEOUT)) {
                query.execute();
            }

            verify(countStatement).setQueryTimeout(2);
            verify(connection, never()).createStatement();
        }

        @Test
        @DisplayName("Should not limit statements without a timeout")
        void shouldSkipTimeoutWhenZero() throws Exception {
            givenCount(0);

            try (StoreQuery<Long> query = store(SqlDialect.POSTGRESQL).prepareCount(addressPlan("1"), Duration.ZERO)) {
                query.execute();
            }

            verify(connection, never()).createStatement();
        }

        @Test
        @DisplayName("Should report a PostgreSQL cancel as store timeout")
        void shouldTranslatePostgresTimeout() throws Exception {
            when(countStatement.executeQuery()).thenThrow(
                    new SQLException("canceling statement due to statement timeout", JdbcContactStore.QUERY_CANCELED_SQLSTATE));

            try (StoreQuery<Long> query = store(SqlDialect.POSTGRESQL).prepareCount(addressPlan("1"), TIMEOUT)) {
                assertThatThrownBy(query::execute)
                        .isInstanceOf(StoreTimeoutException.class)
                        .satisfies(e -> assertThat(((StoreTimeoutException) e).getTimeout()).isEqualTo(TIMEOUT));
            }
            verify(sessionStatement).execute("SET statement_timeout = DEFAULT");
        }

        @Test
        @DisplayName("Should report MySQL execution time exceeded as store timeout")
        void shouldTranslateMysqlTimeout() throws Exception {
            when(countStatement.executeQuery()).thenThrow(new SQLException("Query execution was interrupted",
                    "HY000", JdbcContactStore.MYSQL_EXECUTION_TIME_EXCEEDED));

            try (StoreQuery<Long> query = store(SqlDialect.MYSQL).prepareCount(addressPlan("1"), TIMEOUT)) {
                assertThatThrownBy(query::execute).isInstanceOf(StoreTimeoutException.class);
            }
        }

        @Test
        @DisplayName("Should report SQLTimeoutException as store timeout")
        void shouldTranslateSqlTimeoutException() throws Exception {
            when(countStatement.executeQuery()).thenThrow(new SQLTimeoutException("timed out"));

            try (StoreQuery<Long> query = store(SqlDialect.GENERIC).prepareCount(addressPlan("1"), TIMEOUT)) {
                assertThatThrownBy(query::execute).isInstanceOf(StoreTimeoutException.class);
            }
        }

        @Test
        @DisplayName("Should report other SQL errors as plain store failures")
        void shouldTranslateOtherErrors() throws Exception {
            when(countStatement.executeQuery()).thenThrow(new SQLException("relation does not exist", "42P01"));

            try (StoreQuery<Long> query = store(SqlDialect.POSTGRESQL).prepareCount(addressPlan("1"), TIMEOUT)) {
                assertThatThrownBy(query::execute)
                        .isInstanceOf(StoreException.class)
                        .isNotInstanceOf(StoreTimeoutException.class)
                        .hasMessage("SQL query failed: relation does not exist");
            }
        }
    }

    @Nested
    @DisplayName("Aborting")
    class Aborting {

        @Test
        @DisplayName("Should cancel the running statement on abort")
        void shouldCancelRunningStatement() throws Exception {
            // Given
            final CountDownLatch running = new CountDownLatch(1);
            final CountDownLatch cancelled = new CountDownLatch(1);
            when(countStatement.executeQuery()).thenAnswer(invocation -> {
                running.countDown();
                assertThat(cancelled.await(10, TimeUnit.SECONDS)).isTrue();
                throw new SQLException("canceling statement due to user request", JdbcContactStore.QUERY_CANCELED_SQLSTATE);
            });
            doAnswer(invocation -> {
                cancelled.countDown();
                return null;
            }).when(countStatement).cancel();

            try (StoreQuery<Long> query = store(SqlDialect.POSTGRESQL).prepareCount(addressPlan("1"), TIMEOUT)) {
                final CompletableFuture<Long> execution = CompletableFuture.supplyAsync(() -> {
                    try {
                        return query.execute();
                    } catch (final StoreException e) {
                        throw new IllegalStateException(e);
                    }
                });
                assertThat(running.await(10, TimeUnit.SECONDS)).isTrue();

                // When
                query.abort();

                // Then
                assertThatThrownBy(() -> execution.get(10, TimeUnit.SECONDS))
                        .isInstanceOf(ExecutionException.class)
                        .cause()
                        .cause()
                        .isInstanceOf(StoreException.class)
                        .isNotInstanceOf(StoreTimeoutException.class)
                        .hasMessage("Query aborted");
            }
            verify(countStatement).cancel();
        }

        @Test
        @DisplayName("Should not prepare statements once aborted")
        void shouldRefuseAfterAbort() throws Exception {
            try (StoreQuery<Long> query = store(SqlDialect.POSTGRESQL).prepareCount(addressPlan("1"), TIMEOUT)) {
                query.abort();
                assertThatThrownBy(query::execute).hasMessage("Query aborted before execution");
            }
            verify(connection, never()).prepareStatement(anyString());
            verify(connection).close();
        }
    }

    @Test
    @DisplayName("Should detect the dialect from database metadata")
    void shouldDetectDialect() throws Exception {
        final DatabaseMetaData metaData = mock(DatabaseMetaData.class);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getDatabaseProductName()).thenReturn("PostgreSQL");

        final JdbcContactStore store = JdbcContactStore.detect(dataSource, ContactSchemaRegistry.INSTANCE);

        assertThat(store.dialect()).isEqualTo(SqlDialect.POSTGRESQL);
        assertThat(store.name()).isEqualTo("jdbc-postgresql");
        verify(connection).close();
    }

    @Test
    @DisplayName("Should wrap connection failures")
    void shouldWrapConnectionFailure() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        assertThatThrownBy(() -> store(SqlDialect.POSTGRESQL).prepareCount(addressPlan("1"), TIMEOUT))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("connection refused");
    }
}
