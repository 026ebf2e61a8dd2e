package de.mirkosertic.contactbench.store.jdbc;

import de.mirkosertic.contactbench.plan.Pagination;
import de.mirkosertic.contactbench.plan.QueryPlan;
import de.mirkosertic.contactbench.schema.FieldDescriptor;
import de.mirkosertic.contactbench.schema.SchemaRegistry;
import de.mirkosertic.contactbench.store.AbstractStoreQuery;
import de.mirkosertic.contactbench.store.ContactStore;
import de.mirkosertic.contactbench.store.StoreException;
import de.mirkosertic.contactbench.store.StoreQuery;
import de.mirkosertic.contactbench.store.StoreResult;
import de.mirkosertic.contactbench.store.StoreTimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link ContactStore} on a relational database reached through JDBC.
 * <p>
 * Each prepared query borrows one connection from the {@link DataSource} until it is closed. The
 * statement timeout is set on the session before the data statements run and reset to the
 * server default afterwards. {@link StoreQuery#abort()} cancels the running statement.
 */
public class JdbcContactStore implements ContactStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcContactStore.class);

    /** PostgreSQL: canceling statement due to statement timeout or user request. */
    static final String QUERY_CANCELED_SQLSTATE = "57014";

    /** MySQL: maximum statement execution time exceeded. */
    static final int MYSQL_EXECUTION_TIME_EXCEEDED = 3024;

    @FunctionalInterface
    private interface ResultReader<R> {
        R read(ResultSet resultSet) throws SQLException;
    }

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final SchemaRegistry schema;
    private final SqlQueryRenderer renderer;

    public JdbcContactStore(final DataSource dataSource, final SqlDialect dialect, final SchemaRegistry schema) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.schema = schema;
        this.renderer = new SqlQueryRenderer(schema, dialect);
    }

    /**
     * Creates a store whose dialect matches the database behind {@code dataSource}.
     */
    public static JdbcContactStore detect(final DataSource dataSource, final SchemaRegistry schema)
            throws StoreException {
        try (Connection connection = dataSource.getConnection()) {
            final String product = connection.getMetaData().getDatabaseProductName();
            final SqlDialect dialect = SqlDialect.fromProductName(product);
            logger.info("Connected to {} using dialect {}", product, dialect);
            return new JdbcContactStore(dataSource, dialect, schema);
        } catch (final SQLException e) {
            throw new StoreException("Failed to inspect database: " + e.getMessage(), e);
        }
    }

    public SqlDialect dialect() {
        return dialect;
    }

    @Override
    public String name() {
        return "jdbc-" + dialect.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public StoreQuery<StoreResult> prepareFetch(final QueryPlan plan, final Duration statementTimeout)
            throws StoreException {
        return new JdbcQuery<>(statementTimeout) {
            @Override
            protected StoreResult run() throws SQLException, StoreException {
                final Pagination pagination = plan.pagination();
                if (!pagination.isPaginated()) {
                    final List<Map<String, Object>> rows = query(renderer.select(plan), resultSet -> readRows(plan, resultSet));
                    return new StoreResult(rows, rows.size());
                }
                final long total = query(renderer.count(plan), JdbcContactStore::readCount);
                if (pagination.offset() >= total) {
                    return new StoreResult(List.of(), total);
                }
                return new StoreResult(query(renderer.select(plan), resultSet -> readRows(plan, resultSet)), total);
            }
        };
    }

    @Override
    public StoreQuery<Long> prepareCount(final QueryPlan plan, final Duration statementTimeout) throws StoreException {
        return new JdbcQuery<>(statementTimeout) {
            @Override
            protected Long run() throws SQLException, StoreException {
                return query(renderer.count(plan), JdbcContactStore::readCount);
            }
        };
    }

    private static long readCount(final ResultSet resultSet) throws SQLException {
        return resultSet.next() ? resultSet.getLong(1) : 0L;
    }

    private List<Map<String, Object>> readRows(final QueryPlan plan, final ResultSet resultSet) throws SQLException {
        final List<FieldDescriptor> fields = schema.entity(plan.entity()).fields();
        final List<Map<String, Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            final Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                final Object value = readValue(fields.get(i), resultSet, i + 1);
                if (value != null) {
                    row.put(fields.get(i).path().dotted(), value);
                }
            }
            rows.add(row);
        }
        return rows;
    }

    private static @Nullable Object readValue(final FieldDescriptor field, final ResultSet resultSet, final int column)
            throws SQLException {
        return switch (field.type()) {
            case STRING -> resultSet.getString(column);
            case INTEGER -> {
                final long value = resultSet.getLong(column);
                yield resultSet.wasNull() ? null : value;
            }
            case DATE -> {
                final Date value = resultSet.getDate(column);
                yield value == null ? null : value.toLocalDate();
            }
            case TIMESTAMP -> {
                final Timestamp value = resultSet.getTimestamp(column);
                yield value == null ? null : value.toInstant();
            }
        };
    }

    static Object toJdbcValue(final Object value) {
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        if (value instanceof LocalDate date) {
            return Date.valueOf(date);
        }
        return value;
    }

    @Override
    public void close() {
        logger.info("JDBC contact store closed");
    }

    /**
     * One prepared query holding a borrowed connection.
     */
    private abstract class JdbcQuery<T> extends AbstractStoreQuery<T> {

        private final Duration statementTimeout;
        private final Connection connection;
        private volatile @Nullable Statement current;

        JdbcQuery(final Duration statementTimeout) throws StoreException {
            this.statementTimeout = statementTimeout;
            try {
                this.connection = dataSource.getConnection();
            } catch (final SQLException e) {
                throw new StoreException("Failed to obtain connection: " + e.getMessage(), e);
            }
        }

        protected abstract T run() throws SQLException, StoreException;

        @Override
        protected T doExecute() throws StoreException {
            final boolean sessionTimeout = applySessionTimeout();
            try {
                return run();
            } catch (final SQLException e) {
                throw translate(e);
            } finally {
                if (sessionTimeout) {
                    resetSessionTimeout();
                }
            }
        }

        <R> R query(final RenderedSql rendered, final ResultReader<R> reader) throws SQLException, StoreException {
            try (PreparedStatement statement = connection.prepareStatement(rendered.sql())) {
                current = statement;
                if (isAborted()) {
                    throw new StoreException("Query aborted");
                }
                if (!dialect.hasSessionTimeout() && hasTimeout()) {
                    statement.setQueryTimeout((int) Math.max(1, (statementTimeout.toMillis() + 999) / 1000));
                }
                final List<Object> parameters = rendered.parameters();
                for (int i = 0; i < parameters.size(); i++) {
                    statement.setObject(i + 1, toJdbcValue(parameters.get(i)));
                }
                statementIssued();
                logger.debug("Executing {}", rendered.sql());
                try (ResultSet resultSet = statement.executeQuery()) {
                    return reader.read(resultSet);
                }
            } finally {
                current = null;
            }
        }

        private boolean hasTimeout() {
            return !statementTimeout.isZero() && !statementTimeout.isNegative();
        }

        private boolean applySessionTimeout() throws StoreException {
            if (!hasTimeout()) {
                return false;
            }
            final String sql = dialect.statementTimeout(Math.max(1, statementTimeout.toMillis()));
            if (sql == null) {
                return false;
            }
            try (Statement statement = connection.createStatement()) {
                statement.execute(sql);
                return true;
            } catch (final SQLException e) {
                throw new StoreException("Failed to set statement timeout: " + e.getMessage(), e);
            }
        }

        private void resetSessionTimeout() {
            final String sql = dialect.resetStatementTimeout();
            if (sql == null) {
                return;
            }
            try (Statement statement = connection.createStatement()) {
                statement.execute(sql);
            } catch (final SQLException e) {
                logger.warn("Failed to reset statement timeout, connection may keep a session limit", e);
            }
        }

        private StoreException translate(final SQLException e) {
            if (isAborted()) {
                return new StoreException("Query aborted", e);
            }
            if (e instanceof SQLTimeoutException
                    || QUERY_CANCELED_SQLSTATE.equals(e.getSQLState())
                    || e.getErrorCode() == MYSQL_EXECUTION_TIME_EXCEEDED) {
                return new StoreTimeoutException(statementTimeout, e);
            }
            return new StoreException("SQL query failed: " + e.getMessage(), e);
        }

        @Override
        protected void onAbort() {
            final Statement statement = current;
            if (statement == null) {
                return;
            }
            try {
                statement.cancel();
            } catch (final SQLException e) {
                logger.debug("Cancelling statement failed: {}", e.getMessage());
            }
        }

        @Override
        protected void release() {
            try {
                connection.close();
            } catch (final SQLException e) {
                logger.warn("Failed to close connection", e);
            }
        }
    }
}
