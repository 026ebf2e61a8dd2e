package de.mirkosertic.contactbench.store.jdbc;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Vendor differences the renderer and the store care about: identifier quoting, row windows and
 * the session statement timeout.
 */
public enum SqlDialect {

    POSTGRESQL('"') {
        @Override
        public @Nullable String statementTimeout(final long millis) {
            return "SET statement_timeout = " + millis;
        }

        @Override
        public @Nullable String resetStatementTimeout() {
            return "SET statement_timeout = DEFAULT";
        }
    },
    MYSQL('`') {
        @Override
        public @Nullable String statementTimeout(final long millis) {
            return "SET SESSION max_execution_time = " + millis;
        }

        @Override
        public @Nullable String resetStatementTimeout() {
            return "SET SESSION max_execution_time = DEFAULT";
        }
    },
    GENERIC('"') {
        @Override
        public String window(final long limit, final long offset) {
            return "OFFSET " + offset + " ROWS FETCH NEXT " + limit + " ROWS ONLY";
        }
    };

    private final char quote;

    SqlDialect(final char quote) {
        this.quote = quote;
    }

    public String quote(final String identifier) {
        return quote + identifier + quote;
    }

    public String window(final long limit, final long offset) {
        return "LIMIT " + limit + " OFFSET " + offset;
    }

    /**
     * Session statement that bounds the run time of following statements, or null if the vendor
     * has none and {@link java.sql.Statement#setQueryTimeout(int)} is used instead.
     */
    public @Nullable String statementTimeout(final long millis) {
        return null;
    }

    public @Nullable String resetStatementTimeout() {
        return null;
    }

    public boolean hasSessionTimeout() {
        return statementTimeout(1) != null;
    }

    /**
     * Picks the dialect from {@link java.sql.DatabaseMetaData#getDatabaseProductName()}.
     */
    public static SqlDialect fromProductName(final String productName) {
        final String name = productName.toLowerCase(Locale.ROOT);
        if (name.contains("postgres")) {
            return POSTGRESQL;
        }
        if (name.contains("mysql") || name.contains("mariadb")) {
            return MYSQL;
        }
        return GENERIC;
    }
}
