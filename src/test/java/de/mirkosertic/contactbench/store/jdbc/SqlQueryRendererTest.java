package de.mirkosertic.contactbench.store.jdbc;

import de.mirkosertic.contactbench.plan.QueryPlan;
import de.mirkosertic.contactbench.plan.QueryPlanBuilder;
import de.mirkosertic.contactbench.schema.ContactSchemaRegistry;
import de.mirkosertic.contactbench.schema.EntityType;
import de.mirkosertic.contactbench.schema.FieldPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SqlQueryRenderer Tests")
class SqlQueryRendererTest {

    private final QueryPlanBuilder planBuilder = new QueryPlanBuilder(ContactSchemaRegistry.INSTANCE);
    private final SqlQueryRenderer postgres = new SqlQueryRenderer(ContactSchemaRegistry.INSTANCE, SqlDialect.POSTGRESQL);

    private static Map<String, String> params(final String... keyValues) {
        final Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put(keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    @Test
    @DisplayName("Should join address and relationship for app users")
    void shouldJoinRelatedTables() throws Exception {
        final RenderedSql sql = postgres.count(planBuilder.build(EntityType.APP_USER, params()));

        assertThat(sql.sql()).isEqualTo("SELECT COUNT(*) FROM appuser u"
                + " LEFT JOIN address a ON a.id = u.address_id"
                + " LEFT JOIN customer_relationship r ON r.appuser_id = u.id");
        assertThat(sql.parameters()).isEmpty();
    }

    @Test
    @DisplayName("Should render filters as bound parameters in order")
    void shouldRenderFilters() throws Exception {
        final QueryPlan plan = planBuilder.build(EntityType.APP_USER, params(
                "gender", "M",
                "relationship__points__gte", "1000",
                "address__country__icontains", "United",
                "created__lt", "2024-06-01"));

        final RenderedSql sql = postgres.count(plan);

        assertThat(sql.sql()).endsWith(" WHERE u.gender = ?"
                + " AND r.points >= ?"
                + " AND UPPER(a.country) LIKE UPPER(?) ESCAPE '!'"
                + " AND u.created < ?");
        assertThat(sql.parameters()).containsExactly("M", 1000L, "%United%", Instant.parse("2024-06-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should render ranges with BETWEEN")
    void shouldRenderRange() throws Exception {
        final RenderedSql sql = postgres.count(planBuilder.build(EntityType.APP_USER,
                params("birthday__range", "1980-01-01,1980-12-31")));

        assertThat(sql.sql()).endsWith(" WHERE u.birthday BETWEEN ? AND ?");
        assertThat(sql.parameters()).containsExactly(LocalDate.of(1980, 1, 1), LocalDate.of(1980, 12, 31));
    }

    @Test
    @DisplayName("Should render search as AND of ORs")
    void shouldRenderSearch() throws Exception {
        final RenderedSql sql = postgres.count(planBuilder.build(EntityType.ADDRESS, params("search", "main berlin")));

        assertThat(sql.sql()).isEqualTo("SELECT COUNT(*) FROM address a WHERE"
                + " (UPPER(a.street) LIKE UPPER(?) ESCAPE '!' OR UPPER(a.city) LIKE UPPER(?) ESCAPE '!'"
                + " OR UPPER(a.country) LIKE UPPER(?) ESCAPE '!')"
                + " AND (UPPER(a.street) LIKE UPPER(?) ESCAPE '!' OR UPPER(a.city) LIKE UPPER(?) ESCAPE '!'"
                + " OR UPPER(a.country) LIKE UPPER(?) ESCAPE '!')");
        assertThat(sql.parameters()).containsExactly("%main%", "%main%", "%main%", "%berlin%", "%berlin%", "%berlin%");
    }

    @Test
    @DisplayName("Should alias columns by dotted path and append ordering and window")
    void shouldRenderSelect() throws Exception {
        final RenderedSql sql = postgres.select(planBuilder.build(EntityType.CUSTOMER_RELATIONSHIP, params(
                "ordering", "-points,id", "page", "3", "page_size", "20")));

        assertThat(sql.sql())
                .startsWith("SELECT r.id AS \"id\", r.points AS \"points\"")
                .contains("u.customer_id AS \"appuser.customer_id\"")
                .contains(" FROM customer_relationship r LEFT JOIN appuser u ON u.id = r.appuser_id")
                .endsWith(" ORDER BY r.points DESC, r.id ASC LIMIT 20 OFFSET 40");
    }

    @Test
    @DisplayName("Should use vendor quoting and windows")
    void shouldUseDialect() throws Exception {
        final QueryPlan plan = planBuilder.build(EntityType.ADDRESS, params("page", "2", "page_size", "10"));

        assertThat(new SqlQueryRenderer(ContactSchemaRegistry.INSTANCE, SqlDialect.MYSQL).select(plan).sql())
                .contains("a.city AS `city`")
                .endsWith("LIMIT 10 OFFSET 10");
        assertThat(new SqlQueryRenderer(ContactSchemaRegistry.INSTANCE, SqlDialect.GENERIC).select(plan).sql())
                .endsWith("ORDER BY a.id ASC OFFSET 10 ROWS FETCH NEXT 10 ROWS ONLY");
    }

    @Test
    @DisplayName("Should omit the window for unpaginated plans")
    void shouldOmitWindow() throws Exception {
        final RenderedSql sql = postgres.select(planBuilder.buildUnpaginated(EntityType.ADDRESS, params()));

        assertThat(sql.sql()).endsWith("ORDER BY a.id ASC").doesNotContain("LIMIT");
    }

    @Test
    @DisplayName("Should escape LIKE wildcards in user input")
    void shouldEscapeLike() throws Exception {
        assertThat(SqlQueryRenderer.escapeLike("50%_off!")).isEqualTo("50!%!_off!!");

        final RenderedSql sql = postgres.count(planBuilder.build(EntityType.APP_USER,
                params("first_name__icontains", "a_b")));
        assertThat(sql.parameters()).containsExactly("%a!_b%");
    }

    @Test
    @DisplayName("Should refuse relations the entity has no join for")
    void shouldRefuseUnknownRelation() {
        assertThatThrownBy(() -> postgres.column(EntityType.ADDRESS, FieldPath.of("relationship.points")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should pick dialects from product names")
    void shouldPickDialect() {
        assertThat(SqlDialect.fromProductName("PostgreSQL")).isEqualTo(SqlDialect.POSTGRESQL);
        assertThat(SqlDialect.fromProductName("MariaDB")).isEqualTo(SqlDialect.MYSQL);
        assertThat(SqlDialect.fromProductName("H2")).isEqualTo(SqlDialect.GENERIC);
        assertThat(SqlDialect.GENERIC.hasSessionTimeout()).isFalse();
        assertThat(SqlDialect.POSTGRESQL.statementTimeout(1500)).isEqualTo("SET statement_timeout = 1500");
    }
}
