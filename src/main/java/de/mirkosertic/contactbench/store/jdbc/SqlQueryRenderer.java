package de.mirkosertic.contactbench.store.jdbc;

import de.mirkosertic.contactbench.plan.FilterClause;
import de.mirkosertic.contactbench.plan.OrderSpec;
import de.mirkosertic.contactbench.plan.Pagination;
import de.mirkosertic.contactbench.plan.QueryPlan;
import de.mirkosertic.contactbench.plan.SearchSpec;
import de.mirkosertic.contactbench.plan.SortDirection;
import de.mirkosertic.contactbench.plan.ValueRange;
import de.mirkosertic.contactbench.schema.EntityType;
import de.mirkosertic.contactbench.schema.FieldDescriptor;
import de.mirkosertic.contactbench.schema.FieldPath;
import de.mirkosertic.contactbench.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a {@link QueryPlan} as parameterized SQL.
 * <p>
 * Related entities are reached through LEFT JOINs, so rows without an address or relationship are
 * kept and simply fail filters on those fields. Case-insensitive matching uses
 * {@code UPPER(column) LIKE UPPER(?)} with {@code !} as escape character. Every value travels as a
 * bound parameter; only validated field paths and numbers are inlined.
 */
public class SqlQueryRenderer {

    private static final char LIKE_ESCAPE = '!';

    private record Join(String table, String alias, String condition) {
    }

    private static final Map<EntityType, String> BASE_ALIAS = Map.of(
            EntityType.APP_USER, "u",
            EntityType.ADDRESS, "a",
            EntityType.CUSTOMER_RELATIONSHIP, "r");

    private static final Map<EntityType, Map<String, Join>> JOINS = Map.of(
            EntityType.APP_USER, Map.of(
                    "address", new Join("address", "a", "a.id = u.address_id"),
                    "relationship", new Join("customer_relationship", "r", "r.appuser_id = u.id")),
            EntityType.ADDRESS, Map.of(),
            EntityType.CUSTOMER_RELATIONSHIP, Map.of(
                    "appuser", new Join("appuser", "u", "u.id = r.appuser_id")));

    private final SchemaRegistry schema;
    private final SqlDialect dialect;

    public SqlQueryRenderer(final SchemaRegistry schema, final SqlDialect dialect) {
        this.schema = schema;
        this.dialect = dialect;
    }

    /**
     * Selects every declared field, each aliased as its dotted path.
     */
    public RenderedSql select(final QueryPlan plan) {
        final StringJoiner columns = new StringJoiner(", ");
        for (final FieldDescriptor field : schema.entity(plan.entity()).fields()) {
            columns.add(column(plan.entity(), field.path()) + " AS " + dialect.quote(field.path().dotted()));
        }

        final List<Object> parameters = new ArrayList<>();
        final StringBuilder sql = new StringBuilder("SELECT ").append(columns).append(from(plan.entity()));
        appendWhere(sql, parameters, plan);
        appendOrderBy(sql, plan);

        final Pagination pagination = plan.pagination();
        if (pagination.isPaginated()) {
            sql.append(' ').append(dialect.window(pagination.limit(), pagination.offset()));
        }
        return new RenderedSql(sql.toString(), parameters);
    }

    public RenderedSql count(final QueryPlan plan) {
        final List<Object> parameters = new ArrayList<>();
        final StringBuilder sql = new StringBuilder("SELECT COUNT(*)").append(from(plan.entity()));
        appendWhere(sql, parameters, plan);
        return new RenderedSql(sql.toString(), parameters);
    }

    private String from(final EntityType entity) {
        final StringBuilder from = new StringBuilder(" FROM ")
                .append(entity.tableName()).append(' ').append(BASE_ALIAS.get(entity));
        JOINS.get(entity).values().stream()
                .sorted((left, right) -> left.alias().compareTo(right.alias()))
                .forEach(join -> from.append(" LEFT JOIN ").append(join.table()).append(' ').append(join.alias())
                        .append(" ON ").append(join.condition()));
        return from.toString();
    }

    String column(final EntityType entity, final FieldPath path) {
        final String relation = path.relation();
        if (relation.isEmpty()) {
            return BASE_ALIAS.get(entity) + "." + path.leaf();
        }
        final Join join = JOINS.get(entity).get(relation);
        if (join == null) {
            throw new IllegalArgumentException("No join for relation '" + relation + "' of " + entity);
        }
        return join.alias() + "." + path.leaf();
    }

    private void appendWhere(final StringBuilder sql, final List<Object> parameters, final QueryPlan plan) {
        final List<String> conditions = new ArrayList<>();
        for (final FilterClause filter : plan.filters()) {
            conditions.add(condition(plan.entity(), filter, parameters));
        }
        if (plan.search() != null) {
            conditions.add(search(plan.entity(), plan.search(), parameters));
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
    }

    private String condition(final EntityType entity, final FilterClause filter, final List<Object> parameters) {
        final String column = column(entity, filter.path());
        return switch (filter.operator()) {
            case ICONTAINS -> containsIgnoreCase(column, (String) filter.value(), parameters);
            case RANGE -> {
                final ValueRange range = (ValueRange) filter.value();
                parameters.add(range.lower());
                parameters.add(range.upper());
                yield column + " BETWEEN ? AND ?";
            }
            default -> {
                parameters.add(filter.value());
                yield column + " " + comparator(filter) + " ?";
            }
        };
    }

    private static String comparator(final FilterClause filter) {
        return switch (filter.operator()) {
            case EXACT -> "=";
            case GTE -> ">=";
            case LTE -> "<=";
            case GT -> ">";
            case LT -> "<";
            default -> throw new IllegalArgumentException("No comparator for " + filter.operator());
        };
    }

    private String search(final EntityType entity, final SearchSpec search, final List<Object> parameters) {
        final List<String> perTerm = new ArrayList<>();
        for (final String term : search.terms()) {
            final StringJoiner any = new StringJoiner(" OR ", "(", ")");
            for (final FieldPath field : search.fields()) {
                any.add(containsIgnoreCase(column(entity, field), term, parameters));
            }
            perTerm.add(any.toString());
        }
        return String.join(" AND ", perTerm);
    }

    private static String containsIgnoreCase(final String column, final String value, final List<Object> parameters) {
        parameters.add("%" + escapeLike(value) + "%");
        return "UPPER(" + column + ") LIKE UPPER(?) ESCAPE '" + LIKE_ESCAPE + "'";
    }

    static String escapeLike(final String value) {
        final StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private void appendOrderBy(final StringBuilder sql, final QueryPlan plan) {
        final OrderSpec order = plan.order();
        if (order.isEmpty()) {
            return;
        }
        final StringJoiner terms = new StringJoiner(", ", " ORDER BY ", "");
        for (final OrderSpec.Term term : order.terms()) {
            terms.add(column(plan.entity(), term.path()) + (term.direction() == SortDirection.DESC ? " DESC" : " ASC"));
        }
        sql.append(terms);
    }
}
