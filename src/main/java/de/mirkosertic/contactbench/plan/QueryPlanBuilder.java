package de.mirkosertic.contactbench.plan;

import de.mirkosertic.contactbench.schema.EntityType;
import de.mirkosertic.contactbench.schema.FieldDescriptor;
import de.mirkosertic.contactbench.schema.FieldPath;
import de.mirkosertic.contactbench.schema.InvalidQueryException;
import de.mirkosertic.contactbench.schema.Operator;
import de.mirkosertic.contactbench.schema.SchemaRegistry;
import de.mirkosertic.contactbench.schema.UnknownFieldException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Compiles raw request parameters into a {@link QueryPlan}.
 * <p>
 * Parameters are processed in iteration order of the supplied map and the first problem aborts
 * the build, so no partial plan is ever returned. The builder holds no per-call state and can be
 * shared between threads.
 */
public class QueryPlanBuilder {

    private static final Logger logger = LoggerFactory.getLogger(QueryPlanBuilder.class);

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int DEFAULT_MAX_PAGE_SIZE = 1000;

    private final SchemaRegistry schema;
    private final int defaultPageSize;
    private final int maxPageSize;

    public QueryPlanBuilder(final SchemaRegistry schema) {
        this(schema, DEFAULT_PAGE_SIZE, DEFAULT_MAX_PAGE_SIZE);
    }

    public QueryPlanBuilder(final SchemaRegistry schema, final int defaultPageSize, final int maxPageSize) {
        if (maxPageSize < 1 || defaultPageSize < 1) {
            throw new IllegalArgumentException("Page sizes must be positive");
        }
        this.schema = schema;
        this.maxPageSize = maxPageSize;
        this.defaultPageSize = Math.min(defaultPageSize, maxPageSize);
    }

    public int maxPageSize() {
        return maxPageSize;
    }

    /**
     * Builds a paginated plan.
     *
     * @throws UnknownFieldException if a filter or ordering names a field the entity does not expose
     * @throws ValidationException   if an operator is not allowed or a value is malformed
     */
    public QueryPlan build(final EntityType entity, final Map<String, String> params) throws InvalidQueryException {
        return compile(entity, params, true);
    }

    /**
     * Builds a plan that returns every matching row. Pagination parameters are ignored.
     */
    public QueryPlan buildUnpaginated(final EntityType entity, final Map<String, String> params)
            throws InvalidQueryException {
        return compile(entity, params, false);
    }

    private QueryPlan compile(final EntityType entity, final Map<String, String> params, final boolean paginated)
            throws InvalidQueryException {
        final List<FilterClause> filters = new ArrayList<>();
        for (final Map.Entry<String, String> entry : params.entrySet()) {
            if (QueryParameters.isReserved(entry.getKey())) {
                continue;
            }
            final FilterClause clause = parseFilter(entity, entry.getKey(), entry.getValue());
            if (clause != null) {
                filters.add(clause);
            }
        }

        final String ordering = params.get(QueryParameters.ORDERING);
        final OrderSpec order = parseOrdering(entity,
                ordering == null || ordering.isBlank() ? schema.defaultOrdering(entity) : ordering);

        final SearchSpec search = parseSearch(entity, params.get(QueryParameters.SEARCH));

        final Pagination pagination = paginated ? parsePagination(params) : Pagination.unpaginated();

        final QueryPlan plan = new QueryPlan(entity, filters, order, search, pagination);
        logger.debug("Compiled plan for {}: {} filters, ordering '{}', search {}, {}", entity.parameterName(),
                filters.size(), order.toParameter(), search != null ? search.terms() : "none", pagination);
        return plan;
    }

    private @Nullable FilterClause parseFilter(final EntityType entity, final String key, final @Nullable String raw)
            throws InvalidQueryException {
        final List<String> segments = new ArrayList<>(Arrays.asList(key.split(QueryParameters.LOOKUP_SEPARATOR, -1)));
        Operator operator = Operator.EXACT;
        if (segments.size() > 1) {
            final Operator suffix = Operator.fromSuffix(segments.get(segments.size() - 1));
            if (suffix != null) {
                operator = suffix;
                segments.remove(segments.size() - 1);
            }
        }

        final FieldPath path = toPath(entity, segments, key, "filterable");
        final FieldDescriptor field = schema.filterableField(entity, path);
        if (!field.supports(operator)) {
            throw new ValidationException(path.dotted(),
                    "Operator '" + operator.suffix() + "' is not supported, allowed: " + suffixes(field));
        }

        if (raw == null || raw.isBlank()) {
            return null;
        }

        if (operator == Operator.RANGE) {
            final String[] bounds = raw.split(",", -1);
            if (bounds.length != 2 || bounds[0].isBlank() || bounds[1].isBlank()) {
                throw new ValidationException(path.dotted(), "A range needs two values 'lower,upper', got '" + raw + "'");
            }
            final ValueRange range = new ValueRange(FieldValues.coerce(field, bounds[0]),
                    FieldValues.coerce(field, bounds[1]));
            return new FilterClause(path, field.type(), operator, range);
        }
        if (operator == Operator.ICONTAINS) {
            return new FilterClause(path, field.type(), operator, raw.trim());
        }
        return new FilterClause(path, field.type(), operator, FieldValues.coerce(field, raw));
    }

    private OrderSpec parseOrdering(final EntityType entity, final String ordering) throws InvalidQueryException {
        final List<OrderSpec.Term> terms = new ArrayList<>();
        for (final String token : ordering.split(",")) {
            String name = token.trim();
            if (name.isEmpty()) {
                continue;
            }
            SortDirection direction = SortDirection.ASC;
            if (name.startsWith("-")) {
                direction = SortDirection.DESC;
                name = name.substring(1);
            }
            final FieldPath path = toPath(entity, List.of(name.replace(QueryParameters.LOOKUP_SEPARATOR, ".")),
                    name, "orderable");
            final FieldDescriptor field = schema.orderableField(entity, path);
            terms.add(new OrderSpec.Term(path, field.type(), direction));
        }
        return new OrderSpec(terms);
    }

    private @Nullable SearchSpec parseSearch(final EntityType entity, final @Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        final List<String> terms = Arrays.stream(raw.trim().split("[\\s,]+"))
                .filter(term -> !term.isEmpty())
                .toList();
        if (terms.isEmpty()) {
            return null;
        }
        return new SearchSpec(terms, schema.searchableFields(entity));
    }

    private Pagination parsePagination(final Map<String, String> params) throws ValidationException {
        final String limitValue = params.get(QueryParameters.LIMIT);
        if (limitValue != null && !limitValue.isBlank()) {
            final long limit = clamp(parseNumber(QueryParameters.LIMIT, limitValue), 1, maxPageSize);
            final long offset = Math.max(0, parseNumber(QueryParameters.OFFSET,
                    params.getOrDefault(QueryParameters.OFFSET, "0")));
            return new Pagination(offset, (int) limit);
        }
        final long requestedPage = Math.max(1,
                parseNumber(QueryParameters.PAGE, params.getOrDefault(QueryParameters.PAGE, "1")));
        final long pageSize = clamp(parseNumber(QueryParameters.PAGE_SIZE,
                params.getOrDefault(QueryParameters.PAGE_SIZE, Integer.toString(defaultPageSize))), 1, maxPageSize);
        // Pages beyond the addressable range saturate at the largest representable offset
        final long page = Math.min(requestedPage, Long.MAX_VALUE / pageSize);
        return new Pagination((page - 1) * pageSize, (int) pageSize);
    }

    private static long parseNumber(final String name, final @Nullable String value) throws ValidationException {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name, "A number is required");
        }
        try {
            return Long.parseLong(value.trim());
        } catch (final NumberFormatException e) {
            throw new ValidationException(name, "Enter a whole number, got '" + value + "'");
        }
    }

    private static long clamp(final long value, final long min, final long max) {
        return Math.max(min, Math.min(max, value));
    }

    private static FieldPath toPath(final EntityType entity, final List<String> segments, final String raw,
                                    final String capability) throws UnknownFieldException {
        try {
            return FieldPath.ofSegments(segments);
        } catch (final IllegalArgumentException e) {
            throw new UnknownFieldException(entity, raw, capability);
        }
    }

    private static String suffixes(final FieldDescriptor field) {
        return field.operators().stream()
                .sorted()
                .map(Operator::suffix)
                .toList()
                .toString();
    }
}
