package de.mirkosertic.contactbench.store.lucene;

import de.mirkosertic.contactbench.plan.FilterClause;
import de.mirkosertic.contactbench.plan.OrderSpec;
import de.mirkosertic.contactbench.plan.QueryPlan;
import de.mirkosertic.contactbench.plan.SearchSpec;
import de.mirkosertic.contactbench.plan.SortDirection;
import de.mirkosertic.contactbench.plan.ValueRange;
import de.mirkosertic.contactbench.schema.FieldPath;
import de.mirkosertic.contactbench.schema.FieldType;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.ConstantScoreQuery;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.WildcardQuery;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates a {@link QueryPlan} into a Lucene query and sort.
 * <p>
 * All clauses are non-scoring filters. Rows without a value for a filtered field never match.
 * Rows without a value for a sort field sort last ascending and first descending.
 */
public class LuceneQueryTranslator {

    public Query toQuery(final QueryPlan plan) {
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        builder.add(new TermQuery(new Term(LuceneFields.ENTITY, plan.entity().parameterName())),
                BooleanClause.Occur.FILTER);
        for (final FilterClause filter : plan.filters()) {
            builder.add(toQuery(filter), BooleanClause.Occur.FILTER);
        }
        if (plan.search() != null) {
            builder.add(toQuery(plan.search()), BooleanClause.Occur.FILTER);
        }
        return new ConstantScoreQuery(builder.build());
    }

    Query toQuery(final FilterClause filter) {
        final String field = filter.path().dotted();
        if (filter.type() == FieldType.STRING) {
            return switch (filter.operator()) {
                case EXACT -> new TermQuery(new Term(field, (String) filter.value()));
                case ICONTAINS -> containsIgnoreCase(filter.path(), (String) filter.value());
                default -> throw new IllegalArgumentException(
                        "Operator " + filter.operator() + " is not supported on string field " + field);
            };
        }
        return switch (filter.operator()) {
            case EXACT -> LongPoint.newExactQuery(field, LuceneFields.toLong(filter.type(), filter.value()));
            case GTE -> LongPoint.newRangeQuery(field, bound(filter, filter.value()), Long.MAX_VALUE);
            case LTE -> LongPoint.newRangeQuery(field, Long.MIN_VALUE, bound(filter, filter.value()));
            case GT -> {
                final long lower = bound(filter, filter.value());
                yield lower == Long.MAX_VALUE
                        ? new MatchNoDocsQuery()
                        : LongPoint.newRangeQuery(field, lower + 1, Long.MAX_VALUE);
            }
            case LT -> {
                final long upper = bound(filter, filter.value());
                yield upper == Long.MIN_VALUE
                        ? new MatchNoDocsQuery()
                        : LongPoint.newRangeQuery(field, Long.MIN_VALUE, upper - 1);
            }
            case RANGE -> {
                final ValueRange range = (ValueRange) filter.value();
                yield LongPoint.newRangeQuery(field, bound(filter, range.lower()), bound(filter, range.upper()));
            }
            case ICONTAINS -> throw new IllegalArgumentException("icontains is not supported on field " + field);
        };
    }

    private static long bound(final FilterClause filter, final Object value) {
        return LuceneFields.toLong(filter.type(), value);
    }

    /**
     * Every term must occur in at least one of the search fields.
     */
    Query toQuery(final SearchSpec search) {
        final BooleanQuery.Builder all = new BooleanQuery.Builder();
        for (final String term : search.terms()) {
            final BooleanQuery.Builder any = new BooleanQuery.Builder();
            for (final FieldPath field : search.fields()) {
                any.add(containsIgnoreCase(field, term), BooleanClause.Occur.SHOULD);
            }
            any.setMinimumNumberShouldMatch(1);
            all.add(any.build(), BooleanClause.Occur.FILTER);
        }
        return all.build();
    }

    private static Query containsIgnoreCase(final FieldPath path, final String value) {
        final String pattern = "*" + escapeWildcard(LuceneFields.lowercase(value)) + "*";
        return new WildcardQuery(new Term(LuceneFields.lowercaseField(path), pattern));
    }

    static String escapeWildcard(final String value) {
        final StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '*' || c == '?' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    public Sort toSort(final OrderSpec order) {
        if (order.isEmpty()) {
            return Sort.INDEXORDER;
        }
        final List<SortField> fields = new ArrayList<>();
        for (final OrderSpec.Term term : order.terms()) {
            final boolean reverse = term.direction() == SortDirection.DESC;
            final SortField sortField;
            if (term.type() == FieldType.STRING) {
                sortField = new SortField(term.path().dotted(), SortField.Type.STRING, reverse);
                sortField.setMissingValue(SortField.STRING_LAST);
            } else {
                sortField = new SortField(term.path().dotted(), SortField.Type.LONG, reverse);
                sortField.setMissingValue(Long.MAX_VALUE);
            }
            fields.add(sortField);
        }
        return new Sort(fields.toArray(new SortField[0]));
    }
}
