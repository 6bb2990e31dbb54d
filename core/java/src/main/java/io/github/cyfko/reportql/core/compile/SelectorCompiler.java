package io.github.cyfko.reportql.core.compile;

import io.github.cyfko.reportql.core.api.Column;
import io.github.cyfko.reportql.core.api.SegmentScope;
import io.github.cyfko.reportql.core.api.Selector;
import io.github.cyfko.reportql.core.exception.QueryValidationException;
import io.github.cyfko.reportql.core.spi.ColumnRegistry;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Compiles keyword selections into filter and segment expressions.
 *
 * <h2>Grammar</h2>
 * <pre>
 * selection   := { key → value | [value, ...] }
 * key         := column [ "__" selector ]          selector defaults to "eq"
 * expression  := column-id selector-symbol escaped-value
 * segment     := scope "::condition" [ "::" metric-scope ] "::" expression
 * group       := expression { "," expression }      OR within a group
 * wire-string := group { ";" group }                AND between groups
 * </pre>
 *
 * <p>
 * Every value under a key compiles to its own expression; callers put the expressions of
 * one selection into the same group so that they are OR-ed together, e.g.
 * {@code {"source": ["cpc", "cpm"]}} yields {@code ga:source==cpc,ga:source==cpm}.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * SelectorCompiler compiler = new SelectorCompiler(registry);
 * compiler.compile(Map.of("sessions__gt", 10));
 * // ["ga:sessions>10"]
 * compiler.compileSegment(SegmentScope.USERS, SegmentScope.USERS, Map.of("sessions__gt", 10));
 * // ["users::condition::perUser::ga:sessions>10"]
 * SelectorCompiler.join(List.of(List.of("a==1", "b==2"), List.of("c==3")));
 * // "a==1,b==2;c==3"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SelectorCompiler {

    public static final String SELECTOR_SEPARATOR = "__";
    public static final String SEGMENT_SEPARATOR = "::";
    public static final String OR = ",";
    public static final String AND = ";";

    private static final String CONDITION = "condition";

    private final ColumnRegistry columns;

    public SelectorCompiler(ColumnRegistry columns) {
        this.columns = Objects.requireNonNull(columns, "Column registry cannot be null");
    }

    /**
     * Compiles a keyword selection into one expression per {@code (column, selector, value)}.
     *
     * @param selection keys of the form {@code column} or {@code column__selector}, mapped to
     *                  a single value, a collection or an array of values
     * @return compiled expressions, in selection order
     * @throws QueryValidationException on an unknown selector, an unknown column or a null value
     */
    public List<String> compile(Map<String, ?> selection) {
        Objects.requireNonNull(selection, "Selection cannot be null");
        List<String> expressions = new ArrayList<>();

        for (Map.Entry<String, ?> entry : selection.entrySet()) {
            String key = entry.getKey();
            String columnKey = key;
            String selectorCode = Selector.EQ.getCode();

            int separator = key.indexOf(SELECTOR_SEPARATOR);
            if (separator >= 0) {
                columnKey = key.substring(0, separator);
                selectorCode = key.substring(separator + SELECTOR_SEPARATOR.length());
            }

            // selector first so that typos in it are reported before unknown columns
            Selector selector = Selector.fromString(selectorCode);
            Column column = columns.get(columnKey);

            for (Object value : values(key, entry.getValue())) {
                expressions.add(column.select(selector, value));
            }
        }

        return expressions;
    }

    /**
     * Compiles a keyword selection into segment conditions.
     *
     * @param scope       {@link SegmentScope#USERS} or {@link SegmentScope#SESSIONS}
     * @param metricScope optional metric qualifier, {@code null} to omit it
     * @param selection   keyword selection, as for {@link #compile(Map)}
     * @return one segment expression per compiled condition
     * @throws QueryValidationException if the scope is missing or cannot open a segment
     */
    public List<String> compileSegment(SegmentScope scope, SegmentScope metricScope, Map<String, ?> selection) {
        if (scope == null || !scope.isPrimary()) {
            throw new QueryValidationException("Scope is required. Choose from: users, sessions.");
        }

        String qualifier = metricScope == null ? null : metricScope.getMetricScope();
        return compile(selection).stream()
                .map(condition -> segment(scope.getWireName(), CONDITION, qualifier, condition))
                .collect(Collectors.toList());
    }

    /**
     * Joins condition groups into a wire string: expressions inside a group are separated
     * by {@value #OR}, groups by {@value #AND}.
     *
     * @param groups condition groups, in the order they were added
     * @return the wire string, empty when there are no groups
     */
    public static String join(List<List<String>> groups) {
        return groups.stream()
                .map(group -> String.join(OR, group))
                .collect(Collectors.joining(AND));
    }

    private static String segment(String... parts) {
        return Arrays.stream(parts)
                .filter(part -> part != null && !part.isEmpty())
                .collect(Collectors.joining(SEGMENT_SEPARATOR));
    }

    private static List<Object> values(String key, Object value) {
        List<Object> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            values.addAll(collection);
        } else if (value instanceof Object[] array) {
            values.addAll(Arrays.asList(array));
        } else {
            values.add(value);
        }

        if (values.isEmpty() || values.contains(null)) {
            throw new QueryValidationException("Selection [" + key + "] requires at least one non-null value.");
        }
        return values;
    }
}
