package io.github.cyfko.reportql.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.reportql.core.ReportingContext;
import io.github.cyfko.reportql.core.api.Column;
import io.github.cyfko.reportql.core.cache.QuerySignature;
import io.github.cyfko.reportql.core.compile.SelectorCompiler;
import io.github.cyfko.reportql.core.exception.ColumnNotFoundException;
import io.github.cyfko.reportql.core.exception.InvalidRequestException;
import io.github.cyfko.reportql.core.exception.QueryValidationException;
import io.github.cyfko.reportql.core.exception.ReportingServiceException;
import io.github.cyfko.reportql.core.report.Report;
import io.github.cyfko.reportql.core.report.ReportView;
import io.github.cyfko.reportql.core.report.ResponsePage;
import io.github.cyfko.reportql.core.report.Row;
import io.github.cyfko.reportql.core.spi.ReportCache;
import io.github.cyfko.reportql.core.spi.ReportingApi;

import java.time.temporal.TemporalAccessor;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Immutable description of a report request.
 * <p>
 * A query holds the wire parameters that will be sent to the reporting service
 * ({@code ids}, {@code metrics}, {@code dimensions}, {@code filters}, {@code sort}...) and the
 * {@link QueryOptions} that are only used on the client side. Every builder method returns a
 * <strong>new</strong> query built from a deep copy of the receiver's state; the receiver is
 * never modified, so a base query can be shared and refined independently:
 * </p>
 *
 * <pre>{@code
 * CoreQuery base = context.query("pageviews");
 * Report january  = base.daily("2020-01-01", Period.ofMonths(1)).get();
 * Report february = base.daily("2020-02-01", Period.ofMonths(1)).get();
 * }</pre>
 *
 * <h2>Column arguments</h2>
 * <p>
 * Wherever a column is expected, either a {@link Column} or a {@link String} can be given.
 * Strings are resolved case-insensitively through the context's
 * {@link io.github.cyfko.reportql.core.spi.ColumnRegistry} by id, name or slug; columns are
 * used as they are.
 * </p>
 *
 * <h2>Report access</h2>
 * <p>
 * A query is also a {@link ReportView}: {@link #rows()}, {@link #value()}, {@link #values()},
 * {@link #first()} and {@link #last()} run the query on first use and delegate to the
 * resulting report, which is kept for later calls.
 * </p>
 *
 * @param <Q> concrete query type returned by the builder methods
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class Query<Q extends Query<Q>> implements ReportView {

    private static final Logger log = Logger.getLogger(Query.class.getName());

    public static final String IDS = "ids";
    public static final String METRICS = "metrics";
    public static final String DIMENSIONS = "dimensions";
    public static final String FILTERS = "filters";
    public static final String SEGMENT = "segment";
    public static final String SORT = "sort";
    public static final String START_DATE = "start_date";
    public static final String END_DATE = "end_date";
    public static final String START_INDEX = "start_index";
    public static final String MAX_RESULTS = "max_results";
    public static final String SAMPLING_LEVEL = "samplingLevel";

    private final ReportingContext context;
    private final Map<String, Object> parameters;
    private final QueryOptions options;

    private volatile Report report;

    /**
     * Creates an empty query for the context's profile.
     *
     * @param context reporting context
     */
    protected Query(ReportingContext context) {
        this(context, initialParameters(context), QueryOptions.empty());
    }

    protected Query(ReportingContext context, Map<String, Object> parameters, QueryOptions options) {
        this.context = Objects.requireNonNull(context, "Reporting context cannot be null");
        this.parameters = freeze(Objects.requireNonNull(parameters, "parameters"));
        this.options = options == null ? QueryOptions.empty() : options;
    }

    /**
     * Creates a query of the same type holding the given state.
     *
     * @param context    reporting context
     * @param parameters wire parameters
     * @param options    client-side options
     * @return the new query
     */
    protected abstract Q newInstance(ReportingContext context, Map<String, Object> parameters, QueryOptions options);

    /**
     * @return the reporting API this query targets
     */
    public abstract ReportingApi api();

    /**
     * Runs the query and returns the full report.
     *
     * @return the report
     */
    public abstract Report get();

    // ---------------------------------------------------------------- builder

    /**
     * Returns a new query with additional metrics.
     *
     * @param metrics columns or column keys
     * @return the new query
     * @throws ColumnNotFoundException if a key is unknown
     */
    public Q metrics(Object... metrics) {
        List<String> ids = resolve(Arrays.asList(metrics));
        return derive(draft -> draft.list(METRICS).addAll(ids));
    }

    /**
     * Returns a new query with additional dimensions.
     *
     * @param dimensions columns or column keys
     * @return the new query
     * @throws ColumnNotFoundException if a key is unknown
     */
    public Q dimensions(Object... dimensions) {
        List<String> ids = resolve(Arrays.asList(dimensions));
        return derive(draft -> draft.list(DIMENSIONS).addAll(ids));
    }

    /**
     * Returns a new query with additional metrics and dimensions.
     *
     * @param metrics    columns or column keys, may be {@code null}
     * @param dimensions columns or column keys, may be {@code null}
     * @return the new query
     */
    public Q query(List<?> metrics, List<?> dimensions) {
        List<String> metricIds = resolve(metrics == null ? List.of() : metrics);
        List<String> dimensionIds = resolve(dimensions == null ? List.of() : dimensions);
        return derive(draft -> {
            draft.list(METRICS).addAll(metricIds);
            draft.list(DIMENSIONS).addAll(dimensionIds);
        });
    }

    /**
     * Returns a new query sorted by additional columns.
     * <p>
     * A {@link String} starting with {@code -} sorts descending, a {@link Column} sorts
     * ascending and a {@link SortBy} carries its own direction.
     * </p>
     *
     * <pre>{@code
     * query.sort("pageviews", "-device type");
     * query.sort(SortBy.desc(pageviews));
     * }</pre>
     *
     * @param columns sort targets
     * @return the new query
     * @throws QueryValidationException if a target is of another type
     */
    public Q sort(Object... columns) {
        return sort(Arrays.asList(columns), false);
    }

    /**
     * Returns a new query sorted by additional columns, all descending when
     * {@code descending} is set.
     *
     * @param columns    sort targets
     * @param descending forces a descending sort
     * @return the new query
     */
    public Q sort(List<?> columns, boolean descending) {
        List<String> sorts = new ArrayList<>();
        for (Object target : columns) {
            boolean desc = descending;
            Column column;
            if (target instanceof String key) {
                desc = desc || key.startsWith("-");
                column = context.columns().get(key.replaceFirst("^-+", ""));
            } else if (target instanceof Column resolved) {
                column = resolved;
            } else if (target instanceof SortBy sortBy) {
                desc = desc || sortBy.descending();
                column = context.columns().resolve(sortBy.column());
            } else {
                throw new QueryValidationException("Can only sort on columns or column strings. Received: " + target);
            }
            sorts.add((desc ? "-" : "") + column.id());
        }

        return derive(draft -> {
            draft.sort.addAll(sorts);
            draft.parameters.put(SORT, String.join(",", draft.sort));
        });
    }

    /**
     * Returns a new query with an additional raw filter expression.
     *
     * <pre>{@code
     * query.filter("ga:browser==Chrome,ga:browser==Firefox");
     * }</pre>
     *
     * @param value precompiled filter expression
     * @return the new query
     */
    public Q filter(String value) {
        return filter(value, null);
    }

    /**
     * Returns a new query with an additional keyword filter selection. Values of one key
     * are ORed, keys are ORed with each other inside the group, and groups are ANDed.
     *
     * <pre>{@code
     * query.filter(Map.of("sessions__gt", 10));            // ga:sessions>10
     * query.filter(Map.of("browser", List.of("Chrome", "Firefox")));
     * }</pre>
     *
     * @param selection keyword selection
     * @return the new query
     */
    public Q filter(Map<String, ?> selection) {
        return filter(null, selection);
    }

    /**
     * @param value     precompiled filter expression, may be {@code null}
     * @param selection keyword selection, may be {@code null}
     * @return the new query
     * @throws QueryValidationException if both or neither are given
     */
    public Q filter(String value, Map<String, ?> selection) {
        List<String> group = conditions(value, selection, () -> context.compiler().compile(selection), "filter");
        return derive(draft -> {
            draft.filters.add(group);
            draft.parameters.put(FILTERS, SelectorCompiler.join(draft.filters));
        });
    }

    /**
     * Returns a new query with a raw wire property, for request features that have no
     * builder method. {@link Column} values are sent as their id, dates and times in their
     * ISO form. Metrics and dimensions can only be changed through {@link #metrics} and
     * {@link #dimensions}.
     *
     * @param key   wire key
     * @param value wire value
     * @return the new query
     * @throws QueryValidationException if the key or the value is missing, or if the key is
     *                                  {@code metrics} or {@code dimensions}
     */
    public Q set(String key, Object value) {
        if (key == null || key.isBlank() || value == null) {
            throw new QueryValidationException(
                    "Query#set requires a key and value, or a properties map.");
        }
        requireRawKey(key);
        Object serialized = serialize(value);
        return derive(draft -> draft.parameters.put(key, serialized));
    }

    /**
     * @param properties wire properties
     * @return the new query
     * @see #set(String, Object)
     */
    public Q set(Map<String, ?> properties) {
        if (properties == null || properties.isEmpty()) {
            throw new QueryValidationException(
                    "Query#set requires a key and value, or a properties map.");
        }
        Map<String, Object> serialized = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            requireRawKey(key);
            serialized.put(key, serialize(value));
        });
        return derive(draft -> draft.parameters.putAll(serialized));
    }

    /**
     * @param title human readable title of the report
     * @return the new query
     */
    public Q title(String title) {
        return derive(draft -> draft.title = title);
    }

    // ---------------------------------------------------------------- state

    public ReportingContext context() {
        return context;
    }

    /**
     * @return the wire parameters as held by the builder, metrics and dimensions as lists
     */
    public Map<String, Object> parameters() {
        return parameters;
    }

    public QueryOptions options() {
        return options;
    }

    @SuppressWarnings("unchecked")
    public List<String> metricIds() {
        return (List<String>) parameters.getOrDefault(METRICS, List.of());
    }

    @SuppressWarnings("unchecked")
    public List<String> dimensionIds() {
        return (List<String>) parameters.getOrDefault(DIMENSIONS, List.of());
    }

    /**
     * @return the user supplied title, or the {@linkplain #description() description}
     */
    public String title() {
        return options.title() != null ? options.title() : description();
    }

    /**
     * @return the metric ids in prose, e.g. {@code "ga:sessions, ga:users and ga:pageviews"};
     * {@code "n/a"} when there are none
     */
    public String description() {
        List<String> metrics = metricIds();
        if (metrics.isEmpty()) {
            return "n/a";
        }
        if (metrics.size() == 1) {
            return metrics.get(0);
        }
        return String.join(", ", metrics.subList(0, metrics.size() - 1)) + " and " + metrics.get(metrics.size() - 1);
    }

    /**
     * Wire parameters as sent to the reporting service: metrics comma-joined, dimensions
     * comma-joined or {@code null} when there are none.
     *
     * @return a fresh, modifiable map
     */
    public Map<String, Object> build() {
        Map<String, Object> wire = new LinkedHashMap<>(parameters);
        wire.put(METRICS, String.join(",", metricIds()));
        List<String> dimensions = dimensionIds();
        wire.put(DIMENSIONS, dimensions.isEmpty() ? null : String.join(",", dimensions));
        return wire;
    }

    /**
     * @return the cache key of this query
     * @see QuerySignature
     */
    public String signature() {
        return QuerySignature.of(build());
    }

    /**
     * A query is cacheable when both ends of its date range are absolute dates; relative
     * ranges such as {@code 7daysAgo} yield different results over time.
     *
     * @return {@code true} if the response may be served from a cache
     */
    public boolean cacheable() {
        Object start = parameters.get(START_DATE);
        Object end = parameters.get(END_DATE);
        return start != null && end != null
                && !DateRanges.isRelative(start.toString())
                && !DateRanges.isRelative(end.toString());
    }

    // ---------------------------------------------------------------- execution

    /**
     * Fetches a single response page, from the cache when possible.
     *
     * @return the page
     * @throws InvalidRequestException   if the endpoint rejects the parameters
     * @throws ReportingServiceException if the service answers with an error
     */
    public ResponsePage fetch() {
        Map<String, Object> wire = build();
        Optional<ReportCache> cache = context.cache().filter(c -> cacheable());

        JsonNode response = null;
        if (cache.isPresent()) {
            String signature = signature();
            if (cache.get().exists(signature)) {
                response = cache.get().get(this);
                log.fine(() -> "Serving report request from cache: " + signature);
            }
        }

        if (response == null) {
            response = context.dispatcher().dispatch(api(), wire);
            if (cache.isPresent()) {
                cache.get().set(this, response);
            }
        }

        return ResponsePage.from(response);
    }

    /**
     * Runs the query once, without following further pages.
     *
     * @return a report holding a single page
     */
    public Report execute() {
        return Report.of(fetch(), this);
    }

    /**
     * @return the report of this query, run on first access
     */
    public Report report() {
        Report result = report;
        if (result == null) {
            synchronized (this) {
                result = report;
                if (result == null) {
                    result = get();
                    report = result;
                }
            }
        }
        return result;
    }

    @Override
    public List<Row> rows() {
        return report().rows();
    }

    @Override
    public Object value() {
        return report().value();
    }

    @Override
    public List<Object> values() {
        return report().values();
    }

    @Override
    public Row first() {
        return report().first();
    }

    @Override
    public Row last() {
        return report().last();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + build();
    }

    // ---------------------------------------------------------------- internals

    /**
     * Applies a change to a deep copy of this query's state.
     *
     * @param change mutation of the draft
     * @return the query holding the changed state
     */
    protected final Q derive(Consumer<Draft> change) {
        Draft draft = new Draft(parameters, options);
        change.accept(draft);
        return newInstance(context, draft.parameters, draft.toOptions());
    }

    protected List<String> resolve(List<?> columns) {
        return columns.stream()
                .map(column -> context.columns().resolve(column).id())
                .collect(Collectors.toList());
    }

    /**
     * Turns the arguments of {@code filter} or {@code segment} into one condition group.
     */
    static List<String> conditions(String value, Map<String, ?> selection,
                                   Supplier<List<String>> compiled, String method) {
        boolean hasValue = value != null && !value.isBlank();
        boolean hasSelection = selection != null && !selection.isEmpty();

        if (hasValue && hasSelection) {
            throw new QueryValidationException(
                    "Cannot specify a " + method + " string and a " + method + " keyword selection at the same time.");
        }
        if (hasValue) {
            return List.of(value);
        }
        if (hasSelection) {
            return compiled.get();
        }
        throw new QueryValidationException("Query#" + method + " requires a " + method + " string or a keyword selection.");
    }

    private static void requireRawKey(String key) {
        if (METRICS.equals(key) || DIMENSIONS.equals(key)) {
            throw new QueryValidationException(
                    "Query#set cannot change " + key + ". Use Query#" + key + " instead.");
        }
    }

    private static Object serialize(Object value) {
        if (value instanceof Column column) {
            return column.id();
        }
        if (value instanceof TemporalAccessor temporal) {
            return temporal.toString();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(Query::serialize).collect(Collectors.toList());
        }
        return value;
    }

    private static Map<String, Object> initialParameters(ReportingContext context) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        String profileId = context.profileId();
        parameters.put(IDS, profileId.startsWith("ga:") ? profileId : "ga:" + profileId);
        parameters.put(METRICS, List.of());
        parameters.put(DIMENSIONS, List.of());
        return parameters;
    }

    private static Map<String, Object> freeze(Map<String, Object> parameters) {
        Map<String, Object> frozen = new LinkedHashMap<>();
        parameters.forEach((key, value) -> frozen.put(key, value instanceof List<?> list
                ? Collections.unmodifiableList(new ArrayList<>(list))
                : value));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Mutable working copy of a query's state, only reachable through {@link #derive(Consumer)}.
     */
    protected static final class Draft {

        final Map<String, Object> parameters = new LinkedHashMap<>();
        final List<String> sort;
        final List<List<String>> filters = new ArrayList<>();
        final List<List<String>> segments = new ArrayList<>();
        Integer limit;
        String title;

        private Draft(Map<String, Object> parameters, QueryOptions options) {
            parameters.forEach((key, value) -> this.parameters.put(key, value instanceof List<?> list
                    ? new ArrayList<>(list)
                    : value));
            this.sort = new ArrayList<>(options.sort());
            options.filters().forEach(group -> filters.add(new ArrayList<>(group)));
            options.segments().forEach(group -> segments.add(new ArrayList<>(group)));
            this.limit = options.limit();
            this.title = options.title();
        }

        /**
         * @param key wire key holding a list
         * @return the modifiable list, created when absent
         */
        @SuppressWarnings("unchecked")
        List<String> list(String key) {
            return (List<String>) parameters.computeIfAbsent(key, k -> new ArrayList<String>());
        }

        private QueryOptions toOptions() {
            return new QueryOptions(sort, filters, segments, limit, title);
        }
    }
}
