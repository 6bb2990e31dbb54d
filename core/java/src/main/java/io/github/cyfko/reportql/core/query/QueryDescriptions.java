package io.github.cyfko.reportql.core.query;

import io.github.cyfko.reportql.core.ReportingContext;
import io.github.cyfko.reportql.core.exception.QueryValidationException;

import java.util.*;

/**
 * Builds queries from plain descriptions instead of method chains, typically loaded from a
 * configuration file.
 * <p>
 * Each entry of a description names a builder method and its arguments. Arguments given as
 * a {@link Map} are passed by name, a {@link List} positionally, and anything else as the
 * single argument. Entries are applied in iteration order; empty arguments are skipped.
 * </p>
 *
 * <pre>{@code
 * Map<String, Object> description = new LinkedHashMap<>();
 * description.put("type", "core");
 * description.put("metrics", List.of("pageviews", "sessions"));
 * description.put("daily", Map.of("start", "2020-01-01", "days", 7));
 * description.put("filter", Map.of("browser", "Chrome"));
 * description.put("limit", 100);
 *
 * Query<?> query = QueryDescriptions.describe(context, description);
 * }</pre>
 *
 * <h2>Supported methods</h2>
 * <ul>
 *   <li>all queries: {@code metrics, dimensions, query, sort, filter, set, title, limit}</li>
 *   <li>core queries: {@code range, interval, hourly, daily, weekly, monthly, yearly, lifetime,
 *       precision, step, segment, users, sessions}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QueryDescriptions {

    public static final String TYPE = "type";
    public static final String CORE = "core";
    public static final String REALTIME = "realtime";

    private static final Set<String> COMMON = Set.of(
            "metrics", "dimensions", "query", "sort", "filter", "set", "title", "limit");

    private static final Set<String> CORE_ONLY = Set.of(
            "range", "interval", "hourly", "daily", "weekly", "monthly", "yearly", "lifetime",
            "precision", "step", "segment", "users", "sessions");

    private QueryDescriptions() {
    }

    /**
     * Creates a query from a description. The {@value #TYPE} entry selects the API
     * ({@value #CORE} when absent); every other entry is applied by {@link #refine}.
     *
     * @param context     reporting context
     * @param description query description
     * @return the described query
     * @throws QueryValidationException on an unknown type, method or argument
     */
    public static Query<?> describe(ReportingContext context, Map<String, ?> description) {
        Map<String, Object> remaining = new LinkedHashMap<>(description);
        Object type = remaining.remove(TYPE);
        String api = type == null ? CORE : type.toString().trim().toLowerCase(Locale.ROOT);

        Query<?> query = switch (api) {
            case CORE -> context.query();
            case REALTIME -> context.realtime();
            default -> throw new QueryValidationException(
                    "Unknown query type: " + type + ". Choose from: core, realtime.");
        };
        return refine(query, remaining);
    }

    /**
     * Applies a description to an existing query.
     *
     * @param query       query to refine
     * @param description method name → arguments
     * @return the refined query
     * @throws QueryValidationException on an unknown method or argument
     */
    public static Query<?> refine(Query<?> query, Map<String, ?> description) {
        Query<?> refined = query;
        for (Map.Entry<String, ?> entry : description.entrySet()) {
            String method = entry.getKey();
            if (!supports(refined, method)) {
                throw new QueryValidationException("Unknown query method: " + method);
            }

            Arguments arguments = Arguments.of(entry.getValue());
            if (arguments.isEmpty()) {
                continue;
            }
            refined = apply(refined, method, arguments);
        }
        return refined;
    }

    private static boolean supports(Query<?> query, String method) {
        return COMMON.contains(method) || (query instanceof CoreQuery && CORE_ONLY.contains(method));
    }

    private static Query<?> apply(Query<?> query, String method, Arguments arguments) {
        return switch (method) {
            case "metrics" -> query.metrics(arguments.all("metrics").toArray());
            case "dimensions" -> query.dimensions(arguments.all("dimensions").toArray());
            case "query" -> query.query(arguments.list(0, "metrics"), arguments.list(1, "dimensions"));
            case "sort" -> query.sort(arguments.all("columns"), arguments.bool("descending"));
            case "filter" -> query.filter(arguments.string(0, "value"), arguments.selection("value"));
            case "set" -> arguments.named != null
                    ? query.set(arguments.named)
                    : query.set(arguments.string(0, "key"), arguments.get(1, "value"));
            case "title" -> query.title(arguments.string(0, "title"));
            case "limit" -> limit(query, arguments);
            default -> applyCore((CoreQuery) query, method, arguments);
        };
    }

    private static Query<?> limit(Query<?> query, Arguments arguments) {
        Integer start;
        Integer maximum;
        if (arguments.named != null) {
            start = arguments.integer(0, "start");
            maximum = arguments.integer(0, "maximum");
        } else if (arguments.positional.size() > 1) {
            start = arguments.integer(0, "start");
            maximum = arguments.integer(1, "maximum");
        } else {
            start = null;
            maximum = arguments.integer(0, "maximum");
        }
        required(maximum, "limit");

        if (query instanceof CoreQuery core) {
            return core.limit(start == null ? 1 : start, maximum);
        }
        return ((RealTimeQuery) query).limit(maximum);
    }

    private static int required(Integer maximum, String method) {
        if (maximum == null) {
            throw new QueryValidationException("Query#" + method + " requires a maximum number of rows.");
        }
        return maximum;
    }

    private static CoreQuery applyCore(CoreQuery query, String method, Arguments arguments) {
        return switch (method) {
            case "range" -> range(query, arguments);
            case "lifetime" -> range(query, arguments);
            case "hourly" -> range(query.interval(Granularity.HOUR), arguments);
            case "daily" -> range(query.interval(Granularity.DAY), arguments);
            case "weekly" -> range(query.interval(Granularity.WEEK), arguments);
            case "monthly" -> range(query.interval(Granularity.MONTH), arguments);
            case "yearly" -> range(query.interval(Granularity.YEAR), arguments);
            case "interval" -> arguments.get(0, "granularity") instanceof Number index
                    ? query.interval(index.intValue())
                    : query.interval(arguments.string(0, "granularity"));
            case "precision" -> arguments.get(0, "precision") instanceof Number index
                    ? query.precision(index.intValue())
                    : query.precision(arguments.string(0, "precision"));
            case "step" -> query.step(required(arguments.integer(0, "maximum"), "step"));
            case "segment" -> query.segment(
                    arguments.string(0, "value"),
                    arguments.string(1, "scope"),
                    arguments.string(2, "metric_scope"),
                    arguments.selection("value", "scope", "metric_scope"));
            case "users" -> query.users(arguments.selection());
            case "sessions" -> query.sessions(arguments.selection());
            default -> throw new QueryValidationException("Unknown query method: " + method);
        };
    }

    private static CoreQuery range(CoreQuery query, Arguments arguments) {
        Integer months = arguments.integer(2, "months");
        Integer days = arguments.integer(3, "days");
        return query.range(
                arguments.string(0, "start"),
                arguments.string(1, "stop"),
                months == null ? 0 : months,
                days == null ? 0 : days);
    }

    /**
     * Positional or named arguments of one described call.
     */
    private static final class Arguments {

        private final List<Object> positional;
        private final Map<String, Object> named;

        private Arguments(List<Object> positional, Map<String, Object> named) {
            this.positional = positional;
            this.named = named;
        }

        static Arguments of(Object value) {
            if (value instanceof Map<?, ?> map) {
                Map<String, Object> named = new LinkedHashMap<>();
                map.forEach((key, argument) -> named.put(String.valueOf(key), argument));
                return new Arguments(List.of(), named);
            }
            if (value instanceof Collection<?> collection) {
                return new Arguments(new ArrayList<>(collection), null);
            }
            List<Object> single = new ArrayList<>();
            if (value != null && !(value instanceof String text && text.isBlank())) {
                single.add(value);
            }
            return new Arguments(single, null);
        }

        boolean isEmpty() {
            return named == null ? positional.isEmpty() : named.isEmpty();
        }

        Object get(int position, String name) {
            if (named != null) {
                return named.get(name);
            }
            return position < positional.size() ? positional.get(position) : null;
        }

        String string(int position, String name) {
            Object value = get(position, name);
            return value == null ? null : value.toString();
        }

        Integer integer(int position, String name) {
            Object value = get(position, name);
            if (value == null) {
                return null;
            }
            if (value instanceof Number number) {
                return number.intValue();
            }
            try {
                return Integer.valueOf(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new QueryValidationException("Argument " + name + " should be a number. Received: " + value, e);
            }
        }

        boolean bool(String name) {
            Object value = named == null ? null : named.get(name);
            return value instanceof Boolean flag ? flag : value != null && Boolean.parseBoolean(value.toString());
        }

        List<?> list(int position, String name) {
            Object value = get(position, name);
            if (value == null) {
                return List.of();
            }
            return value instanceof List<?> list ? list : List.of(value);
        }

        /**
         * Every positional argument, or the named argument {@code name} as a list.
         */
        List<Object> all(String name) {
            if (named == null) {
                return positional;
            }
            return new ArrayList<>(list(0, name));
        }

        /**
         * Named arguments minus the given reserved names, as a keyword selection.
         */
        Map<String, Object> selection(String... reserved) {
            if (named == null) {
                return null;
            }
            Map<String, Object> selection = new LinkedHashMap<>(named);
            for (String name : reserved) {
                selection.remove(name);
            }
            return selection;
        }
    }
}
