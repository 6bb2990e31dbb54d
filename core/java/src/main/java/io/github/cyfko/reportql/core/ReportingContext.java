package io.github.cyfko.reportql.core;

import io.github.cyfko.reportql.core.cache.InMemoryReportCache;
import io.github.cyfko.reportql.core.compile.SelectorCompiler;
import io.github.cyfko.reportql.core.config.CachePolicy;
import io.github.cyfko.reportql.core.config.ExecutionPolicy;
import io.github.cyfko.reportql.core.execution.RequestDispatcher;
import io.github.cyfko.reportql.core.execution.RequestThrottle;
import io.github.cyfko.reportql.core.execution.TimeSource;
import io.github.cyfko.reportql.core.query.CoreQuery;
import io.github.cyfko.reportql.core.query.Query;
import io.github.cyfko.reportql.core.query.QueryDescriptions;
import io.github.cyfko.reportql.core.query.RealTimeQuery;
import io.github.cyfko.reportql.core.spi.ColumnRegistry;
import io.github.cyfko.reportql.core.spi.ReportCache;
import io.github.cyfko.reportql.core.spi.ReportingEndpoint;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the library: binds a reporting profile to its collaborators and creates
 * queries against it.
 *
 * <h2>Collaborators</h2>
 * <ul>
 *   <li>{@link ColumnRegistry}: resolves column names (required)</li>
 *   <li>{@link ReportingEndpoint}: transport to the reporting service (required)</li>
 *   <li>{@link ReportCache}: optional response cache</li>
 *   <li>{@link RequestThrottle}: outbound rate limit, shared process-wide by default</li>
 *   <li>{@link Clock}: resolves relative dates, the system clock by default</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ReportingContext context = ReportingContext.builder()
 *     .profileId("12345678")
 *     .columns(registry)
 *     .endpoint(endpoint)
 *     .cachePolicy(CachePolicy.defaults())
 *     .build();
 *
 * Report report = context.query("pageviews", "sessions")
 *     .dimensions("browser")
 *     .daily("2020-01-01", "2020-01-31")
 *     .filter(Map.of("sessions__gt", 10))
 *     .get();
 * }</pre>
 *
 * <p>
 * A context is immutable and safe to share between threads.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReportingContext {

    private final String profileId;
    private final ColumnRegistry columns;
    private final ReportCache cache;
    private final Clock clock;
    private final ExecutionPolicy policy;
    private final SelectorCompiler compiler;
    private final RequestDispatcher dispatcher;

    private ReportingContext(Builder builder) {
        this.profileId = builder.profileId;
        this.columns = builder.columns;
        this.cache = builder.cache;
        this.clock = builder.clock;
        this.policy = builder.executionPolicy;
        this.compiler = new SelectorCompiler(builder.columns);
        this.dispatcher = new RequestDispatcher(builder.endpoint, builder.throttle);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a core reporting query with initial metrics.
     *
     * @param metrics columns or column keys
     * @return the query
     */
    public CoreQuery query(Object... metrics) {
        return new CoreQuery(this).metrics(metrics);
    }

    /**
     * Creates a core reporting query with initial metrics and dimensions.
     *
     * @param metrics    columns or column keys
     * @param dimensions columns or column keys
     * @return the query
     */
    public CoreQuery query(List<?> metrics, List<?> dimensions) {
        return new CoreQuery(this).query(metrics, dimensions);
    }

    /**
     * Creates a real-time query with initial metrics.
     *
     * @param metrics columns or column keys
     * @return the query
     */
    public RealTimeQuery realtime(Object... metrics) {
        return new RealTimeQuery(this).metrics(metrics);
    }

    /**
     * @param description query description
     * @return the described query
     * @see QueryDescriptions#describe(ReportingContext, Map)
     */
    public Query<?> describe(Map<String, ?> description) {
        return QueryDescriptions.describe(this, description);
    }

    public String profileId() {
        return profileId;
    }

    public ColumnRegistry columns() {
        return columns;
    }

    public Optional<ReportCache> cache() {
        return Optional.ofNullable(cache);
    }

    public Clock clock() {
        return clock;
    }

    public ExecutionPolicy policy() {
        return policy;
    }

    public SelectorCompiler compiler() {
        return compiler;
    }

    public RequestDispatcher dispatcher() {
        return dispatcher;
    }

    @Override
    public String toString() {
        return "ReportingContext[profileId=" + profileId + "]";
    }

    /**
     * Builder for {@link ReportingContext}.
     */
    public static final class Builder {
        private String profileId;
        private ColumnRegistry columns;
        private ReportingEndpoint endpoint;
        private ReportCache cache;
        private CachePolicy cachePolicy = CachePolicy.none(); // no caching unless asked
        private RequestThrottle throttle;
        private Clock clock = Clock.systemDefaultZone();
        private ExecutionPolicy executionPolicy = ExecutionPolicy.defaults();

        private Builder() {
        }

        /**
         * @param profileId reporting profile (view) id, with or without the {@code ga:} prefix
         */
        public Builder profileId(String profileId) {
            this.profileId = profileId;
            return this;
        }

        public Builder columns(ColumnRegistry columns) {
            this.columns = columns;
            return this;
        }

        public Builder endpoint(ReportingEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Uses the given cache; takes precedence over {@link #cachePolicy(CachePolicy)}.
         */
        public Builder cache(ReportCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Creates an {@link InMemoryReportCache} when the policy enables caching and no
         * cache was given.
         */
        public Builder cachePolicy(CachePolicy cachePolicy) {
            this.cachePolicy = Objects.requireNonNull(cachePolicy, "cachePolicy");
            return this;
        }

        /**
         * Uses a dedicated throttle instead of the process-wide one.
         */
        public Builder throttle(RequestThrottle throttle) {
            this.throttle = throttle;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder executionPolicy(ExecutionPolicy executionPolicy) {
            this.executionPolicy = Objects.requireNonNull(executionPolicy, "executionPolicy");
            return this;
        }

        /**
         * @return the context
         * @throws IllegalStateException if the profile id, the column registry or the endpoint is missing
         */
        public ReportingContext build() {
            List<String> missing = new ArrayList<>();
            if (profileId == null || profileId.isBlank()) missing.add("profileId");
            if (columns == null) missing.add("columns");
            if (endpoint == null) missing.add("endpoint");
            if (!missing.isEmpty()) {
                throw new IllegalStateException("ReportingContext requires " + String.join(", ", missing));
            }

            if (cache == null) {
                cache = cachePolicy.createCache().orElse(null);
            }

            if (throttle == null) {
                // a custom interval cannot be honoured by the shared throttle
                throttle = executionPolicy.minimumInterval().equals(ExecutionPolicy.DEFAULT_MINIMUM_INTERVAL)
                        ? RequestThrottle.processWide()
                        : new RequestThrottle(executionPolicy.minimumInterval(), TimeSource.system());
            }

            return new ReportingContext(this);
        }
    }
}
