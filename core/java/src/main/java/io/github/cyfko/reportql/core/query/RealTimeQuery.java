package io.github.cyfko.reportql.core.query;

import io.github.cyfko.reportql.core.ReportingContext;
import io.github.cyfko.reportql.core.exception.QueryValidationException;
import io.github.cyfko.reportql.core.report.Report;
import io.github.cyfko.reportql.core.spi.ReportingApi;

import java.util.Map;

/**
 * Query against the real-time reporting API.
 * <p>
 * Real-time results are never paginated: there is no start index, and {@link #get()} runs
 * a single request.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RealTimeQuery extends Query<RealTimeQuery> {

    public RealTimeQuery(ReportingContext context) {
        super(context);
    }

    protected RealTimeQuery(ReportingContext context, Map<String, Object> parameters, QueryOptions options) {
        super(context, parameters, options);
    }

    @Override
    protected RealTimeQuery newInstance(ReportingContext context, Map<String, Object> parameters, QueryOptions options) {
        return new RealTimeQuery(context, parameters, options);
    }

    @Override
    public ReportingApi api() {
        return ReportingApi.REALTIME;
    }

    /**
     * @param maximum number of rows returned
     * @return the new query
     */
    public RealTimeQuery limit(int maximum) {
        if (maximum <= 0) {
            throw new QueryValidationException("Limit must be positive. Received: " + maximum);
        }
        return derive(draft -> {
            draft.limit = maximum;
            draft.parameters.put(MAX_RESULTS, maximum);
        });
    }

    @Override
    public Report get() {
        return execute();
    }
}
