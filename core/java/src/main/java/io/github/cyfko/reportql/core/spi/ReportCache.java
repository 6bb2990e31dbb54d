package io.github.cyfko.reportql.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.reportql.core.query.Query;

/**
 * Pluggable store of raw responses keyed by query signature.
 * <p>
 * The cache is only consulted for {@linkplain Query#cacheable() cacheable} queries, i.e.
 * queries whose date range is absolute. Implementations must tolerate concurrent calls from
 * several query executions; no transactional guarantee across keys is expected.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see Query#signature()
 */
public interface ReportCache {

    /**
     * @param signature query signature
     * @return {@code true} if a response is stored under this signature
     */
    boolean exists(String signature);

    /**
     * @param query query whose response to look up
     * @return the stored response, or {@code null} on a miss
     */
    JsonNode get(Query<?> query);

    /**
     * Stores the response of a query.
     *
     * @param query    query that produced the response
     * @param response raw response body
     */
    void set(Query<?> query, JsonNode response);
}
