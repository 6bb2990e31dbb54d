package io.github.cyfko.reportql.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Transport to the remote reporting service.
 * <p>
 * Implementations send one request carrying the given wire parameters and return the
 * decoded JSON body, which is expected to hold {@code columnHeaders},
 * {@code totalsForAllResults}, an optional {@code rows} array and an optional
 * {@code nextLink}.
 * </p>
 *
 * <p><strong>Failure contract:</strong></p>
 * <ul>
 *   <li>{@link IllegalArgumentException} or {@link ClassCastException}: the parameters
 *       cannot be shaped into a request (malformed type or value)</li>
 *   <li>{@link EndpointException}: the service answered with an error</li>
 *   <li>anything else (e.g. {@link java.io.UncheckedIOException}) is propagated as is</li>
 * </ul>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * ReportingEndpoint endpoint = (api, parameters) -> httpClient.fetchJson(urlFor(api), parameters);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReportingEndpoint {

    /**
     * Executes one request against the reporting service.
     *
     * @param api        which reporting API to call
     * @param parameters wire parameters ({@code ids}, {@code metrics}, {@code start_date}...)
     * @return the decoded response body
     */
    JsonNode get(ReportingApi api, Map<String, Object> parameters);
}
