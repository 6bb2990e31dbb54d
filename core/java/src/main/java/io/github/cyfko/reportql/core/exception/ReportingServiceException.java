package io.github.cyfko.reportql.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when the reporting service answers with an API-level failure
 * (quota exhausted, insufficient permissions, unknown profile...).
 * <p>
 * Carries the original service message, the status code reported by the transport and
 * the parameters of the failed request. No automatic retry takes place.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ReportingServiceException extends RuntimeException {

    private final int statusCode;
    private final Map<String, Object> parameters;

    public ReportingServiceException(String message, int statusCode, Map<String, Object> parameters, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }
}
