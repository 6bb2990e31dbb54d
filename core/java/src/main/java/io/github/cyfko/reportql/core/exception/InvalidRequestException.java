package io.github.cyfko.reportql.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when the reporting endpoint refuses the shape of the request
 * parameters, for instance because a parameter has the wrong type.
 * <p>
 * The message carries the original failure followed by a dump of every wire parameter
 * that was submitted, one {@code key<TAB>value} line each, so that the faulty parameter
 * can be spotted directly from a log.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InvalidRequestException extends RuntimeException {

    private final Map<String, Object> parameters;

    /**
     * @param message    diagnostic message including the parameter dump
     * @param parameters the parameters that were submitted
     * @param cause      the transport failure
     */
    public InvalidRequestException(String message, Map<String, Object> parameters, Throwable cause) {
        super(message, cause);
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * @return the submitted wire parameters
     */
    public Map<String, Object> getParameters() {
        return parameters;
    }
}
