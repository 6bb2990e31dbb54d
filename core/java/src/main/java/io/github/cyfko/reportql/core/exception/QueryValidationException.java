package io.github.cyfko.reportql.core.exception;

/**
 * Exception thrown when a query is being built with malformed arguments.
 * <p>
 * Validation errors are raised synchronously by builder methods and by the selector
 * compiler, before anything is sent over the wire. They are never retried.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li>Unknown selector in a keyword selection ({@code sessions__bigger})</li>
 *   <li>Unknown precision or granularity level</li>
 *   <li>Raw expression and keyword selection passed to the same {@code filter}/{@code segment} call</li>
 *   <li>Sorting on something that is neither a column nor a column name</li>
 *   <li>Unknown method in a query description</li>
 * </ul>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     query = query.precision("EXTREME");
 * } catch (QueryValidationException e) {
 *     // "Precision should be one of: FASTER, DEFAULT, HIGHER_PRECISION"
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class QueryValidationException extends RuntimeException {

    /**
     * @param message description of the invalid argument, listing valid options where applicable
     */
    public QueryValidationException(String message) {
        super(message);
    }

    /**
     * @param message description of the invalid argument
     * @param cause   underlying parsing failure
     */
    public QueryValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
