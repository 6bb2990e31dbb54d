package io.github.cyfko.reportql.core.exception;

/**
 * Exception thrown when a column key cannot be resolved, either against a column
 * registry while building a query or against the headers of a report.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ColumnNotFoundException extends QueryValidationException {

    private final String column;

    /**
     * @param column  the key that could not be resolved
     * @param message description naming the missing column
     */
    public ColumnNotFoundException(String column, String message) {
        super(message);
        this.column = column;
    }

    /**
     * @return the unresolved key
     */
    public String getColumn() {
        return column;
    }
}
