package io.github.cyfko.reportql.core.spi;

/**
 * Raised by {@link ReportingEndpoint} implementations when the reporting service answers
 * with an error payload.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EndpointException extends RuntimeException {

    private final int statusCode;
    private final String content;

    /**
     * @param message    error message returned by the service
     * @param statusCode transport status code (HTTP status for HTTP transports)
     * @param content    raw error body, may be {@code null}
     */
    public EndpointException(String message, int statusCode, String content) {
        super(message);
        this.statusCode = statusCode;
        this.content = content;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getContent() {
        return content;
    }
}
