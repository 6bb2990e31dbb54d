package io.github.cyfko.reportql.core.execution;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.reportql.core.exception.InvalidRequestException;
import io.github.cyfko.reportql.core.exception.ReportingServiceException;
import io.github.cyfko.reportql.core.spi.EndpointException;
import io.github.cyfko.reportql.core.spi.ReportingApi;
import io.github.cyfko.reportql.core.spi.ReportingEndpoint;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Sends wire parameters to the {@link ReportingEndpoint}, going through the
 * {@link RequestThrottle} first, and translates transport failures into the library's
 * error taxonomy.
 *
 * <p><strong>Error translation:</strong></p>
 * <ul>
 *   <li>{@link IllegalArgumentException}, {@link ClassCastException} → {@link InvalidRequestException},
 *       enriched with a dump of every parameter</li>
 *   <li>{@link EndpointException} → {@link ReportingServiceException} with the original message</li>
 *   <li>anything else is propagated unchanged</li>
 * </ul>
 * <p>Nothing is retried.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RequestDispatcher {

    private static final Logger log = Logger.getLogger(RequestDispatcher.class.getName());

    private final ReportingEndpoint endpoint;
    private final RequestThrottle throttle;

    public RequestDispatcher(ReportingEndpoint endpoint, RequestThrottle throttle) {
        this.endpoint = Objects.requireNonNull(endpoint, "Reporting endpoint cannot be null");
        this.throttle = Objects.requireNonNull(throttle, "Request throttle cannot be null");
    }

    /**
     * Executes one throttled request.
     *
     * @param api        target API
     * @param parameters wire parameters
     * @return raw response
     * @throws InvalidRequestException    if the endpoint rejects the parameter shapes
     * @throws ReportingServiceException  if the service answers with an error
     */
    public JsonNode dispatch(ReportingApi api, Map<String, Object> parameters) {
        throttle.acquire();

        log.fine(() -> String.format("Dispatching %s report request: %s", api, parameters));

        try {
            return endpoint.get(api, parameters);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new InvalidRequestException(diagnostics(e.getMessage(), parameters), parameters, e);
        } catch (EndpointException e) {
            throw new ReportingServiceException(e.getMessage(), e.getStatusCode(), parameters, e);
        }
    }

    /**
     * Formats a failure message followed by the submitted parameters, keys padded to the
     * widest key.
     *
     * @param message    original failure message
     * @param parameters submitted parameters
     * @return the diagnostic text
     */
    static String diagnostics(String message, Map<String, Object> parameters) {
        int width = parameters.keySet().stream().mapToInt(String::length).max().orElse(0);
        String dump = parameters.entrySet().stream()
                .map(entry -> String.format("%-" + Math.max(width, 1) + "s\t%s", entry.getKey(), entry.getValue()))
                .collect(Collectors.joining("\n"));

        return message + "\n\nThe query you submitted was:\n\n" + dump;
    }
}
