package io.github.cyfko.reportql.core.execution;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.reportql.core.TestFixtures;
import io.github.cyfko.reportql.core.exception.InvalidRequestException;
import io.github.cyfko.reportql.core.exception.ReportingServiceException;
import io.github.cyfko.reportql.core.spi.EndpointException;
import io.github.cyfko.reportql.core.spi.ReportingApi;
import io.github.cyfko.reportql.core.spi.ReportingEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("RequestDispatcher Tests")
class RequestDispatcherTest {

    @Mock
    private ReportingEndpoint endpoint;

    @Mock
    private RequestThrottle throttle;

    private RequestDispatcher dispatcher;
    private Map<String, Object> parameters;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        dispatcher = new RequestDispatcher(endpoint, throttle);
        parameters = new LinkedHashMap<>();
        parameters.put("ids", "ga:12345");
        parameters.put("metrics", "ga:pageviews");
        parameters.put("start_date", "2020-01-01");
    }

    @Test
    @DisplayName("Should acquire the throttle before calling the endpoint")
    void shouldThrottleBeforeCalling() {
        // Given
        JsonNode response = TestFixtures.response(List.of("ga:pageviews"), null, Map.of("ga:pageviews", "0"), null);
        when(throttle.acquire()).thenReturn(Duration.ZERO);
        when(endpoint.get(ReportingApi.CORE, parameters)).thenReturn(response);

        // When
        JsonNode result = dispatcher.dispatch(ReportingApi.CORE, parameters);

        // Then
        assertSame(response, result);
        InOrder order = inOrder(throttle, endpoint);
        order.verify(throttle).acquire();
        order.verify(endpoint).get(ReportingApi.CORE, parameters);
    }

    @Test
    @DisplayName("Should turn malformed parameters into an invalid request with a parameter dump")
    void shouldReportInvalidRequests() {
        // Given
        when(endpoint.get(eq(ReportingApi.CORE), any())).thenThrow(new IllegalArgumentException("max_results must be an integer"));

        // When
        InvalidRequestException exception = assertThrows(InvalidRequestException.class,
                () -> dispatcher.dispatch(ReportingApi.CORE, parameters));

        // Then
        assertTrue(exception.getMessage().startsWith("max_results must be an integer\n\nThe query you submitted was:\n\n"));
        assertTrue(exception.getMessage().contains("ids       \tga:12345"));
        assertTrue(exception.getMessage().contains("start_date\t2020-01-01"));
        assertEquals(parameters, exception.getParameters());
        assertInstanceOf(IllegalArgumentException.class, exception.getCause());
    }

    @Test
    @DisplayName("Should turn class cast failures into invalid requests too")
    void shouldReportClassCastFailures() {
        // Given
        when(endpoint.get(eq(ReportingApi.CORE), any())).thenThrow(new ClassCastException("not a string"));

        // When & Then
        assertThrows(InvalidRequestException.class, () -> dispatcher.dispatch(ReportingApi.CORE, parameters));
    }

    @Test
    @DisplayName("Should turn service errors into reporting service exceptions")
    void shouldReportServiceErrors() {
        // Given
        when(endpoint.get(eq(ReportingApi.REALTIME), any()))
                .thenThrow(new EndpointException("Quota exceeded", 403, "{\"error\":{}}"));

        // When
        ReportingServiceException exception = assertThrows(ReportingServiceException.class,
                () -> dispatcher.dispatch(ReportingApi.REALTIME, parameters));

        // Then
        assertEquals("Quota exceeded", exception.getMessage());
        assertEquals(403, exception.getStatusCode());
        assertEquals(parameters, exception.getParameters());
    }

    @Test
    @DisplayName("Should propagate other failures unchanged")
    void shouldPropagateOtherFailures() {
        // Given
        UncheckedIOException failure = new UncheckedIOException(new IOException("connection reset"));
        when(endpoint.get(eq(ReportingApi.CORE), any())).thenThrow(failure);

        // When
        UncheckedIOException exception = assertThrows(UncheckedIOException.class,
                () -> dispatcher.dispatch(ReportingApi.CORE, parameters));

        // Then
        assertSame(failure, exception);
        verify(endpoint, times(1)).get(eq(ReportingApi.CORE), any());
    }

    @Test
    @DisplayName("Should pad parameter names to the widest one")
    void shouldPadDiagnostics() {
        // Given
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("ids", "ga:1");
        wire.put("dimensions", null);

        // When
        String diagnostics = RequestDispatcher.diagnostics("boom", wire);

        // Then
        assertEquals("boom\n\nThe query you submitted was:\n\nids       \tga:1\ndimensions\tnull", diagnostics);
    }
}
