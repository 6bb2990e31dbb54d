package io.github.cyfko.reportql.core.query;

import io.github.cyfko.reportql.core.ReportingContext;
import io.github.cyfko.reportql.core.TestFixtures;
import io.github.cyfko.reportql.core.exception.QueryValidationException;
import io.github.cyfko.reportql.core.spi.ReportingEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("QueryDescriptions Tests")
class QueryDescriptionsTest {

    private ReportingContext context;

    @BeforeEach
    void setUp() {
        context = TestFixtures.context(mock(ReportingEndpoint.class));
    }

    @Test
    @DisplayName("Should build the same query as the equivalent method chain")
    void shouldMatchMethodChain() {
        // Given
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("metrics", List.of("pageviews", "sessions"));
        description.put("dimensions", "browser");
        description.put("daily", Map.of("start", "2020-01-01", "stop", "2020-01-31"));
        description.put("filter", Map.of("sessions__gt", 10));
        description.put("sort", List.of("-pageviews"));
        description.put("limit", List.of(1, 50));

        // When
        Query<?> described = QueryDescriptions.describe(context, description);

        // Then
        CoreQuery chained = context.query("pageviews", "sessions")
                .dimensions("browser")
                .daily("2020-01-01", "2020-01-31")
                .filter(Map.of("sessions__gt", 10))
                .sort("-pageviews")
                .limit(1, 50);
        assertInstanceOf(CoreQuery.class, described);
        assertEquals(chained.build(), described.build());
        assertEquals(chained.signature(), described.signature());
    }

    @Test
    @DisplayName("Should pass named range arguments, durations included")
    void shouldPassNamedArguments() {
        // Given
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("metrics", "pageviews");
        description.put("range", Map.of("start", "2020-01-01", "days", 7));
        description.put("precision", 2);
        description.put("interval", "month");

        // When
        Query<?> query = QueryDescriptions.describe(context, description);

        // Then
        assertEquals("2020-01-07", query.parameters().get("end_date"));
        assertEquals("HIGHER_PRECISION", query.parameters().get("samplingLevel"));
        assertEquals(List.of("ga:yearMonth"), query.dimensionIds());
    }

    @Test
    @DisplayName("Should create real-time queries on request")
    void shouldCreateRealTimeQueries() {
        // Given
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("type", "realtime");
        description.put("metrics", "pageviews");
        description.put("limit", 10);

        // When
        Query<?> query = QueryDescriptions.describe(context, description);

        // Then
        assertInstanceOf(RealTimeQuery.class, query);
        assertEquals(10, query.parameters().get("max_results"));
    }

    @Test
    @DisplayName("Should skip empty arguments")
    void shouldSkipEmptyArguments() {
        // Given
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("metrics", "pageviews");
        description.put("filter", Map.of());
        description.put("sort", List.of());
        description.put("segment", null);

        // When
        Query<?> query = QueryDescriptions.describe(context, description);

        // Then
        assertFalse(query.parameters().containsKey("filters"));
        assertFalse(query.parameters().containsKey("sort"));
        assertFalse(query.parameters().containsKey("segment"));
    }

    @Test
    @DisplayName("Should name unknown methods")
    void shouldNameUnknownMethods() {
        // When & Then
        QueryValidationException exception = assertThrows(QueryValidationException.class,
                () -> QueryDescriptions.refine(context.query("pageviews"), Map.of("explode", true)));

        assertEquals("Unknown query method: explode", exception.getMessage());
    }

    @Test
    @DisplayName("Should refuse core-only methods on real-time queries")
    void shouldRefuseCoreMethodsOnRealTimeQueries() {
        QueryValidationException exception = assertThrows(QueryValidationException.class,
                () -> QueryDescriptions.refine(context.realtime("pageviews"), Map.of("daily", "yesterday")));

        assertEquals("Unknown query method: daily", exception.getMessage());
    }

    @Test
    @DisplayName("Should reject unknown query types")
    void shouldRejectUnknownTypes() {
        assertThrows(QueryValidationException.class,
                () -> QueryDescriptions.describe(context, Map.of("type", "mcf")));
    }

    @Test
    @DisplayName("Should compile scoped segment descriptions")
    void shouldCompileSegments() {
        // Given
        Map<String, Object> segment = new LinkedHashMap<>();
        segment.put("scope", "sessions");
        segment.put("metric_scope", "hits");
        segment.put("pageviews__gt", 2);

        // When
        Query<?> query = QueryDescriptions.refine(context.query("pageviews"), Map.of("segment", segment));

        // Then
        assertEquals("sessions::condition::perHit::ga:pageviews>2", query.parameters().get("segment"));
    }
}
