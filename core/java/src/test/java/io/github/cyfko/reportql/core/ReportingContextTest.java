package io.github.cyfko.reportql.core;

import io.github.cyfko.reportql.core.cache.InMemoryReportCache;
import io.github.cyfko.reportql.core.config.CachePolicy;
import io.github.cyfko.reportql.core.config.ExecutionPolicy;
import io.github.cyfko.reportql.core.query.CoreQuery;
import io.github.cyfko.reportql.core.spi.ReportCache;
import io.github.cyfko.reportql.core.spi.ReportingEndpoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("ReportingContext Tests")
class ReportingContextTest {

    private final ReportingEndpoint endpoint = mock(ReportingEndpoint.class);

    @Test
    @DisplayName("Should list every missing collaborator")
    void shouldListMissingCollaborators() {
        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> ReportingContext.builder().build());

        assertEquals("ReportingContext requires profileId, columns, endpoint", exception.getMessage());
    }

    @Test
    @DisplayName("Should prefix the profile id once")
    void shouldPrefixProfileId() {
        // Given
        ReportingContext plain = ReportingContext.builder()
                .profileId("12345").columns(TestFixtures.registry()).endpoint(endpoint).build();
        ReportingContext prefixed = ReportingContext.builder()
                .profileId("ga:12345").columns(TestFixtures.registry()).endpoint(endpoint).build();

        // Then
        assertEquals("ga:12345", plain.query("pageviews").parameters().get("ids"));
        assertEquals("ga:12345", prefixed.query("pageviews").parameters().get("ids"));
    }

    @Test
    @DisplayName("Should not cache by default")
    void shouldNotCacheByDefault() {
        // When
        ReportingContext context = ReportingContext.builder()
                .profileId("1").columns(TestFixtures.registry()).endpoint(endpoint).build();

        // Then
        assertTrue(context.cache().isEmpty());
        assertEquals(ExecutionPolicy.defaults(), context.policy());
    }

    @Test
    @DisplayName("Should create an in-memory cache from an enabled cache policy")
    void shouldCreateCacheFromPolicy() {
        // When
        ReportingContext context = ReportingContext.builder()
                .profileId("1").columns(TestFixtures.registry()).endpoint(endpoint)
                .cachePolicy(CachePolicy.custom(25))
                .build();

        // Then
        ReportCache cache = context.cache().orElseThrow();
        assertInstanceOf(InMemoryReportCache.class, cache);
        assertEquals(25, ((InMemoryReportCache) cache).getMaxSize());
    }

    @Test
    @DisplayName("Should prefer an explicit cache over the policy")
    void shouldPreferExplicitCache() {
        // Given
        ReportCache cache = mock(ReportCache.class);

        // When
        ReportingContext context = ReportingContext.builder()
                .profileId("1").columns(TestFixtures.registry()).endpoint(endpoint)
                .cache(cache)
                .cachePolicy(CachePolicy.defaults())
                .build();

        // Then
        assertSame(cache, context.cache().orElseThrow());
    }

    @Test
    @DisplayName("Should use the configured page size when paginating")
    void shouldUseConfiguredPageSize() {
        // Given
        ReportingContext context = ReportingContext.builder()
                .profileId("1").columns(TestFixtures.registry()).endpoint(endpoint)
                .executionPolicy(new ExecutionPolicy(500, Duration.ZERO))
                .build();

        // When
        CoreQuery next = context.query("pageviews").next();

        // Then
        assertEquals(501, next.parameters().get("start_index"));
    }

    @Test
    @DisplayName("Should create queries from descriptions")
    void shouldDescribeQueries() {
        // Given
        ReportingContext context = TestFixtures.context(endpoint);

        // When
        CoreQuery described = (CoreQuery) context.describe(Map.of("metrics", List.of("pageviews")));

        // Then
        assertEquals(List.of("ga:pageviews"), described.metricIds());
    }
}
