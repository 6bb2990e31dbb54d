package io.github.cyfko.reportql.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Execution settings shared by every query of a {@link io.github.cyfko.reportql.core.ReportingContext}.
 *
 * @param defaultPageSize rows requested per page when a query sets no {@code max_results}
 * @param minimumInterval minimum delay between two outbound requests
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ExecutionPolicy(int defaultPageSize, Duration minimumInterval) {

    public static final int DEFAULT_PAGE_SIZE = 1000;
    public static final Duration DEFAULT_MINIMUM_INTERVAL = Duration.ofSeconds(1);

    public ExecutionPolicy {
        Objects.requireNonNull(minimumInterval, "minimumInterval");
        if (defaultPageSize <= 0) {
            throw new IllegalArgumentException("defaultPageSize must be positive, got: " + defaultPageSize);
        }
        if (minimumInterval.isNegative()) {
            throw new IllegalArgumentException("minimumInterval cannot be negative, got: " + minimumInterval);
        }
    }

    public static ExecutionPolicy defaults() {
        return new ExecutionPolicy(DEFAULT_PAGE_SIZE, DEFAULT_MINIMUM_INTERVAL);
    }
}
