package io.github.cyfko.reportql.core.config;

import io.github.cyfko.reportql.core.cache.InMemoryReportCache;
import io.github.cyfko.reportql.core.spi.ReportCache;

import java.util.Optional;

/**
 * How a {@link io.github.cyfko.reportql.core.ReportingContext} keeps report responses when
 * no {@link ReportCache} is supplied explicitly.
 * <p>
 * Only responses of queries over absolute date ranges are ever stored; relative ranges such
 * as {@code 30daysAgo} bypass the cache whatever the policy says.
 * </p>
 *
 * @param cacheEnabled whether responses are kept in an {@link InMemoryReportCache}
 * @param cacheSize    maximum number of responses kept, the least recently used are evicted;
 *                     ignored when caching is disabled
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(boolean cacheEnabled, int cacheSize) {

    public static final int DEFAULT_CACHE_SIZE = 1000;

    public CachePolicy {
        if (cacheEnabled && cacheSize <= 0) {
            throw new IllegalArgumentException("An enabled response cache needs a positive size, got: " + cacheSize);
        }
        if (!cacheEnabled) {
            cacheSize = 0;
        }
    }

    /**
     * @return an in-memory cache of {@value #DEFAULT_CACHE_SIZE} responses
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, DEFAULT_CACHE_SIZE);
    }

    /**
     * @return no caching, every execution reaches the reporting service
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 0);
    }

    /**
     * @param cacheSize maximum number of responses kept
     * @return an in-memory cache of the given size
     */
    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }

    /**
     * @return a new in-memory response cache, or empty when caching is disabled
     */
    public Optional<ReportCache> createCache() {
        return cacheEnabled ? Optional.of(new InMemoryReportCache(cacheSize)) : Optional.empty();
    }
}
