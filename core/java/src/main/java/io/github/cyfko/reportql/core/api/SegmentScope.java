package io.github.cyfko.reportql.core.api;

import io.github.cyfko.reportql.core.exception.QueryValidationException;

import java.util.Locale;

/**
 * Entity level a segment condition applies to.
 * <p>
 * Only {@link #USERS} and {@link #SESSIONS} may open a segment expression. All three
 * levels may qualify the metric inside the condition, in which case the
 * {@linkplain #getMetricScope() metric scope} keyword is emitted.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SegmentScope {

    USERS("users", "perUser", true),
    SESSIONS("sessions", "perSession", true),
    HITS("hits", "perHit", false);

    private final String wireName;
    private final String metricScope;
    private final boolean primary;

    SegmentScope(String wireName, String metricScope, boolean primary) {
        this.wireName = wireName;
        this.metricScope = metricScope;
        this.primary = primary;
    }

    public String getWireName() {
        return wireName;
    }

    public String getMetricScope() {
        return metricScope;
    }

    /**
     * @return {@code true} if a segment expression may start with this scope
     */
    public boolean isPrimary() {
        return primary;
    }

    /**
     * Resolves a scope from its plural name ({@code users}, {@code sessions}, {@code hits}).
     *
     * @param name scope name, case-insensitive
     * @return the scope
     * @throws QueryValidationException on unknown names
     */
    public static SegmentScope fromString(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (SegmentScope scope : values()) {
                if (scope.wireName.equals(normalized)) {
                    return scope;
                }
            }
        }
        throw new QueryValidationException("Unknown scope: " + name + ". Choose from: users, sessions, hits.");
    }
}
