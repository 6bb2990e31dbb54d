package io.github.cyfko.reportql.core.query;

import io.github.cyfko.reportql.core.exception.QueryValidationException;

import java.util.Locale;

/**
 * Sampling level of a core reporting query.
 * <p>
 * Only {@link #FASTER} and {@link #HIGHER_PRECISION} are sent on the wire, as
 * {@code samplingLevel}; {@link #DEFAULT} leaves the choice to the service.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Precision {

    FASTER,
    DEFAULT,
    HIGHER_PRECISION;

    private static final String CHOICES = "Precision should be one of: FASTER, DEFAULT, HIGHER_PRECISION";

    /**
     * @param index 0 ({@code FASTER}), 1 ({@code DEFAULT}) or 2 ({@code HIGHER_PRECISION})
     * @return the precision level
     * @throws QueryValidationException if the index is out of range
     */
    public static Precision fromIndex(int index) {
        Precision[] levels = values();
        if (index < 0 || index >= levels.length) {
            throw new QueryValidationException(CHOICES + ". Received: " + index);
        }
        return levels[index];
    }

    /**
     * @param name level name, case-insensitive
     * @return the precision level
     * @throws QueryValidationException on unknown names
     */
    public static Precision fromString(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (Precision level : values()) {
                if (level.name().equals(normalized)) {
                    return level;
                }
            }
        }
        throw new QueryValidationException(CHOICES + ". Received: " + name);
    }
}
