package io.github.cyfko.reportql.core.query;

import io.github.cyfko.reportql.core.api.Column;

import java.util.Objects;

/**
 * Sort specification with column and direction.
 *
 * @param column     a {@link Column}, or an id, name or slug
 * @param descending {@code true} for a descending sort
 */
public record SortBy(Object column, boolean descending) {

    /**
     * Canonical constructor with validation.
     */
    public SortBy {
        Objects.requireNonNull(column, "Sorting column is required");

        if (column instanceof String name && name.isBlank()) {
            throw new IllegalArgumentException("column cannot be blank");
        }
    }

    /**
     * Creates ascending sort specification.
     *
     * @param column column or column key
     * @return sort specification with ascending direction
     */
    public static SortBy asc(Object column) {
        return new SortBy(column, false);
    }

    /**
     * Creates descending sort specification.
     *
     * @param column column or column key
     * @return sort specification with descending direction
     */
    public static SortBy desc(Object column) {
        return new SortBy(column, true);
    }
}
