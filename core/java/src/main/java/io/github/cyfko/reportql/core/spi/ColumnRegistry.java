package io.github.cyfko.reportql.core.spi;

import io.github.cyfko.reportql.core.api.Column;
import io.github.cyfko.reportql.core.exception.ColumnNotFoundException;
import io.github.cyfko.reportql.core.exception.QueryValidationException;

import java.util.Optional;

/**
 * Resolves column names and identifiers into {@link Column} descriptors.
 * <p>
 * Lookups are case-insensitive and accept the wire id ({@code ga:pageviews}), the
 * unprefixed id ({@code pageviews}), the human name ({@code Pageviews}) or the slug.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ColumnRegistry {

    /**
     * @param key id, name or slug
     * @return the column, or empty if unknown
     */
    Optional<Column> find(String key);

    /**
     * @param key id, name or slug
     * @return the column
     * @throws ColumnNotFoundException if unknown
     */
    default Column get(String key) {
        return find(key).orElseThrow(() -> new ColumnNotFoundException(key, "Unknown column: " + key));
    }

    /**
     * Resolves a column reference that is either a {@link Column} (returned unchanged, no
     * lookup) or a {@link String} key.
     *
     * @param column column object or key
     * @return the resolved column
     * @throws QueryValidationException if {@code column} is of another type
     * @throws ColumnNotFoundException if the key is unknown
     */
    default Column resolve(Object column) {
        if (column instanceof Column resolved) {
            return resolved;
        }
        if (column instanceof String key) {
            return get(key);
        }
        throw new QueryValidationException("Expected a column or a column name. Received: " + column);
    }
}
