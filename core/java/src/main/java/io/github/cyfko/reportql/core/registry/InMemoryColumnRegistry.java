package io.github.cyfko.reportql.core.registry;

import io.github.cyfko.reportql.core.api.Column;
import io.github.cyfko.reportql.core.spi.ColumnRegistry;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, in-memory {@link ColumnRegistry}.
 * <p>
 * Every registered column is indexed under its id, unprefixed id, name and slug, all
 * normalized to lower case, so lookups are case-insensitive. Columns are typically loaded
 * once from the reporting service's metadata API and registered in bulk.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * InMemoryColumnRegistry columns = new InMemoryColumnRegistry(List.of(
 *     Column.metric("ga:pageviews", "Pageviews", DataType.INTEGER),
 *     Column.dimension("ga:date", "Date", DataType.DATE)));
 *
 * columns.get("PAGEVIEWS");   // ga:pageviews
 * columns.get("date");        // ga:date
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class InMemoryColumnRegistry implements ColumnRegistry {

    private final Map<String, Column> index = new ConcurrentHashMap<>();
    private final Map<String, Column> columns = new ConcurrentHashMap<>();

    public InMemoryColumnRegistry() {
    }

    public InMemoryColumnRegistry(Collection<Column> columns) {
        columns.forEach(this::register);
    }

    /**
     * Registers a column under all its keys.
     * <p>
     * A key already claimed by another column keeps pointing at the first one, except for
     * wire ids which must be unique.
     * </p>
     *
     * @param column the column to register
     * @throws IllegalArgumentException if a column with the same id is already registered
     */
    public void register(Column column) {
        Objects.requireNonNull(column, "column");
        Column previous = columns.putIfAbsent(column.id().toLowerCase(Locale.ROOT), column);
        if (previous != null) {
            throw new IllegalArgumentException("Column [" + column.id() + "] is already registered.");
        }
        // ids win over names and slugs of other columns
        index.put(normalize(column.id()), column);
        for (String key : List.of(Column.unprefixed(column.id()), column.name(), column.slug())) {
            index.putIfAbsent(normalize(key), column);
        }
    }

    @Override
    public Optional<Column> find(String key) {
        if (key == null || key.isBlank()) return Optional.empty();
        return Optional.ofNullable(index.get(normalize(key)));
    }

    /**
     * @return snapshot of every registered column
     */
    public Set<Column> getAllColumns() {
        return Collections.unmodifiableSet(new HashSet<>(columns.values()));
    }

    private static String normalize(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }
}
