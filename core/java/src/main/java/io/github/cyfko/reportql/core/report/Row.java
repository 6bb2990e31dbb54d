package io.github.cyfko.reportql.core.report;

import io.github.cyfko.reportql.core.api.Column;
import io.github.cyfko.reportql.core.exception.ColumnNotFoundException;

import java.util.*;

/**
 * Typed tuple holding one result row, addressable by position or by column.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Row {

    private final List<Column> headers;
    private final List<Object> values;

    Row(List<Column> headers, List<Object> values) {
        this.headers = headers;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public Object get(int index) {
        return values.get(index);
    }

    /**
     * @param column a {@link Column} or an id, name or slug
     * @return the value of that column in this row
     * @throws ColumnNotFoundException if the column is not part of the row
     */
    public Object get(Object column) {
        return values.get(Report.indexOf(headers, column));
    }

    public List<Object> values() {
        return values;
    }

    /**
     * @return slug → value, in column order
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            map.put(headers.get(i).slug(), values.get(i));
        }
        return map;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row row)) return false;
        return values.equals(row.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + asMap();
    }
}
