package io.github.cyfko.reportql.core.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builder state of a {@link Query} that is not sent as such on the wire.
 * <p>
 * Filter and segment conditions are kept as groups of compiled expressions so that the
 * wire strings can be rebuilt with the right separators whenever a group is added.
 * </p>
 *
 * @param sort     signed column ids, in sort order
 * @param filters  filter condition groups
 * @param segments segment condition groups
 * @param limit    overall row cap, {@code null} when unlimited
 * @param title    user supplied title, {@code null} when unset
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record QueryOptions(
        List<String> sort,
        List<List<String>> filters,
        List<List<String>> segments,
        Integer limit,
        String title) {

    public QueryOptions {
        sort = sort == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(sort));
        filters = freeze(filters);
        segments = freeze(segments);
    }

    public static QueryOptions empty() {
        return new QueryOptions(null, null, null, null, null);
    }

    public boolean hasLimit() {
        return limit != null;
    }

    private static List<List<String>> freeze(List<List<String>> groups) {
        if (groups == null) {
            return List.of();
        }
        List<List<String>> copy = new ArrayList<>(groups.size());
        for (List<String> group : groups) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(group)));
        }
        return Collections.unmodifiableList(copy);
    }
}
