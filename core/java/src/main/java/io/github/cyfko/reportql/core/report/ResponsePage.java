package io.github.cyfko.reportql.core.report;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;

/**
 * Typed view of one response page of the reporting service.
 *
 * <pre>{@code
 * {
 *   "columnHeaders": [{"name": "ga:date"}, {"name": "ga:pageviews"}],
 *   "rows": [["20200101", "42"]],                 // absent when nothing matched
 *   "totalsForAllResults": {"ga:pageviews": "42"},
 *   "nextLink": "https://..."                      // absent on the last page
 * }
 * }</pre>
 *
 * @param columnHeaders header names, in column order
 * @param rows          raw rows, empty when the response carried none
 * @param totals        metric id → raw total
 * @param nextLink      link to the following page, {@code null} on the last page
 * @param raw           the undecoded response
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ResponsePage(
        List<String> columnHeaders,
        List<List<String>> rows,
        Map<String, String> totals,
        String nextLink,
        JsonNode raw) {

    public ResponsePage {
        columnHeaders = columnHeaders == null ? List.of() : List.copyOf(columnHeaders);
        rows = rows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rows));
        totals = totals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(totals));
    }

    /**
     * Decodes a raw response.
     *
     * @param raw response body
     * @return the page
     */
    public static ResponsePage from(JsonNode raw) {
        Objects.requireNonNull(raw, "Response cannot be null");

        List<String> headers = new ArrayList<>();
        for (JsonNode header : raw.path("columnHeaders")) {
            headers.add(header.path("name").asText());
        }

        List<List<String>> rows = new ArrayList<>();
        for (JsonNode row : raw.path("rows")) {
            List<String> cells = new ArrayList<>();
            for (JsonNode cell : row) {
                cells.add(cell.isNull() ? null : cell.asText());
            }
            rows.add(Collections.unmodifiableList(cells));
        }

        Map<String, String> totals = new LinkedHashMap<>();
        raw.path("totalsForAllResults").fields()
                .forEachRemaining(entry -> totals.put(entry.getKey(), entry.getValue().asText()));

        String nextLink = raw.hasNonNull("nextLink") ? raw.get("nextLink").asText() : null;

        return new ResponsePage(headers, rows, totals, nextLink, raw);
    }

    /**
     * @return {@code true} if the service announced a following page
     */
    public boolean hasNextPage() {
        return nextLink != null;
    }
}
