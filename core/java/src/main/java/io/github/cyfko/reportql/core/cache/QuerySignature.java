package io.github.cyfko.reportql.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Computes the canonical signature of a set of wire parameters.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Sort parameter entries by key name</li>
 *   <li>Serialize them as a JSON array of {@code [key, value]} pairs, map values with sorted keys</li>
 *   <li>Hash the UTF-8 bytes with SHA-1 and hex-encode the digest (40 characters)</li>
 * </ol>
 *
 * <p>
 * Two queries with identical wire parameters get the same signature no matter in which
 * order their builder methods were called; changing any single parameter changes it.
 * </p>
 *
 * <pre>{@code
 * String key = QuerySignature.of(query.build());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QuerySignature {

    // nested maps are written key-sorted too
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private QuerySignature() {
    }

    /**
     * @param parameters wire parameters of a query
     * @return lower-case hex SHA-1 digest of the canonical form
     */
    public static String of(Map<String, Object> parameters) {
        return sha1(canonicalize(parameters));
    }

    /**
     * @param parameters wire parameters of a query
     * @return canonical JSON form, e.g. {@code [["end_date","2020-01-31"],["ids","ga:1"]]}
     */
    static String canonicalize(Map<String, Object> parameters) {
        List<List<Object>> entries = new ArrayList<>();
        parameters.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> entries.add(Arrays.asList(entry.getKey(), entry.getValue())));

        try {
            return MAPPER.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize query parameters", e);
        }
    }

    private static String sha1(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }
}
