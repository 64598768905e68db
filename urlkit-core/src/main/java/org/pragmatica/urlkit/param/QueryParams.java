package org.pragmatica.urlkit.param;

import org.pragmatica.urlkit.RoutingError;
import org.pragmatica.urlkit.UrlKitException;

import java.lang.reflect.Array;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Ordered query string parameters.
 *
 * <p>Order is fixed when the instance is created: single-valued keys first, sorted by key,
 * then multi-valued keys, sorted by key, each value emitted as its own pair in the given
 * order. A multi-valued key with no values is emitted once with an empty value.
 */
public interface QueryParams {
    record QueryPair(String key, String value) {}

    /**
     * All pairs in emission order.
     */
    List<QueryPair> pairs();

    /**
     * Get the first value for a parameter.
     */
    default Optional<String> get(String name) {
        return pairs().stream()
                      .filter(pair -> pair.key()
                                          .equals(name))
                      .map(QueryPair::value)
                      .findFirst();
    }

    /**
     * Get all values for a parameter.
     */
    default List<String> getAll(String name) {
        return pairs().stream()
                      .filter(pair -> pair.key()
                                          .equals(name))
                      .map(QueryPair::value)
                      .toList();
    }

    /**
     * Get all parameters as a map, keys in emission order.
     */
    default Map<String, List<String>> asMap() {
        var map = new LinkedHashMap<String, List<String>>();
        pairs().forEach(pair -> map.computeIfAbsent(pair.key(),
                                                    key -> new ArrayList<>())
                                   .add(pair.value()));
        return map;
    }

    /**
     * Check if parameter exists.
     */
    default boolean has(String name) {
        return get(name).isPresent();
    }

    default boolean isEmpty() {
        return pairs().isEmpty();
    }

    /**
     * Form-encoded query string without the leading {@code ?}. Spaces become {@code +},
     * {@code *} is escaped as {@code %2A} and {@code ~} is left as is.
     */
    default String encode() {
        return pairs().stream()
                      .map(pair -> encodeComponent(pair.key()) + "=" + encodeComponent(pair.value()))
                      .collect(Collectors.joining("&"));
    }

    /**
     * Combine single and multi-valued parameters. Either map may be {@code null}.
     */
    static QueryParams queryParams(Map<String, String> single, Map<String, ? extends Collection<String>> multi) {
        record queryParams(List<QueryPair> pairs) implements QueryParams {}

        var pairs = new ArrayList<QueryPair>();
        if (single != null) {
            new TreeMap<>(single).forEach((key, value) -> pairs.add(new QueryPair(key,
                                                                                  value == null
                                                                                  ? ""
                                                                                  : value)));
        }
        if (multi != null) {
            new TreeMap<>(multi).forEach((key, values) -> {
                if (values == null || values.isEmpty()) {
                    pairs.add(new QueryPair(key, ""));
                } else {
                    values.forEach(value -> pairs.add(new QueryPair(key,
                                                                    value == null
                                                                    ? ""
                                                                    : value)));
                }
            });
        }
        return new queryParams(List.copyOf(pairs));
    }

    static QueryParams queryParams(Map<String, String> single) {
        return queryParams(single, null);
    }

    /**
     * Empty query parameters.
     */
    static QueryParams empty() {
        return queryParams(null, null);
    }

    /**
     * Build query parameters from a loosely typed input. Accepted inputs are {@code null},
     * {@link QueryParams} and maps whose values are strings, collections, arrays or any other
     * object (rendered with {@link String#valueOf(Object)}). A {@code null} value becomes an
     * empty string.
     */
    static QueryParams from(Object input) throws UrlKitException {
        if (input == null) {
            return empty();
        }
        if (input instanceof QueryParams params) {
            return params;
        }
        if (!(input instanceof Map<?, ?> map)) {
            throw new RoutingError.UnsupportedQuery(input.getClass()
                                                         .getName()).exception();
        }
        var single = new LinkedHashMap<String, String>();
        var multi = new LinkedHashMap<String, List<String>>();
        map.forEach((rawKey, value) -> {
            var key = String.valueOf(rawKey);
            if (value instanceof Collection<?> values) {
                multi.put(key,
                          values.stream()
                                .map(String::valueOf)
                                .toList());
                single.remove(key);
            } else if (value != null && value.getClass()
                                             .isArray()) {
                multi.put(key, arrayValues(value));
                single.remove(key);
            } else {
                single.put(key,
                           value == null
                           ? ""
                           : String.valueOf(value));
                multi.remove(key);
            }
        });
        return queryParams(single, multi);
    }

    private static List<String> arrayValues(Object array) {
        var length = Array.getLength(array);
        var values = new ArrayList<String>(length);
        for (int i = 0; i < length; i++ ) {
            values.add(String.valueOf(Array.get(array, i)));
        }
        return values;
    }

    private static String encodeComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                         .replace("*", "%2A")
                         .replace("%7E", "~");
    }
}
