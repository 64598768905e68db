package org.pragmatica.urlkit.path;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins a group's full path with a route path.
 *
 * <p>The longest run of trailing prefix segments that equals the leading route segments is
 * written once, so {@code /en} + {@code /en/about} gives {@code /en/about}. A trailing slash
 * on the route is kept. When the prefix is exactly {@code /} and the route has segments,
 * the result keeps a double slash ({@code /} + {@code /root} gives {@code //root}). Any
 * other prefix made only of slashes contributes nothing.
 */
public final class PathJoiner {
    private PathJoiner() {}

    private record Segments(List<String> names, boolean trailingSlash, boolean root) {
        static Segments split(String path) {
            if (path.isEmpty()) {
                return new Segments(List.of(), false, false);
            }
            if (path.equals("/")) {
                return new Segments(List.of(), true, true);
            }
            var trailing = path.endsWith("/");
            var trimmed = trimSlashes(path);
            if (trimmed.isEmpty()) {
                return new Segments(List.of(), trailing, false);
            }
            return new Segments(List.of(trimmed.split("/", - 1)), trailing, false);
        }
    }

    public static String join(String prefix, String route) {
        var prefixSegments = Segments.split(prefix);
        var routeSegments = Segments.split(route);
        var overlap = longestOverlap(prefixSegments.names(), routeSegments.names());
        var merged = new ArrayList<>(prefixSegments.names());
        merged.addAll(routeSegments.names()
                                   .subList(overlap,
                                            routeSegments.names()
                                                         .size()));
        if (prefixSegments.root() && !routeSegments.names()
                                                    .isEmpty()) {
            merged.add(0, "");
        }
        if (merged.isEmpty()) {
            return joinWithoutSegments(prefix, route, routeSegments.root());
        }
        var path = "/" + String.join("/", merged);
        if (routeSegments.trailingSlash() && !path.endsWith("/")) {
            path += "/";
        }
        return path;
    }

    private static String joinWithoutSegments(String prefix, String route, boolean routeIsRoot) {
        if (routeIsRoot) {
            if (prefix.isEmpty()) {
                return "/";
            }
            var base = withLeadingSlash(prefix);
            return base.endsWith("/")
                   ? base
                   : base + "/";
        }
        if (!prefix.isEmpty()) {
            return withLeadingSlash(prefix);
        }
        if (!route.isEmpty()) {
            return withLeadingSlash(route);
        }
        return "";
    }

    private static int longestOverlap(List<String> prefix, List<String> route) {
        var max = Math.min(prefix.size(), route.size());
        for (var k = max; k > 0; k-- ) {
            if (prefix.subList(prefix.size() - k,
                               prefix.size())
                      .equals(route.subList(0, k))) {
                return k;
            }
        }
        return 0;
    }

    private static String withLeadingSlash(String path) {
        return path.startsWith("/")
               ? path
               : "/" + path;
    }

    private static String trimSlashes(String path) {
        var start = 0;
        var end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++ ;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end-- ;
        }
        return path.substring(start, end);
    }
}
