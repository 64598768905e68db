package org.pragmatica.urlkit.path;

import org.pragmatica.urlkit.param.QueryParams;

/**
 * Combines a base URL, a path and query parameters into the final URL string.
 *
 * <p>The path is appended to whatever path the base already has, with exactly one
 * {@code /} between them. A query already present on the base comes first, followed by the
 * encoded parameters. A fragment on the base is moved to the end.
 */
public final class UrlJoiner {
    private UrlJoiner() {}

    public static String join(String base, String path, QueryParams query) {
        var fragmentIndex = base.indexOf('#');
        var fragment = fragmentIndex >= 0
                       ? base.substring(fragmentIndex)
                       : "";
        var withoutFragment = fragmentIndex >= 0
                              ? base.substring(0, fragmentIndex)
                              : base;
        var queryIndex = withoutFragment.indexOf('?');
        var existingQuery = queryIndex >= 0
                            ? withoutFragment.substring(queryIndex + 1)
                            : "";
        var location = queryIndex >= 0
                       ? withoutFragment.substring(0, queryIndex)
                       : withoutFragment;
        var url = new StringBuilder(appendPath(location, path));
        var encoded = query.encode();
        if (!existingQuery.isEmpty() || !encoded.isEmpty()) {
            url.append('?')
               .append(existingQuery);
            if (!existingQuery.isEmpty() && !encoded.isEmpty()) {
                url.append('&');
            }
            url.append(encoded);
        }
        return url.append(fragment)
                  .toString();
    }

    public static String join(String base, String path) {
        return join(base, path, QueryParams.empty());
    }

    private static String appendPath(String location, String path) {
        if (path.isEmpty()) {
            return location;
        }
        if (location.isEmpty()) {
            return path;
        }
        var locationSlash = location.endsWith("/");
        var pathSlash = path.startsWith("/");
        if (locationSlash && pathSlash) {
            return location + path.substring(1);
        }
        if (!locationSlash && !pathSlash) {
            return location + "/" + path;
        }
        return location + path;
    }
}
