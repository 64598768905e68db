package org.pragmatica.urlkit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One rendered entry of a navigation sequence.
 *
 * @param group     fully qualified name of the group the route belongs to
 * @param route     route name within the group
 * @param fullRoute dotted {@code group.route} name
 * @param path      raw route template as registered
 * @param url       rendered URL
 * @param params    parameters the URL was rendered with
 */
public record NavigationNode(String group,
                             String route,
                             String fullRoute,
                             String path,
                             String url,
                             Map<String, Object> params) {
    public NavigationNode {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
