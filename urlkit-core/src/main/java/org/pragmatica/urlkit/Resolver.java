package org.pragmatica.urlkit;

import java.util.Map;

/**
 * Minimal URL resolution contract for consumers that only need to turn a group path and a
 * route name into a URL, for example template helpers.
 */
@FunctionalInterface
public interface Resolver {
    String resolve(String groupPath, String route, Map<String, ?> params, Map<String, String> query) throws UrlKitException;
}
