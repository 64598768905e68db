package org.pragmatica.urlkit;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Errors that can occur while registering, looking up, validating or rendering routes.
 */
public sealed interface RoutingError extends UrlKitError {

    record GroupNotFound(String path) implements RoutingError {
        @Override
        public String message() {
            return path.isEmpty()
                   ? "Group not found: empty group path"
                   : "Group not found: " + path;
        }
    }

    record RouteNotFound(String group, String route) implements RoutingError {
        @Override
        public String message() {
            return "Route not found: route '" + route + "' in group " + group;
        }
    }

    record MissingParameter(String template, String name) implements RoutingError {
        @Override
        public String message() {
            return "Missing required parameter '" + name + "' for route template " + template;
        }
    }

    record InvalidParameter(String template, String name, String reason) implements RoutingError {
        @Override
        public String message() {
            return "Invalid value for parameter '" + name + "' in route template " + template + ": " + reason;
        }
    }

    record GroupValidation(String group, List<String> missingRoutes) implements RoutingError {
        public GroupValidation {
            missingRoutes = List.copyOf(missingRoutes);
        }

        @Override
        public String message() {
            return "Group " + group + " is missing routes: " + missingRoutes;
        }
    }

    /**
     * Aggregated outcome of a manager-wide validation. Keys are group paths; values list the
     * missing routes, or a single {@code "Missing group"} entry when the group itself is absent.
     */
    record ValidationFailed(Map<String, List<String>> failures) implements RoutingError {
        public ValidationFailed {
            var copy = new TreeMap<String, List<String>>();
            failures.forEach((group, missing) -> copy.put(group, List.copyOf(missing)));
            failures = Collections.unmodifiableMap(copy);
        }

        @Override
        public String message() {
            return failures.entrySet()
                           .stream()
                           .map(entry -> "group " + entry.getKey() + " missing: " + entry.getValue())
                           .collect(Collectors.joining("; ", "Validation error: ", ""));
        }
    }

    record TemplateSubstitution(String group,
                                String route,
                                String templateOwner,
                                String template,
                                List<String> missing) implements RoutingError {
        public TemplateSubstitution {
            missing = List.copyOf(missing);
        }

        @Override
        public String message() {
            return "Template substitution failed for group " + group + ", route '" + route
                   + "' (template owner " + templateOwner + ", template '" + template
                   + "'): missing variables " + missing;
        }
    }

    record UnsupportedParams(String type, String reason) implements RoutingError {
        @Override
        public String message() {
            return "Unsupported params of type " + type + ": " + reason;
        }
    }

    record UnsupportedQuery(String type) implements RoutingError {
        @Override
        public String message() {
            return "Unsupported query of type " + type + ": expected a map or QueryParams";
        }
    }

    record InvalidGroupPath(String path, String reason) implements RoutingError {
        @Override
        public String message() {
            return "Invalid group path '" + path + "': " + reason;
        }
    }
}
