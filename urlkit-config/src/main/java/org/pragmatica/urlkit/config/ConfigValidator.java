package org.pragmatica.urlkit.config;

import org.pragmatica.urlkit.UrlKitException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Validates route configuration before it is applied.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Every group has a non-blank name without dots</li>
 *   <li>Root group names are unique, as are sibling names</li>
 *   <li>Only root groups declare {@code base_url}</li>
 *   <li>Routes and template variables have values</li>
 * </ul>
 */
public final class ConfigValidator {
    private ConfigValidator() {}

    /**
     * Validate configuration, reporting all validation errors at once.
     */
    public static RouteConfig validate(RouteConfig config) throws UrlKitException {
        var errors = new ArrayList<String>();
        validateGroups(config.groups(), "", true, errors);
        if (!errors.isEmpty()) {
            throw ConfigError.validationFailed(errors)
                             .exception();
        }
        return config;
    }

    private static void validateGroups(List<GroupConfig> groups, String parentPath, boolean roots, List<String> errors) {
        var seen = new HashSet<String>();
        for (int i = 0; i < groups.size(); i++ ) {
            var group = groups.get(i);
            var location = describe(parentPath, i, group);
            if (group == null) {
                errors.add("Group definition " + location + " is empty");
                continue;
            }
            var name = group.name()
                            .trim();
            if (name.isEmpty()) {
                errors.add("Group name is required for " + location);
            } else if (name.contains(".")) {
                errors.add("Group name must not contain '.': " + location);
            } else if (!seen.add(name)) {
                errors.add(roots
                           ? "Duplicate root group name: " + name
                           : "Duplicate group name " + name + " under " + parentPath);
            }
            if (!roots && !group.baseUrl()
                                .isEmpty()) {
                errors.add("base_url is only supported on root groups: " + location);
            }
            group.effectiveRoutes()
                 .forEach((route, template) -> {
                     if (template == null) {
                         errors.add("Route " + route + " in group " + location + " has no template");
                     }
                 });
            group.templateVars()
                 .forEach((key, value) -> {
                     if (value == null) {
                         errors.add("Template variable " + key + " in group " + location + " has no value");
                     }
                 });
            validateGroups(group.groups(), location, false, errors);
        }
    }

    private static String describe(String parentPath, int index, GroupConfig group) {
        var name = group == null || group.name()
                                         .isBlank()
                   ? "#" + index
                   : group.name()
                          .trim();
        return parentPath.isEmpty()
               ? name
               : parentPath + "." + name;
    }
}
