package org.pragmatica.urlkit.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of a group and its descendants.
 *
 * @param name         group name, required
 * @param baseUrl      base URL, roots only
 * @param path         mount path relative to the parent
 * @param routes       route name to template
 * @param paths        legacy alias for {@code routes}, used only when {@code routes} is empty
 * @param urlTemplate  URL template, empty for none
 * @param templateVars variables defined on this group
 * @param groups       child groups
 */
public record GroupConfig(@JsonProperty("name") String name,
                          @JsonProperty("base_url") String baseUrl,
                          @JsonProperty("path") String path,
                          @JsonProperty("routes") Map<String, String> routes,
                          @JsonProperty("paths") Map<String, String> paths,
                          @JsonProperty("url_template") String urlTemplate,
                          @JsonProperty("template_vars") Map<String, String> templateVars,
                          @JsonProperty("groups") List<GroupConfig> groups) {
    public GroupConfig {
        name = orEmpty(name);
        baseUrl = orEmpty(baseUrl);
        path = orEmpty(path);
        routes = copy(routes);
        paths = copy(paths);
        urlTemplate = orEmpty(urlTemplate);
        templateVars = copy(templateVars);
        groups = groups == null
                 ? List.of()
                 : Collections.unmodifiableList(new ArrayList<>(groups));
    }

    public static GroupConfig root(String name, String baseUrl, Map<String, String> routes) {
        return new GroupConfig(name, baseUrl, "", routes, null, "", null, null);
    }

    public static GroupConfig child(String name, String path, Map<String, String> routes) {
        return new GroupConfig(name, "", path, routes, null, "", null, null);
    }

    public GroupConfig withUrlTemplate(String template) {
        return new GroupConfig(name, baseUrl, path, routes, paths, template, templateVars, groups);
    }

    public GroupConfig withTemplateVars(Map<String, String> vars) {
        return new GroupConfig(name, baseUrl, path, routes, paths, urlTemplate, vars, groups);
    }

    public GroupConfig withGroups(GroupConfig... children) {
        return new GroupConfig(name, baseUrl, path, routes, paths, urlTemplate, templateVars, List.of(children));
    }

    /**
     * Routes to register: {@code routes}, or the legacy {@code paths} when no routes are given.
     */
    @JsonIgnore
    public Map<String, String> effectiveRoutes() {
        return routes.isEmpty()
               ? paths
               : routes;
    }

    private static String orEmpty(String value) {
        return value == null
               ? ""
               : value;
    }

    private static Map<String, String> copy(Map<String, String> map) {
        return map == null
               ? Map.of()
               : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
