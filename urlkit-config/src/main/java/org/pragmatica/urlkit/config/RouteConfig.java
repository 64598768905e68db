package org.pragmatica.urlkit.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top level route configuration: a list of root groups.
 */
public record RouteConfig(@JsonProperty("groups") List<GroupConfig> groups) {
    public RouteConfig {
        groups = groups == null
                 ? List.of()
                 : Collections.unmodifiableList(new ArrayList<>(groups));
    }

    public static RouteConfig routeConfig(GroupConfig... groups) {
        return new RouteConfig(List.of(groups));
    }
}
