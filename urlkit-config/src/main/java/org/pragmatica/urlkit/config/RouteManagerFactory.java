package org.pragmatica.urlkit.config;

import org.pragmatica.urlkit.Group;
import org.pragmatica.urlkit.RouteManager;
import org.pragmatica.urlkit.UrlKitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link RouteManager} from validated configuration.
 */
public final class RouteManagerFactory {
    private static final Logger log = LoggerFactory.getLogger(RouteManagerFactory.class);

    private RouteManagerFactory() {}

    public static RouteManager fromConfig(RouteConfig config) throws UrlKitException {
        var manager = RouteManager.routeManager();
        apply(manager, config);
        return manager;
    }

    /**
     * Register every group of {@code config} in an existing manager. Routes of groups that
     * already exist are merged.
     */
    public static void apply(RouteManager manager, RouteConfig config) throws UrlKitException {
        ConfigValidator.validate(config);
        for (var rootConfig : config.groups()) {
            var name = rootConfig.name()
                                 .trim();
            manager.registerGroup(name, rootConfig.baseUrl(), rootConfig.effectiveRoutes());
            var root = manager.getGroup(name);
            if (!rootConfig.path()
                           .isEmpty()) {
                root.setPath(rootConfig.path());
            }
            applyTemplate(root, rootConfig);
            applyChildren(root, rootConfig);
        }
        log.debug("Applied route configuration with {} root group(s)",
                  config.groups()
                        .size());
    }

    private static void applyChildren(Group parent, GroupConfig parentConfig) {
        for (var childConfig : parentConfig.groups()) {
            var child = parent.registerGroup(childConfig.name()
                                                        .trim(),
                                             childConfig.path(),
                                             childConfig.effectiveRoutes());
            if (!childConfig.path()
                            .isEmpty()) {
                child.setPath(childConfig.path());
            }
            applyTemplate(child, childConfig);
            applyChildren(child, childConfig);
        }
    }

    private static void applyTemplate(Group group, GroupConfig config) {
        if (!config.urlTemplate()
                   .isEmpty()) {
            group.setUrlTemplate(config.urlTemplate());
        }
        config.templateVars()
              .forEach(group::setTemplateVar);
    }
}
