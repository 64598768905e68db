package org.pragmatica.urlkit;

import org.pragmatica.urlkit.param.QueryParams;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Node of the route tree.
 *
 * <p>A group owns named routes, child groups, local template variables and an optional URL
 * template. Roots carry the base URL; every group contributes its mount path to the paths of
 * its descendants. When the group or one of its ancestors has a URL template, routes are
 * rendered through that template instead of plain path concatenation.
 *
 * <p>All operations are safe to call from multiple threads.
 */
public interface Group {

    /**
     * Create a detached root group.
     */
    static Group root(String name, String baseUrl, Map<String, String> routes) {
        return GroupImpl.root(name, baseUrl, routes);
    }

    String name();

    /**
     * Mount path of this group relative to its parent.
     */
    String path();

    void setPath(String path);

    /**
     * Base URL; only meaningful on roots, empty elsewhere.
     */
    String baseUrl();

    Optional<Group> parent();

    Group root();

    /**
     * Dotted names from the root down to this group.
     */
    String fqn();

    /**
     * Concatenation of the mount paths from the root down to this group.
     */
    String fullPath();

    /**
     * Get or create a child. An existing child gets the routes merged in and keeps its path
     * unless it has none yet.
     */
    Group registerGroup(String name, String path, Map<String, String> routes);

    Group getGroup(String childName) throws UrlKitException;

    default Group group(String childName) {
        return Must.must(() -> getGroup(childName));
    }

    /**
     * Snapshot of the children, sorted by name.
     */
    Map<String, Group> children();

    void addRoutes(Map<String, String> routes);

    /**
     * Snapshot of the raw route templates, sorted by route name.
     */
    Map<String, String> routes();

    String route(String routeName) throws UrlKitException;

    default String mustRoute(String routeName) {
        return Must.must(() -> route(routeName));
    }

    /**
     * Check that every listed route exists; fails with {@link RoutingError.GroupValidation}
     * naming the missing ones. A {@code null} list requires nothing.
     */
    void validate(Collection<String> routeNames) throws UrlKitException;

    /**
     * Set the URL template; an empty string disables template rendering for this group.
     */
    void setUrlTemplate(String template);

    String urlTemplate();

    void setTemplateVar(String key, String value);

    /**
     * Variable defined on this group only, ancestors are not consulted.
     */
    Optional<String> templateVar(String key);

    /**
     * Variables merged from the root down to this group; nearer groups win.
     */
    Map<String, String> collectTemplateVars();

    /**
     * Nearest group, starting with this one, that has a non-empty URL template.
     */
    Optional<Group> findTemplateOwner();

    UrlBuilder builder(String routeName);

    String render(String routeName, Map<String, String> params, QueryParams query) throws UrlKitException;

    default String render(String routeName, Map<String, String> params) throws UrlKitException {
        return render(routeName, params, QueryParams.empty());
    }

    /**
     * Render the listed routes in order. Blank names are skipped; the first failure aborts.
     *
     * @param params supplies the parameters for a route name, may return {@code null}
     */
    List<NavigationNode> navigation(List<String> routeNames,
                                    Function<String, ? extends Map<String, ?>> params) throws UrlKitException;
}
