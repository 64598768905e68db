package org.pragmatica.urlkit;

import org.pragmatica.urlkit.param.ParamSource;
import org.pragmatica.urlkit.param.QueryParams;
import org.pragmatica.urlkit.path.PathJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Registry of named root groups.
 *
 * <p>Groups are addressed by dotted paths such as {@code frontend.marketing.landing}: the first
 * element names a root, the rest walk down through children.
 */
public interface RouteManager extends Resolver {

    /**
     * Register a root group, or merge {@code routes} into an existing root of that name. The
     * base URL of an existing root is left unchanged.
     */
    RouteManager registerGroup(String name, String baseUrl, Map<String, String> routes);

    Group getGroup(String path) throws UrlKitException;

    default Group group(String path) {
        return Must.must(() -> getGroup(path));
    }

    /**
     * Get the group at {@code path}, creating missing non-root elements. Each element is
     * {@code name} (mounted at {@code /name}) or {@code name:/custom} (mounted at
     * {@code /custom}). Existing groups are returned as they are, even when a different mount
     * path is given. The root must already exist.
     */
    Group ensureGroup(String path) throws UrlKitException;

    Group addRoutes(String path, Map<String, String> routes) throws UrlKitException;

    /**
     * Check that every listed group exists and has the listed routes. All problems are
     * reported together in a {@link RoutingError.ValidationFailed}.
     */
    void validate(Map<String, ? extends Collection<String>> expected) throws UrlKitException;

    default RouteManager mustValidate(Map<String, ? extends Collection<String>> expected) {
        return Must.must(() -> {
            validate(expected);
            return this;
        });
    }

    /**
     * Human readable, deterministic dump of all groups, routes and template settings.
     */
    String debugTree();

    /**
     * Like {@link #resolve(String, String, Map, Map)} but accepts loosely typed input: params
     * may be anything {@link ParamSource#of(Object)} accepts, query anything
     * {@link QueryParams#from(Object)} accepts.
     */
    String resolveWith(String groupPath, String route, Object params, Object query) throws UrlKitException;

    /**
     * Group path joined with the raw, unexpanded route template.
     */
    String routePath(String groupPath, String route) throws UrlKitException;

    Set<String> rootNames();

    static RouteManager routeManager() {
        return new RouteManagerImpl();
    }
}

final class RouteManagerImpl implements RouteManager {
    private static final Logger log = LoggerFactory.getLogger(RouteManagerImpl.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, GroupImpl> roots = new HashMap<>();

    @Override
    public RouteManager registerGroup(String name, String baseUrl, Map<String, String> routes) {
        GroupImpl existing;
        lock.writeLock()
            .lock();
        try{
            existing = roots.get(name);
            if (existing == null) {
                roots.put(name, GroupImpl.root(name, baseUrl, routes));
                log.debug("Registered root group {} with base URL {}", name, baseUrl);
            }
        } finally{
            lock.writeLock()
                .unlock();
        }
        if (existing != null) {
            existing.addRoutes(routes);
        }
        return this;
    }

    @Override
    public Group getGroup(String path) throws UrlKitException {
        return lookup(path);
    }

    private GroupImpl lookup(String path) throws UrlKitException {
        if (path == null || path.isEmpty()) {
            throw new RoutingError.GroupNotFound("").exception();
        }
        var exact = root(path);
        if (exact.isPresent()) {
            return exact.get();
        }
        var parts = path.split("\\.", - 1);
        var current = root(parts[0].trim()).orElse(null);
        for (int i = 1; current != null && i < parts.length; i++ ) {
            var part = parts[i].trim();
            current = part.isEmpty()
                      ? null
                      : current.child(part)
                               .orElse(null);
        }
        if (current == null) {
            throw new RoutingError.GroupNotFound(path).exception();
        }
        return current;
    }

    private Optional<GroupImpl> root(String name) {
        return read(() -> Optional.ofNullable(roots.get(name)));
    }

    @Override
    public Group ensureGroup(String path) throws UrlKitException {
        if (path == null || path.isEmpty()) {
            throw new RoutingError.GroupNotFound("").exception();
        }
        var parts = path.split("\\.", - 1);
        var rootName = parts[0].trim();
        var current = root(rootName).orElse(null);
        if (current == null) {
            throw new RoutingError.GroupNotFound(rootName).exception();
        }
        for (int i = 1; i < parts.length; i++ ) {
            var segment = GroupSegment.parse(path, parts[i]);
            current = current.ensureChild(segment.name(), segment.path());
        }
        return current;
    }

    @Override
    public Group addRoutes(String path, Map<String, String> routes) throws UrlKitException {
        var group = lookup(path);
        group.addRoutes(routes);
        return group;
    }

    @Override
    public void validate(Map<String, ? extends Collection<String>> expected) throws UrlKitException {
        var failures = new TreeMap<String, List<String>>();
        for (var entry : expected.entrySet()) {
            Group group;
            try{
                group = lookup(entry.getKey());
            } catch (UrlKitException e) {
                failures.put(entry.getKey(), List.of("Missing group"));
                continue;
            }
            try{
                group.validate(entry.getValue());
            } catch (UrlKitException e) {
                failures.put(entry.getKey(),
                             e.error() instanceof RoutingError.GroupValidation validation
                             ? validation.missingRoutes()
                             : List.of(e.getMessage()));
            }
        }
        if (!failures.isEmpty()) {
            throw new RoutingError.ValidationFailed(failures).exception();
        }
    }

    @Override
    public String debugTree() {
        var snapshot = read(() -> new TreeMap<String, Group>(roots));
        if (snapshot.isEmpty()) {
            return "RouteManager: <empty>";
        }
        var tree = new StringBuilder("RouteManager Debug Tree:\n");
        var first = true;
        for (var group : snapshot.values()) {
            if (!first) {
                tree.append('\n');
            }
            first = false;
            appendGroup(tree, group, 0);
        }
        return tree.toString();
    }

    private static void appendGroup(StringBuilder tree, Group group, int depth) {
        var indent = "  ".repeat(depth);
        var meta = new ArrayList<String>(2);
        if (group.parent()
                 .isEmpty()) {
            meta.add("base=\"" + group.baseUrl() + "\"");
        }
        if (!group.path()
                  .isEmpty()) {
            meta.add("path=\"" + group.path() + "\"");
        }
        var displayName = group.fqn()
                               .isEmpty()
                          ? "(unnamed)"
                          : group.fqn();
        tree.append(indent)
            .append("- ")
            .append(displayName);
        if (!meta.isEmpty()) {
            tree.append(" (")
                .append(String.join(", ", meta))
                .append(')');
        }
        tree.append('\n');
        var template = group.urlTemplate();
        if (!template.isEmpty()) {
            tree.append(indent)
                .append("  template: \"")
                .append(template)
                .append("\"\n");
        }
        var vars = group.collectTemplateVars();
        if (!vars.isEmpty()) {
            tree.append(indent)
                .append("  vars:\n");
            vars.forEach((key, value) -> tree.append(indent)
                                             .append("    ")
                                             .append(key)
                                             .append(" = \"")
                                             .append(value)
                                             .append("\"\n"));
        }
        var routes = group.routes();
        if (!routes.isEmpty()) {
            tree.append(indent)
                .append("  routes:\n");
            routes.forEach((routeName, routeTemplate) -> tree.append(indent)
                                                             .append("    - ")
                                                             .append(routeName)
                                                             .append(": ")
                                                             .append(routeTemplate)
                                                             .append('\n'));
        }
        var children = group.children();
        var first = true;
        for (var child : children.values()) {
            if (!first) {
                tree.append('\n');
            }
            first = false;
            appendGroup(tree, child, depth + 1);
        }
    }

    @Override
    public String resolve(String groupPath,
                          String route,
                          Map<String, ?> params,
                          Map<String, String> query) throws UrlKitException {
        var group = lookup(groupPath);
        var values = new HashMap<String, String>();
        if (params != null) {
            params.forEach((key, value) -> {
                if (value != null) {
                    values.put(key, String.valueOf(value));
                }
            });
        }
        return group.render(route, values, QueryParams.queryParams(query));
    }

    @Override
    public String resolveWith(String groupPath, String route, Object params, Object query) throws UrlKitException {
        var source = ParamSource.of(params);
        var queryParams = QueryParams.from(query);
        var group = lookup(groupPath);
        var values = new HashMap<String, String>();
        source.params()
              .forEach(param -> {
                  if (param.value() == null) {
                      values.remove(param.key());
                  } else {
                      values.put(param.key(), param.value());
                  }
              });
        return group.render(route, values, queryParams);
    }

    @Override
    public String routePath(String groupPath, String route) throws UrlKitException {
        var group = lookup(groupPath);
        return PathJoiner.join(group.fullPath(), group.route(route));
    }

    @Override
    public Set<String> rootNames() {
        return read(() -> new TreeSet<>(roots.keySet()));
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock()
            .lock();
        try{
            return action.get();
        } finally{
            lock.readLock()
                .unlock();
        }
    }
}
