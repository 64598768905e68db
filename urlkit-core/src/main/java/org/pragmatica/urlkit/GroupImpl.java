package org.pragmatica.urlkit;

import org.pragmatica.urlkit.param.QueryParams;
import org.pragmatica.urlkit.path.PathJoiner;
import org.pragmatica.urlkit.path.PathTemplate;
import org.pragmatica.urlkit.path.UrlJoiner;
import org.pragmatica.urlkit.template.TemplateSubstitution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Lock-per-node group implementation.
 *
 * <p>Each node guards its own mutable state with a read/write lock. A thread never holds
 * the locks of two nodes at once: walks towards the root or into children take and release
 * one node lock per step.
 */
final class GroupImpl implements Group {
    private static final Logger log = LoggerFactory.getLogger(GroupImpl.class);

    static final String ROUTE_PATH = "route_path";
    static final String BASE_URL = "base_url";
    static final String ROUTE_PATH_SUFFIX = "route_path_suffix";
    static final String DEFAULT_ROUTE_PATH_SUFFIX = "/";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final String name;
    private final String baseUrl;
    private final GroupImpl parent;

    private final Map<String, String> routes = new HashMap<>();
    private final Map<String, PathTemplate> compiledRoutes = new HashMap<>();
    private final Map<String, GroupImpl> children = new HashMap<>();
    private final Map<String, String> templateVars = new HashMap<>();
    private String path;
    private String urlTemplate = "";

    private record TemplateOwner(GroupImpl group, String template) {}

    private GroupImpl(String name, String baseUrl, String path, GroupImpl parent, Map<String, String> routes) {
        this.name = Objects.requireNonNull(name, "name");
        this.baseUrl = baseUrl == null
                       ? ""
                       : baseUrl;
        this.path = path == null
                    ? ""
                    : path;
        this.parent = parent;
        if (routes != null) {
            routes.forEach((routeName, template) -> {
                this.routes.put(routeName, template);
                this.compiledRoutes.put(routeName, PathTemplate.compile(template));
            });
        }
    }

    static GroupImpl root(String name, String baseUrl, Map<String, String> routes) {
        return new GroupImpl(name, baseUrl, "", null, routes);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String path() {
        return read(() -> path);
    }

    @Override
    public void setPath(String path) {
        write(() -> this.path = path == null
                                ? ""
                                : path);
    }

    @Override
    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public Optional<Group> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public Group root() {
        var current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    @Override
    public String fqn() {
        if (parent == null) {
            return name;
        }
        var parentName = parent.fqn();
        if (parentName.isEmpty()) {
            return name;
        }
        if (name.isEmpty()) {
            return parentName;
        }
        return parentName + "." + name;
    }

    @Override
    public String fullPath() {
        return parent == null
               ? path()
               : parent.fullPath() + path();
    }

    @Override
    public Group registerGroup(String childName, String childPath, Map<String, String> childRoutes) {
        Objects.requireNonNull(childName, "childName");
        GroupImpl child;
        boolean created;
        lock.writeLock()
            .lock();
        try{
            var existing = children.get(childName);
            created = existing == null;
            child = created
                    ? new GroupImpl(childName, "", childPath, this, childRoutes)
                    : existing;
            if (created) {
                children.put(childName, child);
            }
        } finally{
            lock.writeLock()
                .unlock();
        }
        if (created) {
            log.debug("Registered group {} at {}", child.fqn(), child.path());
            return child;
        }
        if (childRoutes != null && !childRoutes.isEmpty()) {
            child.addRoutes(childRoutes);
        }
        if (childPath != null && !childPath.isEmpty()) {
            child.mountIfUnset(childPath);
        }
        return child;
    }

    /**
     * Get the named child, creating it at {@code childPath} when absent. An existing child is
     * returned unchanged.
     */
    GroupImpl ensureChild(String childName, String childPath) {
        lock.writeLock()
            .lock();
        try{
            var existing = children.get(childName);
            if (existing != null) {
                return existing;
            }
            var child = new GroupImpl(childName, "", childPath, this, Map.of());
            children.put(childName, child);
            log.debug("Created group {} at {}", childName, childPath);
            return child;
        } finally{
            lock.writeLock()
                .unlock();
        }
    }

    Optional<GroupImpl> child(String childName) {
        return read(() -> Optional.ofNullable(children.get(childName)));
    }

    private void mountIfUnset(String newPath) {
        write(() -> {
            if (path.isEmpty()) {
                path = newPath;
            }
        });
    }

    @Override
    public Group getGroup(String childName) throws UrlKitException {
        var found = child(childName);
        if (found.isEmpty()) {
            var parentName = displayName();
            throw new RoutingError.GroupNotFound(parentName + "." + childName).exception();
        }
        return found.get();
    }

    @Override
    public Map<String, Group> children() {
        return read(() -> Collections.unmodifiableMap(new TreeMap<String, Group>(children)));
    }

    @Override
    public void addRoutes(Map<String, String> newRoutes) {
        if (newRoutes == null || newRoutes.isEmpty()) {
            return;
        }
        var compiled = new HashMap<String, PathTemplate>();
        newRoutes.forEach((routeName, template) -> compiled.put(routeName, PathTemplate.compile(template)));
        write(() -> {
            routes.putAll(newRoutes);
            compiledRoutes.putAll(compiled);
        });
        log.debug("Added {} route(s) to group {}", newRoutes.size(), displayName());
    }

    @Override
    public Map<String, String> routes() {
        return read(() -> Collections.unmodifiableMap(new TreeMap<>(routes)));
    }

    @Override
    public String route(String routeName) throws UrlKitException {
        var template = read(() -> routes.get(routeName));
        if (template == null) {
            throw new RoutingError.RouteNotFound(displayName(), routeName).exception();
        }
        return template;
    }

    @Override
    public void validate(Collection<String> routeNames) throws UrlKitException {
        if (routeNames == null) {
            return;
        }
        var missing = read(() -> routeNames.stream()
                                           .filter(routeName -> !routes.containsKey(routeName))
                                           .toList());
        if (!missing.isEmpty()) {
            throw new RoutingError.GroupValidation(displayName(), missing).exception();
        }
    }

    @Override
    public void setUrlTemplate(String template) {
        write(() -> urlTemplate = template == null
                                  ? ""
                                  : template);
    }

    @Override
    public String urlTemplate() {
        return read(() -> urlTemplate);
    }

    @Override
    public void setTemplateVar(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        write(() -> templateVars.put(key, value));
    }

    @Override
    public Optional<String> templateVar(String key) {
        return read(() -> Optional.ofNullable(templateVars.get(key)));
    }

    @Override
    public Map<String, String> collectTemplateVars() {
        return new TreeMap<>(mergedTemplateVars());
    }

    private Map<String, String> mergedTemplateVars() {
        var chain = new ArrayList<GroupImpl>();
        for (var current = this; current != null; current = current.parent) {
            chain.add(current);
        }
        Collections.reverse(chain);
        var merged = new HashMap<String, String>();
        chain.forEach(group -> merged.putAll(group.read(() -> new HashMap<>(group.templateVars))));
        return merged;
    }

    @Override
    public Optional<Group> findTemplateOwner() {
        return templateOwner().map(TemplateOwner::group);
    }

    private Optional<TemplateOwner> templateOwner() {
        for (var current = this; current != null; current = current.parent) {
            var template = current.urlTemplate();
            if (!template.isEmpty()) {
                return Optional.of(new TemplateOwner(current, template));
            }
        }
        return Optional.empty();
    }

    @Override
    public UrlBuilder builder(String routeName) {
        return new UrlBuilder(this, routeName);
    }

    @Override
    public String render(String routeName, Map<String, String> params, QueryParams query) throws UrlKitException {
        var compiled = read(() -> compiledRoutes.get(routeName));
        if (compiled == null) {
            throw new RoutingError.RouteNotFound(displayName(), routeName).exception();
        }
        var routePath = compiled.expand(params == null
                                        ? Map.of()
                                        : params);
        var owner = templateOwner();
        if (owner.isPresent()) {
            return renderTemplate(routeName, routePath, owner.get(), query);
        }
        var fullPath = PathJoiner.join(fullPath(), routePath);
        return UrlJoiner.join(root().baseUrl(),
                              fullPath,
                              query == null
                              ? QueryParams.empty()
                              : query);
    }

    private String renderTemplate(String routeName,
                                  String routePath,
                                  TemplateOwner owner,
                                  QueryParams query) throws UrlKitException {
        var vars = mergedTemplateVars();
        var suffix = vars.getOrDefault(ROUTE_PATH_SUFFIX, DEFAULT_ROUTE_PATH_SUFFIX);
        vars.put(ROUTE_PATH, withSuffix(routePath, suffix));
        vars.put(BASE_URL, root().baseUrl());
        var missing = TemplateSubstitution.missingVariables(owner.template(), vars);
        if (!missing.isEmpty()) {
            throw new RoutingError.TemplateSubstitution(displayName(),
                                                        routeName,
                                                        owner.group()
                                                             .displayName(),
                                                        owner.template(),
                                                        missing).exception();
        }
        var url = TemplateSubstitution.substitute(owner.template(), vars);
        return UrlJoiner.join(url,
                              "",
                              query == null
                              ? QueryParams.empty()
                              : query);
    }

    private static String withSuffix(String routePath, String suffix) {
        if (suffix.isEmpty() || routePath.isEmpty() || routePath.equals("/") || routePath.endsWith(suffix)) {
            return routePath;
        }
        return routePath + suffix;
    }

    @Override
    public List<NavigationNode> navigation(List<String> routeNames,
                                           Function<String, ? extends Map<String, ?>> params) throws UrlKitException {
        if (routeNames == null || routeNames.isEmpty()) {
            return List.of();
        }
        var groupName = fqn();
        var nodes = new ArrayList<NavigationNode>(routeNames.size());
        for (var routeName : routeNames) {
            if (routeName == null || routeName.isBlank()) {
                continue;
            }
            Map<String, ?> provided = params == null
                                      ? null
                                      : params.apply(routeName);
            if (provided == null) {
                provided = Map.of();
            }
            String url;
            try{
                url = builder(routeName).withParams(provided)
                                        .build();
            } catch (UrlKitException e) {
                log.warn("Navigation for group {} stopped at route {}: {}", displayName(), routeName, e.getMessage());
                throw e;
            }
            var fullRoute = groupName.isEmpty()
                            ? routeName
                            : groupName + "." + routeName;
            nodes.add(new NavigationNode(groupName, routeName, fullRoute, route(routeName), url, new HashMap<>(provided)));
        }
        return List.copyOf(nodes);
    }

    String displayName() {
        var qualified = fqn();
        if (!qualified.isEmpty()) {
            return qualified;
        }
        return parent == null
               ? "(root)"
               : "(unnamed)";
    }

    @Override
    public String toString() {
        return "Group(" + displayName() + ")";
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

    private void write(Runnable action) {
        lock.writeLock()
            .lock();
        try{
            action.run();
        } finally{
            lock.writeLock()
                .unlock();
        }
    }
}
