package org.pragmatica.urlkit;

/**
 * One {@code name} or {@code name:/path} element of an {@code ensureGroup} path.
 */
record GroupSegment(String name, String path) {

    static GroupSegment parse(String fullPath, String segment) throws UrlKitException {
        var trimmed = segment.trim();
        if (trimmed.isEmpty()) {
            throw new RoutingError.InvalidGroupPath(fullPath, "empty segment").exception();
        }
        var colon = trimmed.indexOf(':');
        var name = (colon >= 0
                    ? trimmed.substring(0, colon)
                    : trimmed).trim();
        var custom = colon >= 0
                     ? trimmed.substring(colon + 1)
                              .trim()
                     : "";
        if (name.isEmpty()) {
            throw new RoutingError.InvalidGroupPath(fullPath, "segment '" + segment + "' is missing a group name").exception();
        }
        if (custom.isEmpty()) {
            return new GroupSegment(name, "/" + stripLeadingSlashes(name));
        }
        return new GroupSegment(name,
                                custom.startsWith("/")
                                ? custom
                                : "/" + custom);
    }

    private static String stripLeadingSlashes(String value) {
        var start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++ ;
        }
        return start == value.length()
               ? value
               : value.substring(start);
    }
}
