package org.pragmatica.urlkit;

import org.pragmatica.urlkit.param.ParamSource;
import org.pragmatica.urlkit.param.QueryParams;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-call accumulator of path parameters and query values for one route.
 *
 * <p>Setters never fail: the first error (for example an unsupported object passed to
 * {@link #withStruct(Object)}) is remembered and reported by {@link #build()}, and later
 * setters are ignored. Instances are not thread-safe and are meant to be discarded after
 * building.
 */
public final class UrlBuilder {
    private final Group group;
    private final String routeName;
    private final Map<String, String> params = new LinkedHashMap<>();
    private final Map<String, String> query = new HashMap<>();
    private final Map<String, List<String>> multiQuery = new HashMap<>();
    private UrlKitException error;

    UrlBuilder(Group group, String routeName) {
        this.group = group;
        this.routeName = routeName;
    }

    /**
     * Set a path parameter; the value is rendered with {@link String#valueOf(Object)} and
     * {@code null} removes it.
     */
    public UrlBuilder withParam(String key, Object value) {
        if (error == null) {
            putParam(key, value);
        }
        return this;
    }

    public UrlBuilder withParams(Map<String, ?> values) {
        if (error == null && values != null) {
            values.forEach(this::putParam);
        }
        return this;
    }

    /**
     * Merge parameters from a record, an object with public fields, a map or a
     * {@link ParamSource}.
     */
    public UrlBuilder withStruct(Object source) {
        if (error != null) {
            return this;
        }
        try{
            ParamSource.of(source)
                       .params()
                       .forEach(param -> putParam(param.key(),
                                                  param.value()));
        } catch (UrlKitException e) {
            error = e;
        }
        return this;
    }

    /**
     * Set a query value. Collections and arrays become repeated keys, {@code null} becomes an
     * empty value, anything else is rendered with {@link String#valueOf(Object)}.
     */
    public UrlBuilder withQuery(String key, Object value) {
        if (error != null) {
            return this;
        }
        if (value instanceof Collection<?> values) {
            setQueryValues(key,
                           values.stream()
                                 .map(String::valueOf)
                                 .toList());
        } else if (value != null && value.getClass()
                                         .isArray()) {
            var values = new ArrayList<String>();
            for (int i = 0; i < Array.getLength(value); i++ ) {
                values.add(String.valueOf(Array.get(value, i)));
            }
            setQueryValues(key, values);
        } else {
            multiQuery.remove(key);
            query.put(key,
                      value == null
                      ? ""
                      : String.valueOf(value));
        }
        return this;
    }

    public UrlBuilder withQueryValues(Map<String, ? extends Collection<?>> values) {
        if (error == null && values != null) {
            values.forEach(this::withQuery);
        }
        return this;
    }

    public String build() throws UrlKitException {
        if (error != null) {
            throw error;
        }
        return group.render(routeName, Map.copyOf(params), QueryParams.queryParams(query, multiQuery));
    }

    public String mustBuild() {
        return Must.must(this::build);
    }

    private void putParam(String key, Object value) {
        if (value == null) {
            params.remove(key);
        } else {
            params.put(key, String.valueOf(value));
        }
    }

    private void setQueryValues(String key, List<String> values) {
        query.remove(key);
        multiQuery.put(key,
                       values.isEmpty()
                       ? List.of("")
                       : List.copyOf(values));
    }
}
