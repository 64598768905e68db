package org.pragmatica.urlkit.param;

import org.pragmatica.urlkit.UrlKitException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anything that can contribute route parameters to a builder.
 *
 * <p>Types that know their own parameter names implement this interface directly. Maps,
 * records and plain objects with public fields are adapted by {@link #of(Object)}.
 */
@FunctionalInterface
public interface ParamSource {
    /**
     * A single parameter. A {@code null} value removes the key from the target.
     */
    record Param(String key, String value) {}

    List<Param> params();

    static ParamSource empty() {
        return List::of;
    }

    static ParamSource fromMap(Map<String, ?> values) {
        var params = new ArrayList<Param>(values.size());
        values.forEach((key, value) -> params.add(new Param(key,
                                                            value == null
                                                            ? null
                                                            : String.valueOf(value))));
        var snapshot = List.copyOf(params);
        return () -> snapshot;
    }

    /**
     * Adapt an arbitrary object.
     *
     * <ul>
     *   <li>{@code null} contributes nothing;</li>
     *   <li>a {@code ParamSource} is used as is;</li>
     *   <li>a {@code Map} contributes its entries, values rendered with {@link String#valueOf(Object)};</li>
     *   <li>a record contributes its components, any other object its public instance fields.</li>
     * </ul>
     *
     * Member names come from {@link UrlParam}, then Jackson's {@code @JsonProperty}, then the
     * member name with its first letter lower-cased. {@code @UrlParam(ignore = true)} and
     * {@code @JsonIgnore} skip a member; members holding {@code null} are skipped too.
     *
     * @throws UrlKitException with {@code UnsupportedParams} for scalars, collections and arrays
     */
    static ParamSource of(Object input) throws UrlKitException {
        if (input == null) {
            return empty();
        }
        if (input instanceof ParamSource source) {
            return source;
        }
        if (input instanceof Map<?, ?> map) {
            var values = new LinkedHashMap<String, Object>();
            map.forEach((key, value) -> values.put(String.valueOf(key), value));
            return fromMap(values);
        }
        var snapshot = ObjectParams.extract(input);
        return () -> snapshot;
    }
}
