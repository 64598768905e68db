package org.pragmatica.urlkit.param;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.pragmatica.urlkit.RoutingError;
import org.pragmatica.urlkit.UrlKitException;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Reflection based extraction of parameters from records and plain objects.
 */
final class ObjectParams {
    private ObjectParams() {}

    static List<ParamSource.Param> extract(Object value) throws UrlKitException {
        var type = value.getClass();
        if (isScalar(value)) {
            throw unsupported(type, "expected a map, a record or an object with public fields");
        }
        return type.isRecord()
               ? fromRecord(value, type)
               : fromFields(value, type);
    }

    private static List<ParamSource.Param> fromRecord(Object value, Class<?> type) throws UrlKitException {
        var params = new ArrayList<ParamSource.Param>();
        for (var component : type.getRecordComponents()) {
            var key = keyFor(component.getName(), annotatedElements(type, component));
            if (key.isEmpty()) {
                continue;
            }
            var accessor = component.getAccessor();
            try{
                accessor.setAccessible(true);
                add(params, key.get(), accessor.invoke(value));
            } catch (IllegalAccessException | InvocationTargetException | RuntimeException e) {
                throw unsupported(type, "cannot read component " + component.getName() + ": " + e.getMessage());
            }
        }
        return List.copyOf(params);
    }

    private static List<ParamSource.Param> fromFields(Object value, Class<?> type) throws UrlKitException {
        var params = new ArrayList<ParamSource.Param>();
        for (var field : type.getFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            var key = keyFor(field.getName(), field);
            if (key.isEmpty()) {
                continue;
            }
            try{
                field.setAccessible(true);
                add(params, key.get(), field.get(value));
            } catch (IllegalAccessException | RuntimeException e) {
                throw unsupported(type, "cannot read field " + field.getName() + ": " + e.getMessage());
            }
        }
        return List.copyOf(params);
    }

    private static void add(List<ParamSource.Param> params, String key, Object value) {
        if (value != null) {
            params.add(new ParamSource.Param(key, String.valueOf(value)));
        }
    }

    // Jackson annotations on a record component land on the field and the accessor
    private static AnnotatedElement[] annotatedElements(Class<?> type, RecordComponent component) {
        var elements = new ArrayList<AnnotatedElement>(3);
        elements.add(component);
        elements.add(component.getAccessor());
        declaredField(type, component.getName()).ifPresent(elements::add);
        return elements.toArray(AnnotatedElement[]::new);
    }

    private static Optional<Field> declaredField(Class<?> type, String name) {
        try{
            return Optional.of(type.getDeclaredField(name));
        } catch (NoSuchFieldException e) {
            return Optional.empty();
        }
    }

    private static Optional<String> keyFor(String memberName, AnnotatedElement... elements) {
        for (var element : elements) {
            var urlParam = element.getAnnotation(UrlParam.class);
            if (urlParam != null) {
                if (urlParam.ignore()) {
                    return Optional.empty();
                }
                if (!urlParam.value()
                             .isEmpty()) {
                    return Optional.of(urlParam.value());
                }
            }
        }
        for (var element : elements) {
            var ignore = element.getAnnotation(JsonIgnore.class);
            if (ignore != null && ignore.value()) {
                return Optional.empty();
            }
        }
        for (var element : elements) {
            var property = element.getAnnotation(JsonProperty.class);
            if (property != null && !property.value()
                                             .isEmpty()) {
                return Optional.of(property.value());
            }
        }
        return Optional.of(lowerFirst(memberName));
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence || value instanceof Number || value instanceof Boolean
               || value instanceof Character || value instanceof Collection<?> || value instanceof Enum<?>
               || value instanceof Optional<?> || value.getClass()
                                                       .isArray();
    }

    private static String lowerFirst(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return Character.toLowerCase(value.charAt(0)) + value.substring(1);
    }

    private static UrlKitException unsupported(Class<?> type, String reason) {
        return new RoutingError.UnsupportedParams(type.getName(), reason).exception();
    }
}
