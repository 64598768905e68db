package org.pragmatica.urlkit.param;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the parameter name used when an object is turned into route parameters.
 * Takes precedence over Jackson's {@code @JsonProperty}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.RECORD_COMPONENT})
public @interface UrlParam {
    /**
     * Parameter name; empty means "derive from the member".
     */
    String value() default "";

    /**
     * Skip the member entirely.
     */
    boolean ignore() default false;
}
