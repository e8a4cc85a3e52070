package com.jsonloom.core.resources.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Exposes a field as a JSON:API attribute. */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Attr {

    /** Public attribute name. Defaults to the field name. */
    String publicName() default "";

    AttrCapabilities[] capabilities() default {
        AttrCapabilities.ALLOW_VIEW,
        AttrCapabilities.ALLOW_FILTER,
        AttrCapabilities.ALLOW_SORT,
        AttrCapabilities.ALLOW_CREATE,
        AttrCapabilities.ALLOW_CHANGE
    };
}
