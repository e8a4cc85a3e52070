package com.jsonloom.core.resources.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a JSON:API resource. Registration in the resource graph is still explicit;
 * this annotation only supplies metadata.
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface JsonApiResource {

    /** Public resource type name. Defaults to the camel-cased, pluralized class name. */
    String publicName() default "";
}
