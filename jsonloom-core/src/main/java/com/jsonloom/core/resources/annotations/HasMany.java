package com.jsonloom.core.resources.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Exposes a {@code List}, {@code Set} or {@code Collection} field as a to-many relationship. */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface HasMany {

    String publicName() default "";

    boolean canInclude() default true;
}
