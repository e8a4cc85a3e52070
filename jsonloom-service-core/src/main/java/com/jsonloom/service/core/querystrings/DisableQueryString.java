package com.jsonloom.service.core.querystrings;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Disables standard query string parameters on a controller or handler method. Using a disabled
 * parameter fails the request.
 */
@Documented
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface DisableQueryString {

    StandardQueryStringParameter[] value();
}
