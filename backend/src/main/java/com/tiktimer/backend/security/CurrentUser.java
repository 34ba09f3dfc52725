package com.tiktimer.backend.security;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Injects the authenticated {@link com.tiktimer.backend.model.User} (or its {@link UserPrincipal})
 * into a controller method after the gate has run up to {@link #value()}.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CurrentUser {
    AccessLevel value() default AccessLevel.ACTIVE;
}
