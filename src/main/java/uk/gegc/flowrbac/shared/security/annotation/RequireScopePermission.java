package uk.gegc.flowrbac.shared.security.annotation;

import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires the caller to hold {@link #permission()} on the resource whose id is passed in
 * {@link #scopeParam()}. The check runs before the method body.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequireScopePermission {
    String permission();

    ScopeType scope();

    String scopeParam();

    String userParam() default "userId";

    /**
     * When true a null resource id skips the check instead of failing validation.
     */
    boolean optional() default false;
}
