package com.example.abac.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires the calling subject to be permitted {@link #action()} on {@link #resourceType()}
 * before a controller method runs. The method must return a {@code Mono} and take a
 * {@code ServerWebExchange} argument.
 *
 * <p>Example usage:
 * <pre>
 * {@literal @}DeleteMapping("/files/{fileId}")
 * {@literal @}RequiresAbacPermission(resourceType = "file", action = "delete", resourceIdParam = "fileId")
 * public Mono<Void> deleteFile(@PathVariable String fileId, ServerWebExchange exchange) {...}
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresAbacPermission {

    String resourceType();

    String action();

    /**
     * Path variable holding the resource id; empty for type-level checks.
     */
    String resourceIdParam() default "";
}
