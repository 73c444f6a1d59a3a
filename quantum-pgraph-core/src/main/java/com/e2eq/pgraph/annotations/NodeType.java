package com.e2eq.pgraph.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Optionally customizes the node type (otype) written for an entity class.
 * Default id is the simple class name.
 */
@Retention(RUNTIME)
@Target(TYPE)
public @interface NodeType {
    String id() default "";
}
