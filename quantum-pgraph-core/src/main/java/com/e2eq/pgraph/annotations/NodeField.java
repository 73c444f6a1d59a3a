package com.e2eq.pgraph.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Customizes how an entity field is stored. On a literal field {@code id} names the
 * column; on a reference field it names the edge predicate.
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface NodeField {
    String id() default "";       // default: field name
    String type() default "";     // FieldType name, overrides the type inferred from the Java type
}
