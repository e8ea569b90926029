package io.lighting.beacon.meta;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the primary key field.
 * <p>
 * Without this annotation the field named {@code id} is the key. Keys are generated by the
 * database unless {@link #noAutoIncrement()} is exactly {@code "true"}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Id {
    String noAutoIncrement() default "";
}
