package io.lighting.beacon.meta;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a relation to other models.
 * <p>
 * Association fields, and embedded fields whose type carries this annotation, never become
 * direct columns; loading them is up to the association layer.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.TYPE})
public @interface Association {
}
