package io.lighting.beacon.meta;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Field to column mapping.
 * <p>
 * Fields without this annotation are still mapped; their column name is the underscored field
 * name ({@code createdAt} becomes {@code created_at}).
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Column {
    /**
     * Column name. Blank means the underscored field name.
     */
    String name() default "";

    /**
     * Whether the column is selected when reading rows.
     */
    boolean readable() default true;

    /**
     * Whether the column is written by inserts and updates.
     */
    boolean writeable() default true;

    /**
     * Custom select expression, rendered as {@code expression AS name}.
     */
    String select() default "";
}
