package io.lighting.beacon.meta;

import java.util.Objects;

/**
 * Metadata of one model field.
 *
 * @param fieldName        Java field name, dotted for fields reached through embedded holders
 * @param columnName       mapped column name
 * @param javaType         declared field type
 * @param persistent       whether the field is one of the model's columns
 * @param readable         whether the column is selected
 * @param writeable        whether the column is written
 * @param selectExpression custom select expression, or {@code null}
 * @param accessor         reads and writes the field on an instance
 */
public record FieldMeta(
    String fieldName,
    String columnName,
    Class<?> javaType,
    boolean persistent,
    boolean readable,
    boolean writeable,
    String selectExpression,
    FieldAccessor accessor
) {
    public FieldMeta {
        Objects.requireNonNull(fieldName, "fieldName");
        Objects.requireNonNull(columnName, "columnName");
        Objects.requireNonNull(javaType, "javaType");
        Objects.requireNonNull(accessor, "accessor");
        if (columnName.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank: " + fieldName);
        }
    }

    public static FieldMeta column(String fieldName, String columnName, Class<?> javaType, FieldAccessor accessor) {
        return new FieldMeta(fieldName, columnName, javaType, true, true, true, null, accessor);
    }

    public static FieldMeta property(String fieldName, Class<?> javaType, FieldAccessor accessor) {
        return new FieldMeta(fieldName, fieldName, javaType, false, false, false, null, accessor);
    }

    public Object read(Object target) {
        return accessor.get(target);
    }

    public void write(Object target, Object value) {
        accessor.set(target, value);
    }
}
