package io.lighting.beacon.meta;

import java.util.Objects;

/**
 * Primary key of a model type.
 */
public record IdMeta(FieldMeta field, PrimaryKeyKind kind, boolean autoIncrement) {
    public IdMeta {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(kind, "kind");
    }

    public static IdMeta of(FieldMeta field, boolean autoIncrement) {
        return new IdMeta(field, PrimaryKeyKind.of(field.javaType()), autoIncrement);
    }

    public String fieldName() {
        return field.fieldName();
    }

    public String columnName() {
        return field.columnName();
    }

    public Class<?> javaType() {
        return field.javaType();
    }
}
