package io.lighting.beacon.columns;

import java.util.Objects;

/**
 * Primary key column of a {@link ColumnSet}.
 *
 * @param name      column name
 * @param writeable whether the key is supplied by the caller rather than generated by the database
 */
public record IdField(String name, boolean writeable) {
    public static final String DEFAULT_NAME = "id";

    public IdField {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }
}
