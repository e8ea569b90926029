package io.lighting.beacon.model;

import java.util.Objects;

public record ResolvedTableName(String name, TableNameSource source) {
    public ResolvedTableName {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
    }
}
