package io.lighting.beacon.id;

import io.lighting.beacon.meta.PrimaryKeyKind;
import java.util.Objects;
import java.util.UUID;

public final class IdGenerators {
    private static final IdGenerator<UUID> UUID_GENERATOR = UUID::randomUUID;
    private static final IdGenerator<String> UUID_STRING_GENERATOR = () -> UUID.randomUUID().toString();

    private IdGenerators() {
    }

    public static IdGenerator<UUID> uuid() {
        return UUID_GENERATOR;
    }

    public static IdGenerator<String> uuidString() {
        return UUID_STRING_GENERATOR;
    }

    /**
     * Default provider: random UUIDs for UUID keys, nothing for other kinds.
     */
    public static IdGenerator<?> forKind(PrimaryKeyKind kind) {
        Objects.requireNonNull(kind, "kind");
        return switch (kind) {
            case UUID -> uuid();
            case INTEGER, LONG, STRING, OTHER -> null;
        };
    }
}
