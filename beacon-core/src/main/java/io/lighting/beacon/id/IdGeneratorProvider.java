package io.lighting.beacon.id;

import io.lighting.beacon.meta.PrimaryKeyKind;

/**
 * Chooses the generator for caller-assigned keys of a given kind. Returning {@code null} means
 * keys of that kind are never generated.
 */
@FunctionalInterface
public interface IdGeneratorProvider {
    IdGenerator<?> generator(PrimaryKeyKind kind);
}
