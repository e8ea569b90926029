package io.lighting.beacon.meta;

import java.util.Optional;

/**
 * Source of per-type model metadata.
 */
public interface ModelMetaRegistry {
    /**
     * Metadata for {@code modelType}, built on first use and cached afterwards.
     *
     * @throws io.lighting.beacon.NotARecordException if the type cannot carry fields
     */
    ModelMeta metaOf(Class<?> modelType);

    /**
     * Registers metadata declared by hand, replacing anything derived for the same type.
     */
    void register(ModelMeta meta);

    /**
     * Table declared for {@code modelType}, empty when the name is left to convention.
     */
    default Optional<String> declaredTable(Class<?> modelType) {
        return metaOf(modelType).table();
    }
}
