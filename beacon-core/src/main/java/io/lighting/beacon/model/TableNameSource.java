package io.lighting.beacon.model;

/**
 * Where a resolved table name came from, in precedence order, and whether it may be cached per type.
 */
public enum TableNameSource {
    /**
     * The wrapped value is the table name itself.
     */
    LITERAL(false),
    /**
     * {@link HasTableName}.
     */
    STATIC(true),
    /**
     * {@link HasContextualTableName}; depends on the context of each call.
     */
    CONTEXTUAL(false),
    /**
     * {@link io.lighting.beacon.meta.Table}.
     */
    ANNOTATION(true),
    /**
     * Tableized simple name of the type.
     */
    CONVENTION(true);

    private final boolean cacheable;

    TableNameSource(boolean cacheable) {
        this.cacheable = cacheable;
    }

    public boolean cacheable() {
        return cacheable;
    }
}
