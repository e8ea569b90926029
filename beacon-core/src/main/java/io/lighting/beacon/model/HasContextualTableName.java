package io.lighting.beacon.model;

/**
 * Table name chosen from the context of the current operation, for example a tenant prefix.
 * Resolved again on every call, never cached.
 */
@FunctionalInterface
public interface HasContextualTableName {
    String tableName(ModelContext context);
}
