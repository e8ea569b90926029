package io.lighting.beacon.model;

/**
 * Lets a model type choose its own table name.
 * <p>
 * Results are cached per type, so the name must not depend on instance state. Use
 * {@link HasContextualTableName} for names that vary.
 */
@FunctionalInterface
public interface HasTableName {
    String tableName();
}
