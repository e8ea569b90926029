package io.lighting.beacon.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Request-scoped values travelling with a {@link Model}.
 * <p>
 * The model itself only hands the context to {@link HasContextualTableName}; everything else in
 * it belongs to the persistence layer. Instances are immutable.
 */
public final class ModelContext {
    private static final ModelContext BACKGROUND = new ModelContext(Map.of());

    private final Map<String, Object> values;

    private ModelContext(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Empty context, used when none was supplied.
     */
    public static ModelContext background() {
        return BACKGROUND;
    }

    public static ModelContext of(String key, Object value) {
        return BACKGROUND.with(key, value);
    }

    public ModelContext with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Map<String, Object> copy = new HashMap<>(values);
        copy.put(key, value);
        return new ModelContext(Map.copyOf(copy));
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(Objects.requireNonNull(key, "key")));
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return get(key).filter(type::isInstance).map(type::cast);
    }

    @Override
    public String toString() {
        return "ModelContext" + values.keySet();
    }
}
