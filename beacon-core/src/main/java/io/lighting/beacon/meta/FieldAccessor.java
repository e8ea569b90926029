package io.lighting.beacon.meta;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Reads and writes one field of a model instance.
 */
public interface FieldAccessor {
    Object get(Object target);

    void set(Object target, Object value);

    @SuppressWarnings("unchecked")
    static <T> FieldAccessor of(Function<? super T, ?> getter, BiConsumer<? super T, Object> setter) {
        Objects.requireNonNull(getter, "getter");
        return new FieldAccessor() {
            @Override
            public Object get(Object target) {
                return getter.apply((T) target);
            }

            @Override
            public void set(Object target, Object value) {
                if (setter == null) {
                    throw new UnsupportedOperationException("Field is read-only");
                }
                setter.accept((T) target, value);
            }
        };
    }
}
