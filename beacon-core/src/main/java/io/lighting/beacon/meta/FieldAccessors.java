package io.lighting.beacon.meta;

import java.lang.reflect.Field;
import java.util.List;
import java.util.Objects;

final class FieldAccessors {
    private FieldAccessors() {
    }

    static FieldAccessor direct(Field field) {
        Objects.requireNonNull(field, "field");
        field.setAccessible(true);
        return new FieldAccessor() {
            @Override
            public Object get(Object target) {
                try {
                    return field.get(target);
                } catch (IllegalAccessException ex) {
                    throw new IllegalStateException("Failed to read field " + field.getName(), ex);
                }
            }

            @Override
            public void set(Object target, Object value) {
                try {
                    field.set(target, value);
                } catch (IllegalAccessException ex) {
                    throw new IllegalStateException("Failed to set field " + field.getName(), ex);
                }
            }
        };
    }

    /**
     * Accessor for a field reached through embedded holders. Reads yield {@code null} while a
     * holder is unset; writes instantiate missing holders through their no-arg constructor.
     */
    static FieldAccessor path(List<Field> holders, Field leaf) {
        List<Field> chain = List.copyOf(holders);
        for (Field holder : chain) {
            holder.setAccessible(true);
        }
        FieldAccessor target = direct(leaf);
        return new FieldAccessor() {
            @Override
            public Object get(Object root) {
                Object current = root;
                for (Field holder : chain) {
                    current = read(holder, current);
                    if (current == null) {
                        return null;
                    }
                }
                return target.get(current);
            }

            @Override
            public void set(Object root, Object value) {
                Object current = root;
                for (Field holder : chain) {
                    Object next = read(holder, current);
                    if (next == null) {
                        next = instantiate(holder.getType());
                        write(holder, current, next);
                    }
                    current = next;
                }
                target.set(current, value);
            }
        };
    }

    private static Object read(Field field, Object target) {
        try {
            return field.get(target);
        } catch (IllegalAccessException ex) {
            throw new IllegalStateException("Failed to read field " + field.getName(), ex);
        }
    }

    private static void write(Field field, Object target, Object value) {
        try {
            field.set(target, value);
        } catch (IllegalAccessException ex) {
            throw new IllegalStateException("Failed to set field " + field.getName(), ex);
        }
    }

    private static Object instantiate(Class<?> type) {
        try {
            var constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException("Failed to instantiate embedded " + type.getName(), ex);
        }
    }
}
