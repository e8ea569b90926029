package io.lighting.beacon.meta;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Supported primary key representations.
 * <p>
 * Each kind knows how to expose a key value for parameter binding, how to coerce an incoming
 * value into the declared field type, and what counts as "no key yet".
 */
public enum PrimaryKeyKind {
    /**
     * {@code byte}, {@code short}, {@code int} and their wrappers.
     */
    INTEGER {
        @Override
        public Object coerce(Object value, Class<?> targetType) {
            if (value == null) {
                return null;
            }
            long number = toLong(value);
            if (targetType == byte.class || targetType == Byte.class) {
                return (byte) checkRange(number, Byte.MIN_VALUE, Byte.MAX_VALUE, "byte");
            }
            if (targetType == short.class || targetType == Short.class) {
                return (short) checkRange(number, Short.MIN_VALUE, Short.MAX_VALUE, "short");
            }
            return (int) checkRange(number, Integer.MIN_VALUE, Integer.MAX_VALUE, "int");
        }
    },
    /**
     * {@code long} and {@link Long}.
     */
    LONG {
        @Override
        public Object coerce(Object value, Class<?> targetType) {
            if (value == null) {
                return null;
            }
            return toLong(value);
        }
    },
    UUID {
        @Override
        public Object format(Object value) {
            return value == null ? null : value.toString();
        }

        @Override
        public Object coerce(Object value, Class<?> targetType) {
            if (value == null || value instanceof java.util.UUID) {
                return value;
            }
            if (value instanceof CharSequence text) {
                return java.util.UUID.fromString(text.toString());
            }
            throw new IllegalArgumentException("Cannot assign " + value.getClass().getName() + " to a UUID key");
        }
    },
    STRING {
        @Override
        public Object coerce(Object value, Class<?> targetType) {
            return value == null ? null : value.toString();
        }

        @Override
        public boolean isEmpty(Object value) {
            return value == null || value.toString().isBlank();
        }
    },
    OTHER;

    /**
     * Key value in the form query parameters are bound with.
     */
    public Object format(Object value) {
        return value;
    }

    /**
     * Converts {@code value} for assignment to a field of {@code targetType}.
     */
    public Object coerce(Object value, Class<?> targetType) {
        return value;
    }

    /**
     * Whether {@code value} is the zero value of this kind.
     */
    public boolean isEmpty(Object value) {
        if (value instanceof Number number) {
            return number.longValue() == 0L;
        }
        return value == null;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == LONG;
    }

    public static PrimaryKeyKind of(Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (type == int.class || type == Integer.class
            || type == short.class || type == Short.class
            || type == byte.class || type == Byte.class) {
            return INTEGER;
        }
        if (type == long.class || type == Long.class) {
            return LONG;
        }
        if (type == java.util.UUID.class) {
            return UUID;
        }
        if (type == String.class) {
            return STRING;
        }
        return OTHER;
    }

    /**
     * Exact integral value of {@code value}; fractional and out-of-range numbers are rejected
     * rather than truncated.
     */
    private static long toLong(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (!Double.isFinite(number) || number != Math.rint(number)
                || number < Long.MIN_VALUE || number >= 0x1p63) {
                throw new IllegalArgumentException("Not an integral key: " + value);
            }
            return (long) number;
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).longValueExact();
            } catch (NumberFormatException | ArithmeticException ex) {
                throw new IllegalArgumentException("Not an integral key: " + value, ex);
            }
        }
        if (value instanceof CharSequence text) {
            try {
                return Long.parseLong(text.toString().trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Not a numeric key: " + text, ex);
            }
        }
        throw new IllegalArgumentException("Cannot assign " + value.getClass().getName() + " to a numeric key");
    }

    private static long checkRange(long number, long min, long max, String type) {
        if (number < min || number > max) {
            throw new IllegalArgumentException("Key " + number + " does not fit a " + type + " field");
        }
        return number;
    }
}
