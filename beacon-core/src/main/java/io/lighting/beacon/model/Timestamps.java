package io.lighting.beacon.model;

import io.lighting.beacon.ModelException;
import io.lighting.beacon.meta.FieldMeta;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;

final class Timestamps {
    private Timestamps() {
    }

    /**
     * {@code now} in the representation of {@code field}. Integral fields receive Unix epoch
     * seconds; {@code int} fields only hold instants up to 2038-01-19T03:14:07Z.
     */
    static Object convert(Instant now, ZoneId zone, FieldMeta field) {
        Class<?> type = field.javaType();
        if (type == Instant.class) {
            return now;
        }
        if (type == LocalDateTime.class) {
            return LocalDateTime.ofInstant(now, zone);
        }
        if (type == OffsetDateTime.class) {
            return OffsetDateTime.ofInstant(now, zone);
        }
        if (type == ZonedDateTime.class) {
            return ZonedDateTime.ofInstant(now, zone);
        }
        if (type == java.sql.Timestamp.class) {
            return java.sql.Timestamp.from(now);
        }
        if (type == Date.class) {
            return Date.from(now);
        }
        if (type == long.class || type == Long.class) {
            return now.getEpochSecond();
        }
        if (type == int.class || type == Integer.class) {
            long seconds = now.getEpochSecond();
            if (seconds < Integer.MIN_VALUE || seconds > Integer.MAX_VALUE) {
                throw new ModelException("Timestamp " + now + " does not fit the int field " + field.fieldName());
            }
            return (int) seconds;
        }
        throw new ModelException("Unsupported timestamp type " + type.getName() + " of field " + field.fieldName());
    }

    static boolean isZero(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Number number) {
            return number.longValue() == 0L;
        }
        return false;
    }
}
