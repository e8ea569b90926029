package io.lighting.beacon;

import java.util.Objects;

/**
 * Field metadata was requested for a value that is not a record type, such as a string,
 * a number or another JDK type.
 */
public class NotARecordException extends ModelException {
    private final Class<?> valueType;

    public NotARecordException(Class<?> valueType) {
        super("model " + Objects.requireNonNull(valueType, "valueType").getName() + " is not a record type");
        this.valueType = valueType;
    }

    public Class<?> valueType() {
        return valueType;
    }
}
