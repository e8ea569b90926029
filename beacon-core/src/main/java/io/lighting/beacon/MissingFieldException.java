package io.lighting.beacon;

import java.util.Objects;

/**
 * The model type lacks a field the requested operation depends on.
 */
public class MissingFieldException extends ModelException {
    private final Class<?> modelType;
    private final String fieldName;

    public MissingFieldException(Class<?> modelType, String fieldName) {
        super("model " + Objects.requireNonNull(modelType, "modelType").getName()
            + " is missing required field " + Objects.requireNonNull(fieldName, "fieldName"));
        this.modelType = modelType;
        this.fieldName = fieldName;
    }

    public Class<?> modelType() {
        return modelType;
    }

    public String fieldName() {
        return fieldName;
    }
}
