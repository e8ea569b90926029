package io.lighting.beacon;

/**
 * Base class of the failures raised while inspecting or mutating models.
 */
public class ModelException extends RuntimeException {
    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
