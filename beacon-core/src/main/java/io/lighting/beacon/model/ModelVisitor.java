package io.lighting.beacon.model;

/**
 * Callback for {@link Model#forEach(ModelVisitor)}.
 *
 * @param <E> exception type the callback may throw; it aborts the iteration and reaches the caller unchanged
 */
@FunctionalInterface
public interface ModelVisitor<E extends Exception> {
    void visit(Model model) throws E;
}
