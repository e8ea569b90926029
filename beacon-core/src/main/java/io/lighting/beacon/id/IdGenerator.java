package io.lighting.beacon.id;

@FunctionalInterface
public interface IdGenerator<T> {
    T nextId();
}
