package me.golemcore.tunebot.adapter.inbound.telegram;

import org.springframework.beans.factory.ObjectProvider;

import java.util.stream.Stream;

/**
 * Wraps an instance, possibly {@code null}, as an {@link ObjectProvider}.
 */
final class TestObjectProvider<T> implements ObjectProvider<T> {

    private final T value;

    TestObjectProvider(T value) {
        this.value = value;
    }

    @Override
    public T getObject(Object... args) {
        return value;
    }

    @Override
    public T getIfAvailable() {
        return value;
    }

    @Override
    public T getIfUnique() {
        return value;
    }

    @Override
    public Stream<T> stream() {
        return value == null ? Stream.empty() : Stream.of(value);
    }

    @Override
    public Stream<T> orderedStream() {
        return stream();
    }
}
