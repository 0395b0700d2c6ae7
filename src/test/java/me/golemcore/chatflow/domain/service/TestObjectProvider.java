package me.golemcore.chatflow.domain.service;

import org.springframework.beans.factory.ObjectProvider;

final class TestObjectProvider<T> implements ObjectProvider<T> {

    private final T value;

    TestObjectProvider(T value) {
        this.value = value;
    }

    static <T> TestObjectProvider<T> empty() {
        return new TestObjectProvider<>(null);
    }

    @Override
    public T getObject() {
        return value;
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
    public java.util.stream.Stream<T> stream() {
        return value != null ? java.util.stream.Stream.of(value) : java.util.stream.Stream.empty();
    }

    @Override
    public java.util.stream.Stream<T> orderedStream() {
        return stream();
    }
}
