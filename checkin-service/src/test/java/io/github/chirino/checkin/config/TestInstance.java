package io.github.chirino.checkin.config;

import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.util.TypeLiteral;
import java.lang.annotation.Annotation;
import java.util.Iterator;
import java.util.List;

/** {@link Instance} over one fixed bean, or over none, for selector tests. */
class TestInstance<T> implements Instance<T> {

    private final T value;

    private TestInstance(T value) {
        this.value = value;
    }

    static <T> Instance<T> of(T value) {
        return new TestInstance<>(value);
    }

    static <T> Instance<T> unsatisfied() {
        return new TestInstance<>(null);
    }

    @Override
    public T get() {
        if (value == null) {
            throw new IllegalStateException("No bean available");
        }
        return value;
    }

    @Override
    public Instance<T> select(Annotation... qualifiers) {
        return this;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <U extends T> Instance<U> select(Class<U> subtype, Annotation... qualifiers) {
        return (Instance<U>) this;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <U extends T> Instance<U> select(TypeLiteral<U> subtype, Annotation... qualifiers) {
        return (Instance<U>) this;
    }

    @Override
    public boolean isUnsatisfied() {
        return value == null;
    }

    @Override
    public boolean isAmbiguous() {
        return false;
    }

    @Override
    public boolean isResolvable() {
        return value != null;
    }

    @Override
    public void destroy(T instance) {}

    @Override
    public Handle<T> getHandle() {
        throw new UnsupportedOperationException();
    }

    @Override
    public Iterable<? extends Handle<T>> handles() {
        throw new UnsupportedOperationException();
    }

    @Override
    public Iterator<T> iterator() {
        return value == null ? List.<T>of().iterator() : List.of(value).iterator();
    }
}
