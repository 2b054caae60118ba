package com.regvm.vm.host;

import com.regvm.vm.Value;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Host capabilities injected into a VM: the environment root, the document root,
 * an optional source evaluator and the factory for the empty-object register.
 */
public record HostBindings(Value environment, Value document, HostEvaluator evaluator,
                           Supplier<Value> emptyObjectFactory) {

    public HostBindings {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(emptyObjectFactory, "emptyObjectFactory");
    }

    /**
     * Bindings whose empty objects are map-backed.
     */
    public HostBindings(Value environment, Value document, HostEvaluator evaluator) {
        this(environment, document, evaluator, () -> Value.host(new MapHostObject()));
    }

    /**
     * Bindings with empty map-backed roots and no evaluator.
     */
    public static HostBindings detached() {
        return new HostBindings(Value.host(new MapHostObject()), Value.host(new MapHostObject()), null);
    }

    public Optional<HostEvaluator> findEvaluator() {
        return Optional.ofNullable(evaluator);
    }

    /**
     * A fresh empty object owned by the host, loaded into {@code EMPTY_OBJ} on every init.
     */
    public Value newEmptyObject() {
        Value value = emptyObjectFactory.get();
        if (value == null) {
            throw new IllegalStateException("Empty object factory returned null");
        }
        return value;
    }

    public HostBindings withEvaluator(HostEvaluator evaluator) {
        return new HostBindings(environment, document, evaluator, emptyObjectFactory);
    }
}
