package com.stepflow.core;

import java.util.Map;
import java.util.Objects;

/**
 * Derives the context a child sees from its task's context. Always returns a new instance (or the same one);
 * the task's context is never edited.
 */
@FunctionalInterface
public interface ContextMapping {

    Context apply(Context parent);

    static ContextMapping identity() {
        return parent -> parent;
    }

    /**
     * The child sees only the namespace at {@code path}.
     *
     * @throws IllegalArgumentException if {@code path} is not a valid dotted path
     */
    static ContextMapping namespace(String path) {
        Context.checkPath(path);
        return parent -> parent.namespace(path);
    }

    /** The child sees the parent with {@code overrides} on top. */
    static ContextMapping overrides(Map<String, ?> overrides) {
        Context layer = Context.of(overrides);
        return parent -> parent.merge(layer);
    }

    default ContextMapping andThen(ContextMapping next) {
        Objects.requireNonNull(next, "next");
        return parent -> next.apply(apply(parent));
    }
}
