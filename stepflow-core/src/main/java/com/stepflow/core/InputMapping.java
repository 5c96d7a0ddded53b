package com.stepflow.core;

import java.util.List;
import java.util.Objects;

/**
 * Shapes the previous child's output into the next child's input. The default passes the output through
 * unchanged.
 */
@FunctionalInterface
public interface InputMapping {

    /**
     * @param consumer name of the step that will receive the mapped input, for error reporting
     */
    Output apply(String consumer, Output previous) throws ValidationException;

    static InputMapping identity() {
        return (consumer, previous) -> previous;
    }

    /** Keeps only the named fields; each must be present. */
    static InputMapping select(String... fields) {
        List<String> names = List.of(fields);
        return (consumer, previous) -> {
            Output.Builder selected = Output.builder(previous.producer(), OutputSchema.empty());
            for (String name : names) {
                if (!previous.has(name)) {
                    throw new ValidationException(consumer, "input field '" + name + "' not produced by '"
                        + previous.producer() + "'");
                }
                selected.put(name, previous.get(name));
            }
            return selected.build();
        };
    }

    /** Exposes field {@code from} under the name {@code to}; other fields pass through. */
    static InputMapping rename(String from, String to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        return (consumer, previous) -> {
            if (!previous.has(from)) {
                throw new ValidationException(consumer, "input field '" + from + "' not produced by '"
                    + previous.producer() + "'");
            }
            Output.Builder renamed = Output.builder(previous.producer(), OutputSchema.empty());
            previous.fields().forEach((name, value) -> {
                if (!name.equals(from)) renamed.put(name, value);
            });
            renamed.put(to, previous.get(from));
            return renamed.build();
        };
    }

    default InputMapping andThen(InputMapping next) {
        Objects.requireNonNull(next, "next");
        return (consumer, previous) -> next.apply(consumer, apply(consumer, previous));
    }
}
