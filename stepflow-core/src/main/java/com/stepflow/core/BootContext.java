package com.stepflow.core;

import java.util.Objects;

/**
 * The process-wide default {@link Context}, used only by callers that run a step without supplying one.
 *
 * <p>It can be installed once during boot, before anything reads it. The first {@link #get()} freezes it (an
 * empty context when nothing was installed); later {@link #install} calls fail.
 */
public final class BootContext {
    private static Context current;

    private BootContext() {}

    public static synchronized void install(Context context) {
        Objects.requireNonNull(context, "context");
        if (current != null) {
            throw new IllegalStateException("Boot context is already set and cannot be replaced");
        }
        current = context;
    }

    public static synchronized Context get() {
        if (current == null) {
            current = Context.empty();
        }
        return current;
    }
}
