package com.stepflow.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BootContextTest {

    @Test
    void firstReadFreezesTheBootContext() {
        Context first = BootContext.get();

        assertSame(first, BootContext.get());
        assertThrows(IllegalStateException.class, () -> BootContext.install(Context.of(Map.of("a", 1))));
        assertSame(first, BootContext.get());
    }

    @Test
    void runWithoutArgumentsUsesTheBootContext() {
        Step counter = Steps.step("count-keys").output("keys", Integer.class)
            .execute((ctx, in, out) -> out.put("keys", ctx.keys().size()));

        StepResult result = counter.run();

        assertTrue(result.succeeded());
        assertEquals(BootContext.get().keys().size(), result.output().get("keys"));
        assertEquals(1, result.trace().size());
    }
}
