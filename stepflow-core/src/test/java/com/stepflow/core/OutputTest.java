package com.stepflow.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

final class OutputTest {

    private static final OutputSchema SCHEMA = OutputSchema.of(
        FieldSpec.required("rows", Long.class).describedAs("rows written"),
        FieldSpec.optional("location", String.class));

    @Test
    void builtOutputIsImmutableAndOrdered() {
        Output out = Output.builder("writer", SCHEMA).put("rows", 3L).put("location", "/tmp/x").build();

        assertEquals(List.of("rows", "location"), List.copyOf(out.names()));
        assertThrows(UnsupportedOperationException.class, () -> out.fields().put("extra", 1));
        assertEquals(3L, out.get("rows", Long.class));
        assertEquals("writer", out.producer());
        assertSame(SCHEMA, out.schema());
    }

    @Test
    void missingAndMistypedFieldAccessFailsLoudly() {
        Output out = Output.of("p", Map.of("n", 1));

        assertThrows(NoSuchElementException.class, () -> out.get("absent"));
        assertThrows(ClassCastException.class, () -> out.get("n", String.class));
        assertTrue(out.find("absent").isEmpty());
    }

    @Test
    void schemaReportsEveryViolation() {
        Output missing = Output.of("w", Map.of("location", 5));

        List<String> problems = SCHEMA.violations(missing);

        assertEquals(List.of("required field 'rows' is missing", "field 'location' is Integer, expected String"),
            problems);
        StepExecutionException e = assertThrows(StepExecutionException.class, () -> SCHEMA.verify("w", missing));
        assertEquals("w", e.stepName());
    }

    @Test
    void optionalFieldMayBeAbsentAndExtrasAreTolerated() {
        Output out = Output.of("w", Map.of("rows", 1L, "debug", true));

        assertEquals(List.of(), SCHEMA.violations(out));
    }

    @Test
    void schemaRejectsDuplicateNamesAndMergesLaterWins() {
        assertThrows(IllegalArgumentException.class,
            () -> OutputSchema.of(FieldSpec.required("a", String.class), FieldSpec.optional("a", Long.class)));

        OutputSchema merged = SCHEMA.merge(OutputSchema.of(FieldSpec.required("location", String.class)));
        assertTrue(merged.field("location").orElseThrow().required());
        assertTrue(merged.declares("rows"));
        assertSame(SCHEMA, SCHEMA.merge(OutputSchema.empty()));
    }

    @Test
    void jsonIsDeterministic() {
        Output a = Output.of("p", Map.of("b", 2, "a", Map.of("z", 1, "y", 2)));

        assertEquals("{\"a\":{\"y\":2,\"z\":1},\"b\":2}", a.toJson());
    }

    @Test
    void equalityIgnoresSchemaAndTrace() {
        Output a = Output.of("p", Map.of("x", 1));
        Output b = Output.builder("p", SCHEMA).put("x", 1).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, Output.of("q", Map.of("x", 1)));
    }

    @Test
    void emptyOutputHasNoProducerOrFields() {
        assertTrue(Output.empty().isEmpty());
        assertEquals("", Output.empty().producer());
        assertTrue(Output.empty().trace().isEmpty());
        assertEquals("{}", Output.empty().toJson());
    }
}
