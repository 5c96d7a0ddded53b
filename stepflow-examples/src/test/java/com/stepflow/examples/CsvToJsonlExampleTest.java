package com.stepflow.examples;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.CompositionException;
import com.stepflow.core.ConfigResolutionException;
import com.stepflow.core.Context;
import com.stepflow.core.Output;
import com.stepflow.core.StepExecutionException;
import com.stepflow.core.StepResult;
import com.stepflow.core.StepState;
import com.stepflow.core.Task;
import com.stepflow.core.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class CsvToJsonlExampleTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private Context context(Path csv, Path out) {
        return Context.of(Map.of(
            "extract", Map.of("source", Map.of("path", csv.toString())),
            "transform", Map.of("columns", Map.of("name", "full_name")),
            "load", Map.of("target", Map.of("path", out.toString()))));
    }

    @Test
    void builtAndLoadedTasksProduceTheSameFile() throws Exception {
        Path csv = Files.writeString(dir.resolve("people.csv"), "name,age\nAda,36\nAlan,41\n");
        Path built = dir.resolve("built/people.jsonl");
        Path loaded = dir.resolve("loaded/people.jsonl");

        Output a = CsvToJsonlExample.buildTask().execute(context(csv, built), Output.empty());
        Output b = CsvToJsonlExample.loadTask().execute(context(csv, loaded), Output.empty());

        assertEquals(2L, a.get("rows"));
        assertEquals(built.toAbsolutePath().toString(), a.get("location"));
        List<String> lines = Files.readAllLines(built);
        assertEquals(List.of("{\"full_name\":\"Ada\",\"age\":\"36\"}", "{\"full_name\":\"Alan\",\"age\":\"41\"}"), lines);
        assertEquals(lines, Files.readAllLines(loaded));
        assertEquals(a.fields().keySet(), b.fields().keySet());
        assertEquals(Map.of("full_name", "Ada", "age", "36"),
            MAPPER.readValue(lines.get(0), Map.class));
    }

    @Test
    void headerlessFileWithCustomDelimiter() throws Exception {
        Path csv = Files.writeString(dir.resolve("raw.txt"), "x;1\ny;2\n");
        Path out = dir.resolve("raw.jsonl");
        Context ctx = context(csv, out)
            .with("extract.source.header", false)
            .with("extract.source.delimiter", ";")
            .with("transform.columns", Map.of("c0", "key"));

        Output result = CsvToJsonlExample.buildTask().execute(ctx, Output.empty());

        assertEquals(2L, result.get("rows"));
        assertEquals("{\"key\":\"x\",\"c1\":\"1\"}", Files.readAllLines(out).get(0));
    }

    @Test
    void missingConfigurationIsCaughtBeforeAnythingRuns() {
        Path out = dir.resolve("never.jsonl");
        Context ctx = Context.of(Map.of(
            "extract", Map.of("source", Map.of("path", dir.resolve("in.csv").toString())),
            "transform", Map.of("columns", Map.of("a", "b")),
            "load", Map.of("target", Map.of())));

        CompositionException e = assertThrows(CompositionException.class,
            () -> CsvToJsonlExample.buildTask().execute(ctx, Output.empty()));

        assertEquals("write_jsonl", e.childName());
        assertEquals(3, e.position());
        assertEquals(List.of("target.path"), assertInstanceOf(ConfigResolutionException.class, e.getCause()).paths());
        assertFalse(Files.exists(out));
    }

    @Test
    void badDelimiterFailsValidation() {
        Path csv = dir.resolve("in.csv");
        Context ctx = context(csv, dir.resolve("o.jsonl")).with("extract.source.delimiter", "::");

        CompositionException e = assertThrows(CompositionException.class,
            () -> CsvToJsonlExample.buildTask().execute(ctx, Output.empty()));

        assertInstanceOf(ValidationException.class, e.getCause());
        assertEquals("read_csv", e.childName());
    }

    @Test
    void missingInputFileStopsTheRunAtTheReader() {
        Path out = dir.resolve("out.jsonl");
        Task task = CsvToJsonlExample.buildTask();

        StepResult result = task.run(context(dir.resolve("absent.csv"), out), Output.empty());

        CompositionException e = assertInstanceOf(CompositionException.class, result.error());
        assertEquals(1, e.position());
        assertEquals(List.of(), e.completed());
        assertInstanceOf(StepExecutionException.class, e.getCause());
        assertEquals(StepState.FAILED, result.trace().get(0).state());
        assertEquals(1, result.trace().size());
        assertFalse(Files.exists(out));
    }

    @Test
    void reportSummarisesSuccessAndFailure() throws Exception {
        Path csv = Files.writeString(dir.resolve("p.csv"), "name\nAda\n");

        assertTrue(ExamplesMain.report(CsvToJsonlExample.buildTask(), context(csv, dir.resolve("p.jsonl"))));
        assertFalse(ExamplesMain.report(CsvToJsonlExample.buildTask(), Context.empty()));
    }
}
