package com.stepflow.examples;

import com.stepflow.config.TaskDefinitionLoader;
import com.stepflow.core.Aggregation;
import com.stepflow.core.ContextMapping;
import com.stepflow.core.InputMapping;
import com.stepflow.core.Task;
import com.stepflow.examples.steps.CsvFileReader;
import com.stepflow.examples.steps.EtlSteps;
import com.stepflow.examples.steps.JsonLinesWriter;
import com.stepflow.examples.steps.RenameColumns;

import java.io.IOException;
import java.io.InputStream;

/**
 * Extract, rename, load: a CSV file becomes a JSON Lines file. The same task is available built in code and
 * loaded from {@code tasks/csv-to-jsonl.json}; both read their settings from the {@code extract}, {@code transform}
 * and {@code load} namespaces.
 */
public final class CsvToJsonlExample {
    static final String DEFINITION = "tasks/csv-to-jsonl.json";

    private CsvToJsonlExample() {}

    public static Task buildTask() {
        return Task.builder("csv_to_jsonl")
            .aggregation(Aggregation.MERGE_ALL)
            .preflight(true)
            .addScoped(new CsvFileReader(), "extract")
            .add(new RenameColumns(), InputMapping.select("dataset"), ContextMapping.namespace("transform"))
            .addScoped(new JsonLinesWriter(), "load")
            .build();
    }

    public static Task loadTask() throws IOException {
        try (InputStream in = CsvToJsonlExample.class.getClassLoader().getResourceAsStream(DEFINITION)) {
            if (in == null) throw new IOException("Missing task definition on classpath: " + DEFINITION);
            return TaskDefinitionLoader.loadJson(in, EtlSteps.registry());
        }
    }
}
