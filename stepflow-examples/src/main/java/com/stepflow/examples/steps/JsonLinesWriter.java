package com.stepflow.examples.steps;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.AbstractStep;
import com.stepflow.core.Context;
import com.stepflow.core.Output;
import com.stepflow.core.Requirements;
import com.stepflow.core.StepKind;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the data set as JSON Lines to {@code target.path}, replacing the file. Reports the number of rows
 * written and the absolute location.
 */
public final class JsonLinesWriter extends AbstractStep {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public JsonLinesWriter() {
        this("write_jsonl");
    }

    public JsonLinesWriter(String name) {
        super(name, StepKind.WRITER, Requirements.builder()
            .config("target.path", String.class)
            .output("rows", Long.class)
            .output("location", String.class)
            .build());
    }

    @Override
    protected void doExecute(Context context, Output input, Output.Builder output) throws IOException {
        Path target = Path.of(context.getString("target.path")).toAbsolutePath();
        List<?> dataset = input.get(Output.DATASET, List.class);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (Object row : dataset) {
                writer.write(MAPPER.writeValueAsString(row));
                writer.newLine();
            }
        }
        log().info("wrote {} rows to {}", dataset.size(), target);
        output.put("rows", (long) dataset.size()).put("location", target.toString());
    }
}
