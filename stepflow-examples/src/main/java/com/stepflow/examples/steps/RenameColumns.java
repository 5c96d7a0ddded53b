package com.stepflow.examples.steps;

import com.stepflow.core.AbstractStep;
import com.stepflow.core.Context;
import com.stepflow.core.Output;
import com.stepflow.core.Requirements;
import com.stepflow.core.StepKind;
import com.stepflow.core.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renames columns of every row. The mapping comes from the {@code columns} namespace, old name to new name;
 * columns not named there keep their name and position.
 */
public final class RenameColumns extends AbstractStep {

    public RenameColumns() {
        this("rename_columns");
    }

    public RenameColumns(String name) {
        super(name, StepKind.TRANSFORMATION, Requirements.builder()
            .config("columns", Context.class)
            .output(Output.DATASET, List.class)
            .build());
    }

    @Override
    public boolean idempotent() {
        return true;
    }

    @Override
    protected void checkPreconditions(Context context) throws ValidationException {
        for (Map.Entry<String, Object> entry : context.namespace("columns").flatten().entrySet()) {
            if (!(entry.getValue() instanceof String target) || target.isBlank()) {
                throw new ValidationException(name(), "columns." + entry.getKey() + " must name the new column");
            }
        }
    }

    @Override
    protected void doExecute(Context context, Output input, Output.Builder output) throws ValidationException {
        Map<String, Object> renames = context.namespace("columns").flatten();
        List<?> dataset = input.get(Output.DATASET, List.class);
        List<Map<String, Object>> renamed = new ArrayList<>(dataset.size());
        for (Object item : dataset) {
            if (!(item instanceof Map<?, ?> row)) {
                throw new ValidationException(name(), "data set rows must be maps, got " + item);
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            row.forEach((column, value) -> {
                Object target = renames.get(String.valueOf(column));
                copy.put(target != null ? (String) target : String.valueOf(column), value);
            });
            renamed.add(Collections.unmodifiableMap(copy));
        }
        log().debug("renamed {} columns in {} rows", renames.size(), renamed.size());
        output.put(Output.DATASET, List.copyOf(renamed));
    }
}
