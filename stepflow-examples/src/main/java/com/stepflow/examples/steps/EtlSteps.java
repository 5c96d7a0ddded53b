package com.stepflow.examples.steps;

import com.stepflow.config.StepRegistry;

/** Registry entries for the example steps, as referenced by the bundled task definitions. */
public final class EtlSteps {
    private EtlSteps() {}

    public static StepRegistry registry() {
        return register(new StepRegistry());
    }

    public static StepRegistry register(StepRegistry registry) {
        return registry
            .register("read_csv", CsvFileReader::new)
            .register("rename_columns", RenameColumns::new)
            .register("write_jsonl", JsonLinesWriter::new);
    }
}
