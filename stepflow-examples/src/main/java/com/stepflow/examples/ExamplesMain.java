package com.stepflow.examples;

import com.stepflow.config.ContextLoader;
import com.stepflow.core.CompositionException;
import com.stepflow.core.Context;
import com.stepflow.core.Output;
import com.stepflow.core.StepResult;
import com.stepflow.core.StepTrace;
import com.stepflow.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * Runs the CSV to JSON Lines example.
 *
 * <pre>
 * ExamplesMain &lt;input.csv&gt; [config.(json|yaml|toml)]
 * </pre>
 *
 * Settings come from {@code etl-defaults.yaml}, then the optional config file, then {@code STEPFLOW_*}
 * environment variables; the input path given on the command line wins over all of them.
 */
public final class ExamplesMain {
    private static final Logger log = LoggerFactory.getLogger(ExamplesMain.class);

    private ExamplesMain() {}

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("usage: ExamplesMain <input.csv> [config file]");
            System.exit(2);
        }
        ContextLoader.Builder config = ContextLoader.builder().resource("etl-defaults.yaml");
        if (args.length > 1) {
            config.file(Path.of(args[1]));
        }
        Context context = config
            .environment("STEPFLOW")
            .overrides(Map.of("extract.source.path", args[0]))
            .build()
            .load();

        boolean ok = report(CsvToJsonlExample.buildTask(), context)
            & report(CsvToJsonlExample.loadTask(), context);
        System.exit(ok ? 0 : 1);
    }

    static boolean report(Task task, Context context) {
        StepResult result = task.run(context, Output.empty());
        for (StepTrace entry : result.trace()) {
            log.info("{} #{} {} {} ({} ms)", task.name(), entry.position(), entry.name(), entry.state(),
                entry.elapsedNanos() / 1_000_000);
        }
        if (result.succeeded()) {
            log.info("{} wrote {} rows to {}", task.name(), result.output().get("rows"),
                result.output().get("location"));
            return true;
        }
        if (result.error() instanceof CompositionException failure) {
            log.error("{} failed at step '{}' (position {}), completed {}: {}", task.name(), failure.childName(),
                failure.position(), failure.completed(), failure.failure().getMessage());
        } else {
            log.error("{} failed: {}", task.name(), result.error().getMessage());
        }
        return false;
    }
}
