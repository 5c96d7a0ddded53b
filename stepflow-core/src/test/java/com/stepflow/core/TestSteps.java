package com.stepflow.core;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Recording steps shared by the task tests. */
final class TestSteps {
    private TestSteps() {}

    static final class Journal {
        final List<String> validated = new CopyOnWriteArrayList<>();
        final List<String> executed = new CopyOnWriteArrayList<>();
    }

    /** Appends its name to the "value" field of its input. */
    static Step appending(String name, Journal journal) {
        return new AppendStep(name, journal, null);
    }

    /** Fails during execute with an IllegalStateException. */
    static Step failing(String name, Journal journal) {
        return new AppendStep(name, journal, new IllegalStateException(name + " exploded"));
    }

    /** Requires {@code path} to resolve as a string. */
    static Step requiring(String name, String path, Journal journal) {
        return new RequiringStep(name, path, journal);
    }

    private static final class AppendStep extends AbstractStep {
        private final Journal journal;
        private final RuntimeException failure;

        private AppendStep(String name, Journal journal, RuntimeException failure) {
            super(name, Requirements.builder().output("value", String.class).build());
            this.journal = journal;
            this.failure = failure;
        }

        @Override
        protected void checkPreconditions(Context context) {
            journal.validated.add(name());
        }

        @Override
        protected void doExecute(Context context, Output input, Output.Builder output) {
            journal.executed.add(name());
            if (failure != null) throw failure;
            String previous = (String) input.find("value").orElse("");
            output.put("value", previous + name());
        }
    }

    private static final class RequiringStep extends AbstractStep {
        private final String path;
        private final Journal journal;

        private RequiringStep(String name, String path, Journal journal) {
            super(name, Requirements.builder().config(path, String.class).output("value", String.class).build());
            this.path = path;
            this.journal = journal;
        }

        @Override
        protected void doExecute(Context context, Output input, Output.Builder output) {
            journal.executed.add(name());
            output.put("value", input.find("value").orElse("") + context.getString(path));
        }
    }
}
