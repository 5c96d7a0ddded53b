package com.stepflow.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Objects;

/** Per-step SLF4J loggers and the MDC keys set while a task runs one of its children. */
public final class StepLoggers {
    public static final String CATEGORY_PREFIX = "stepflow.step.";
    public static final String MDC_TASK = "stepflow.task";
    public static final String MDC_STEP = "stepflow.step";
    public static final String MDC_POSITION = "stepflow.position";

    private StepLoggers() {}

    /** Logger under {@code stepflow.step.<name>}; repeated calls return the same logger. */
    public static Logger forStep(String stepName) {
        return LoggerFactory.getLogger(CATEGORY_PREFIX + Objects.requireNonNull(stepName, "stepName"));
    }

    /** Puts task/step/position into the MDC; closing restores what was there before. */
    static MdcScope enter(String taskName, String stepName, int position) {
        return new MdcScope(taskName, stepName, position);
    }

    static final class MdcScope implements AutoCloseable {
        private final String previousTask = MDC.get(MDC_TASK);
        private final String previousStep = MDC.get(MDC_STEP);
        private final String previousPosition = MDC.get(MDC_POSITION);

        private MdcScope(String taskName, String stepName, int position) {
            MDC.put(MDC_TASK, taskName);
            MDC.put(MDC_STEP, stepName);
            MDC.put(MDC_POSITION, Integer.toString(position));
        }

        @Override
        public void close() {
            restore(MDC_TASK, previousTask);
            restore(MDC_STEP, previousStep);
            restore(MDC_POSITION, previousPosition);
        }

        private static void restore(String key, String value) {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        }
    }
}
