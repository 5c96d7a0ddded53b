package com.stepflow.core;

/** How a task assembles its output from its children's outputs. The trace is attached under both policies. */
public enum Aggregation {
    /** The last child's fields. */
    LAST_WINS,
    /** Union of every child's fields; a later child overwrites a same-named field. */
    MERGE_ALL
}
