package com.stepflow.core;

public final class PathNotFoundException extends ContextException {
    private final String missingSegment;
    private final String stoppedAt;

    public PathNotFoundException(String path, String missingSegment, String stoppedAt) {
        super(path, "Context path '" + path + "' not found: no key '" + missingSegment + "' in namespace "
            + (stoppedAt.isEmpty() ? "<root>" : "'" + stoppedAt + "'"));
        this.missingSegment = missingSegment;
        this.stoppedAt = stoppedAt;
    }

    public String missingSegment() {
        return missingSegment;
    }

    /** Dotted path of the namespace where resolution stopped; empty for the root. */
    public String stoppedAt() {
        return stoppedAt;
    }
}
