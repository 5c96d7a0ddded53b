package com.stepflow.core;

public enum StepState {
    CONSTRUCTED,
    VALIDATED,
    EXECUTING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    boolean canMoveTo(StepState next) {
        return switch (this) {
            case CONSTRUCTED -> next == VALIDATED || next == FAILED;
            case VALIDATED -> next == EXECUTING || next == FAILED;
            case EXECUTING -> next == SUCCEEDED || next == FAILED;
            case SUCCEEDED, FAILED -> false;
        };
    }
}
