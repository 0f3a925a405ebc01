package com.llmregress.scheduler;

public enum OutcomeStatus {
    PASSED,
    FAILED,
    ERRORED,
    SKIPPED;

    public boolean isFailure() {
        return this == FAILED || this == ERRORED;
    }
}
