package com.llmregress.retry;

public enum RetryState {
    ATTEMPTING,
    TRANSIENT_FAILURE,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
