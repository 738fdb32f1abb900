package io.lapse4j.core;

public enum ExecutionOutcome {
    COMPLETED,
    CANCELLED,
    FAILED
}
