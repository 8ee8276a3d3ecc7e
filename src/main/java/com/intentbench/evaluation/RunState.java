package com.intentbench.evaluation;

/**
 * Lifecycle of one evaluation run. {@code FAILED} is reachable only from {@code LOADING}.
 */
public enum RunState {
    LOADING,
    RUNNING,
    REPORTING,
    DONE,
    FAILED
}
