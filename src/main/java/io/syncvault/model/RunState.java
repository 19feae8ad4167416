package io.syncvault.model;

public enum RunState {
    IDLE,
    RUNNING,
    SUCCESS,
    PARTIAL_FAILURE,
    CANCELLED,
    ABORTED
}
