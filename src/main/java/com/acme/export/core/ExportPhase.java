package com.acme.export.core;

public enum ExportPhase {
    IDLE,
    DISCOVERING,
    COMPUTING_PENDING,
    EXECUTING,
    FINALIZING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
