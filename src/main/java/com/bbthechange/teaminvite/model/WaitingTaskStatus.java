package com.bbthechange.teaminvite.model;

public enum WaitingTaskStatus {
    WAITING,
    PROCESSING,
    SUCCESS,
    FAILED;

    public boolean isFinished() {
        return this == SUCCESS || this == FAILED;
    }
}
