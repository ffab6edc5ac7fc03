package io.feedloom.model;

public enum TaskStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    CANCELED;

    public boolean terminal() {
        return this == DONE || this == FAILED || this == CANCELED;
    }
}
