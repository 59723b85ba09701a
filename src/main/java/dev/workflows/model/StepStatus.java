package dev.workflows.model;

public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    ERROR
}
