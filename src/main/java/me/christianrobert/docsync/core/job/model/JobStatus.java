package me.christianrobert.docsync.core.job.model;

public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
