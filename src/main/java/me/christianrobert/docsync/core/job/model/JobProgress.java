package me.christianrobert.docsync.core.job.model;

import java.time.LocalDateTime;

/**
 * Snapshot of a running job's progress as reported through the progress callback.
 * The percentage is clamped to 0..100.
 */
public class JobProgress {
    private int percentage;
    private String currentTask;
    private String details;
    private LocalDateTime lastUpdated;

    public JobProgress() {
        this.percentage = 0;
        this.currentTask = "";
        this.details = "";
        this.lastUpdated = LocalDateTime.now();
    }

    public JobProgress(int percentage, String currentTask) {
        this();
        this.percentage = clamp(percentage);
        this.currentTask = currentTask != null ? currentTask : "";
    }

    public JobProgress(int percentage, String currentTask, String details) {
        this(percentage, currentTask);
        this.details = details != null ? details : "";
    }

    private static int clamp(int percentage) {
        return Math.max(0, Math.min(100, percentage));
    }

    public int getPercentage() {
        return percentage;
    }

    public void setPercentage(int percentage) {
        this.percentage = clamp(percentage);
        this.lastUpdated = LocalDateTime.now();
    }

    public String getCurrentTask() {
        return currentTask;
    }

    public void setCurrentTask(String currentTask) {
        this.currentTask = currentTask != null ? currentTask : "";
        this.lastUpdated = LocalDateTime.now();
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details != null ? details : "";
        this.lastUpdated = LocalDateTime.now();
    }

    public LocalDateTime getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "JobProgress{" +
                "percentage=" + percentage +
                ", currentTask='" + currentTask + '\'' +
                ", details='" + details + '\'' +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
