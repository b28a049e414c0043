package me.christianrobert.docsync.sync.model;

import java.util.Optional;

/**
 * Outcome of one sync phase: passed, or failed with a {@link SyncFailure}.
 * Phases return this instead of throwing; the driver turns a failure into a rollback.
 */
public final class CheckResult {

    private static final CheckResult PASSED = new CheckResult(null);

    private final SyncFailure failure;

    private CheckResult(SyncFailure failure) {
        this.failure = failure;
    }

    public static CheckResult passed() {
        return PASSED;
    }

    public static CheckResult failed(SyncFailure failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure must not be null");
        }
        return new CheckResult(failure);
    }

    public boolean isPassed() {
        return failure == null;
    }

    public Optional<SyncFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isPassed() ? "CheckResult{passed}" : "CheckResult{failed=" + failure.describe() + "}";
    }
}
