package me.christianrobert.docsync.sync.model;

public enum SyncErrorType {
    SCHEMA_MISMATCH,
    ANCHOR_MISMATCH,
    NON_EMPTY_TARGET,
    DANGLING_REFERENCE,
    COUNT_MISMATCH,
    STORAGE_ERROR
}
