package me.christianrobert.docsync.sync.model;

import java.util.List;

/**
 * Why a sync run stopped: the error category, the phase, the offending tables and,
 * where ids are involved, a bounded sample of them.
 */
public class SyncFailure {

    /** Upper bound of ids quoted in a failure. */
    public static final int MAX_SAMPLE_IDS = 10;

    private final SyncErrorType type;
    private final SyncPhase phase;
    private final List<String> tables;
    private final String message;
    private final List<Long> sampleIds;

    public SyncFailure(SyncErrorType type, SyncPhase phase, List<String> tables, String message, List<Long> sampleIds) {
        this.type = type;
        this.phase = phase;
        this.tables = tables != null ? List.copyOf(tables) : List.of();
        this.message = message;
        this.sampleIds = sampleIds != null ? List.copyOf(sample(sampleIds)) : List.of();
    }

    public SyncFailure(SyncErrorType type, SyncPhase phase, List<String> tables, String message) {
        this(type, phase, tables, message, List.of());
    }

    /**
     * @return the first {@link #MAX_SAMPLE_IDS} ids of the list
     */
    public static List<Long> sample(List<Long> ids) {
        return ids.size() > MAX_SAMPLE_IDS ? ids.subList(0, MAX_SAMPLE_IDS) : ids;
    }

    public SyncErrorType getType() {
        return type;
    }

    public SyncPhase getPhase() {
        return phase;
    }

    public List<String> getTables() {
        return tables;
    }

    public String getMessage() {
        return message;
    }

    public List<Long> getSampleIds() {
        return sampleIds;
    }

    /**
     * @return "{@code <phase label> failed [<TYPE>]: <message>}"
     */
    public String describe() {
        return String.format("%s failed [%s]: %s", phase.getLabel(), type, message);
    }

    @Override
    public String toString() {
        return "SyncFailure{type=" + type + ", phase=" + phase + ", tables=" + tables +
                ", message='" + message + "', sampleIds=" + sampleIds + '}';
    }
}
