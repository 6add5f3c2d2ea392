package io.formulaxform.core.model;

/** Outcome of persisting one generated unit. */
public enum WriteStatus {
    WRITTEN(1),
    SKIPPED(0),
    FAILED(-1);

    private final int code;

    WriteStatus(int code) {
        this.code = code;
    }

    /** Numeric status: {@code 1} written, {@code 0} nothing to write, {@code -1} failed. */
    public int code() {
        return code;
    }

    /**
     * Combines the statuses of the two units: {@link #FAILED} if either failed, else
     * {@link #WRITTEN} if either was written, else {@link #SKIPPED}.
     */
    public static WriteStatus combine(WriteStatus volume, WriteStatus boundary) {
        if (volume == FAILED || boundary == FAILED) {
            return FAILED;
        }
        return volume == WRITTEN || boundary == WRITTEN ? WRITTEN : SKIPPED;
    }
}
