package com.example.subburn_backend.util;

/**
 * Linear stages of a subtitle job. Each non-terminal stage may only move to the next one, or to {@link #FAILED}.
 */
public enum JobStage {
    QUEUED(0),
    EXTRACTING_AUDIO(10),
    TRANSCRIBING(30),
    BURNING(60),
    COMPLETED(100),
    FAILED(-1);

    private final int progress;

    JobStage(int progress) {
        this.progress = progress;
    }

    /** Percentage reported when the stage is entered; {@code -1} for {@link #FAILED}. */
    public int progress() {
        return progress;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canAdvanceTo(JobStage next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
