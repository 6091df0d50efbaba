package com.newsintel.alcalor.model;

import java.util.Arrays;

/**
 * Checkpoint status as stored in backfill_progress.status.
 */
public enum BackfillStatus {

    IN_PROGRESS("in_progress"),
    PAUSED("paused"),
    COMPLETED("completed");

    private final String dbValue;

    BackfillStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isResumable() {
        return this != COMPLETED;
    }

    public static BackfillStatus fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.dbValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown backfill status: " + value));
    }
}
