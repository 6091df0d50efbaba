package com.newsintel.alcalor.model;

public enum RunType {

    DAILY("daily"),
    MANUAL("manual"),
    BACKFILL("backfill");

    private final String dbValue;

    RunType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }
}
