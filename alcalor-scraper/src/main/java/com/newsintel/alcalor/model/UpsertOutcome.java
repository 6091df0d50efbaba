package com.newsintel.alcalor.model;

public enum UpsertOutcome {
    INSERTED, UPDATED
}
