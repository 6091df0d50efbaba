package com.newsintel.alcalor.model;

/**
 * Per-invocation settings shared by every date of a run.
 *
 * @param workers    concurrent article extractions, already clamped
 * @param writeFiles write daily JSON files
 * @param useStore   write to the database; false when it was unreachable at startup
 * @param runType    recorded on scrape_runs rows
 */
public record RunOptions(int workers, boolean writeFiles, boolean useStore, RunType runType) {
}
