package com.newsintel.alcalor.model;

import java.time.LocalDate;

/**
 * The single durable backfill checkpoint for a source.
 */
public record BackfillProgress(String source, LocalDate lastCompletedDate, BackfillStatus status) {
}
