package com.newsintel.alcalor.service;

import java.time.LocalDate;

/**
 * Bounds requested for a backfill. Null dates are resolved by the service.
 *
 * @param startDate oldest date to reach, or null for configured/discovered
 * @param endDate   newest date, or null for yesterday
 * @param resume    continue below the stored checkpoint
 */
public record BackfillRequest(LocalDate startDate, LocalDate endDate, boolean resume) {
}
