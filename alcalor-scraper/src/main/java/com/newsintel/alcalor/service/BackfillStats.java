package com.newsintel.alcalor.service;

import com.newsintel.alcalor.model.BackfillStatus;
import com.newsintel.alcalor.model.DailyArticles;
import com.newsintel.alcalor.model.InsertResult;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Running totals of one backfill.
 */
@Data
public class BackfillStats {

    private LocalDate startDate;
    private LocalDate endDate;
    private long totalDays;
    private int daysCompleted;
    private int totalArticles;
    private int newArticles;
    private int updatedArticles;
    private int errors;
    private Instant startedAt;
    private BackfillStatus finalStatus;

    public static BackfillStats begin(LocalDate startDate, LocalDate endDate, Instant startedAt) {
        BackfillStats stats = new BackfillStats();
        stats.setStartDate(startDate);
        stats.setEndDate(endDate);
        stats.setTotalDays(Math.max(0, endDate.toEpochDay() - startDate.toEpochDay() + 1));
        stats.setStartedAt(startedAt);
        return stats;
    }

    public void record(DailyArticles daily) {
        daysCompleted++;
        totalArticles += daily.getMetadata().getSuccessfulArticles();
        errors += daily.getMetadata().getFailedArticles();
        InsertResult stored = daily.getStoreResult();
        if (stored != null) {
            newArticles += stored.getInserted();
            updatedArticles += stored.getUpdated();
            errors += stored.getErrors().size();
        }
    }

    public void recordDayError() {
        daysCompleted++;
        errors++;
    }

    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, now);
    }

    /**
     * Remaining time extrapolated from the average day so far; zero before the first day.
     */
    public Duration eta(Instant now, long daysRemaining) {
        if (daysCompleted == 0) return Duration.ZERO;
        return elapsed(now).dividedBy(daysCompleted).multipliedBy(Math.max(0, daysRemaining));
    }

    static String format(Duration d) {
        long s = d.getSeconds();
        return String.format("%d:%02d:%02d", s / 3600, (s % 3600) / 60, s % 60);
    }
}
