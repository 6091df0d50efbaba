package com.newsintel.alcalor.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Tracks each scrape run for observability.
 * Stored in the scrape_runs table: one row per date for daily/manual runs,
 * one row per batch of days for backfill.
 */
@Data
@Builder
public class ScrapeRunRecord {

    private String source;
    private RunType runType;
    private LocalDate targetDate;       // single-date runs
    private LocalDate startDate;        // backfill batches
    private LocalDate endDate;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private String status;              // completed | failed
    private int totalArticles;
    private int successfulArticles;
    private int failedArticles;
    private int newArticles;
    private int updatedArticles;
    private List<String> errors;        // null when clean
    private boolean proxyUsed;
    private Double durationSeconds;

    public static ScrapeRunRecord forDate(String source, RunType runType, RunMetadata metadata,
                                          InsertResult storeResult) {
        return ScrapeRunRecord.builder()
                .source(source)
                .runType(runType)
                .targetDate(metadata.getDate())
                .startedAt(metadata.getStartTime())
                .completedAt(metadata.getEndTime())
                .status(isFailed(metadata) ? "failed" : "completed")
                .totalArticles(metadata.getTotalArticles())
                .successfulArticles(metadata.getSuccessfulArticles())
                .failedArticles(metadata.getFailedArticles())
                .newArticles(storeResult == null ? 0 : storeResult.getInserted())
                .updatedArticles(storeResult == null ? 0 : storeResult.getUpdated())
                .errors(metadata.getErrors().isEmpty() ? null : List.copyOf(metadata.getErrors()))
                .proxyUsed(metadata.isProxyUsed())
                .durationSeconds(metadata.getDurationSeconds())
                .build();
    }

    /** A date fails only when errors were recorded and nothing at all was extracted. */
    private static boolean isFailed(RunMetadata metadata) {
        return metadata.getSuccessfulArticles() == 0 && !metadata.getErrors().isEmpty();
    }
}
