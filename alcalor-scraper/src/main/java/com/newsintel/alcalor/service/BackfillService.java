package com.newsintel.alcalor.service;

import com.newsintel.alcalor.config.ScraperProperties;
import com.newsintel.alcalor.model.BackfillProgress;
import com.newsintel.alcalor.model.BackfillStatus;
import com.newsintel.alcalor.model.DailyArticles;
import com.newsintel.alcalor.model.InsertResult;
import com.newsintel.alcalor.model.RunMetadata;
import com.newsintel.alcalor.model.RunOptions;
import com.newsintel.alcalor.model.RunType;
import com.newsintel.alcalor.model.ScrapeRunRecord;
import com.newsintel.alcalor.output.ArticleStore;
import com.newsintel.alcalor.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks a date range from newest to oldest, checkpointing after every day.
 *
 * The end defaults to yesterday. The start is, in order: the requested start date,
 * the configured one, or the earliest date with articles found by binary search.
 * With {@code resume} the walk continues one day below the stored checkpoint; the
 * checkpoint day itself is not scraped again.
 *
 * A {@link ShutdownSignal} is checked before each day; the day in flight always
 * finishes and the checkpoint is then stored as paused.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackfillService {

    private final ArticlePipelineFactory pipelineFactory;
    private final ArticleStore articleStore;
    private final OutputRouter outputRouter;
    private final ScraperProperties properties;
    private final Clock clock;

    public BackfillStats run(BackfillRequest request, RunOptions options, ShutdownSignal signal) {
        LocalDate end = request.endDate() != null ? request.endDate() : LocalDate.now(clock).minusDays(1);

        Optional<LocalDate> checkpoint = Optional.empty();
        if (request.resume()) {
            checkpoint = findResumePoint(options);
            if (checkpoint.isPresent()) {
                end = checkpoint.get().minusDays(1);
                log.info("Resuming backfill from {}", end);
            } else {
                log.info("No resumable backfill checkpoint found; starting from {}", end);
            }
        }

        try (ArticlePipeline pipeline = pipelineFactory.open(options)) {
            LocalDate start = request.startDate() != null
                    ? request.startDate()
                    : properties.getBackfill().configuredStartDate().orElse(null);
            if (start == null) {
                start = discoverEarliestDate(pipeline);
            }
            return walk(pipeline, start, end, options, signal, checkpoint.orElse(null));
        }
    }

    /**
     * Binary search for the earliest date whose archive lists at least one article,
     * between the configured floor and one year ago. Falls back to the floor when the
     * upper bound itself has nothing.
     */
    public LocalDate discoverEarliestDate(ArticlePipeline pipeline) {
        ScraperProperties.Backfill cfg = properties.getBackfill();
        LocalDate left = cfg.getFloorDate();
        LocalDate right = LocalDate.now(clock).minusDays(365);
        log.info("Searching for earliest available date...");

        boolean upperHasArticles = hasArticles(pipeline, right);
        probePause();
        if (!upperHasArticles) {
            log.warn("Could not find articles on {}. Using default start {}", right, left);
            return left;
        }

        LocalDate earliest = right;
        right = right.minusDays(1);
        while (!left.isAfter(right)) {
            LocalDate mid = left.plusDays(ChronoUnit.DAYS.between(left, right) / 2);
            if (hasArticles(pipeline, mid)) {
                earliest = mid;
                right = mid.minusDays(1);
            } else {
                left = mid.plusDays(1);
            }
            probePause();
        }

        log.info("Earliest available date: {}", earliest);
        return earliest;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private BackfillStats walk(ArticlePipeline pipeline, LocalDate start, LocalDate end,
                               RunOptions options, ShutdownSignal signal, LocalDate resumedFrom) {
        BackfillStats stats = BackfillStats.begin(start, end, clock.instant());
        log.info("Starting backfill from {} to {} ({} days)", end, start, stats.getTotalDays());

        BatchTally batch = new BatchTally();
        LocalDate current = end;
        LocalDate lastCompleted = null;

        while (!current.isBefore(start)) {
            if (signal.isRequested()) {
                log.info("Shutdown requested; stopping before {}", current);
                break;
            }

            try {
                DailyArticles daily = pipeline.scrapeDate(current);
                stats.record(daily);
                batch.add(daily);
            } catch (RuntimeException e) {
                log.error("Error processing {}: {}", current, e.getMessage(), e);
                stats.recordDayError();
            }

            lastCompleted = current;
            saveProgress(options, current, BackfillStatus.IN_PROGRESS);

            if (batch.days >= Math.max(1, properties.getBackfill().getBatchSize())) {
                outputRouter.writeScrapeRun(batch.toRecord(properties.getSourceName()), options);
                batch = new BatchTally();
            }

            int interval = Math.max(1, properties.getBackfill().getProgressIntervalDays());
            if (stats.getDaysCompleted() % interval == 0) {
                logProgress(stats, current, start);
            }
            current = current.minusDays(1);
        }

        if (batch.days > 0) {
            outputRouter.writeScrapeRun(batch.toRecord(properties.getSourceName()), options);
        }

        BackfillStatus finalStatus = !current.isBefore(start) ? BackfillStatus.PAUSED : BackfillStatus.COMPLETED;
        stats.setFinalStatus(finalStatus);
        if (lastCompleted != null) {
            saveProgress(options, lastCompleted, finalStatus);
        } else if (finalStatus == BackfillStatus.COMPLETED && resumedFrom != null) {
            // checkpoint already reached the start; only the status was never closed
            saveProgress(options, resumedFrom, BackfillStatus.COMPLETED);
        } else {
            log.info("No day was processed; checkpoint left unchanged");
        }

        logSummary(stats);
        return stats;
    }

    private boolean hasArticles(ArticlePipeline pipeline, LocalDate date) {
        int attempts = Math.max(1, properties.getBackfill().getProbeAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return !pipeline.listArticles(date).isEmpty();
            } catch (FetchException e) {
                log.warn("Probe for {} failed (attempt {}/{}): {}", date, attempt, attempts, e.getMessage());
                if (attempt < attempts) probePause();
            }
        }
        log.warn("Treating {} as having no articles", date);
        return false;
    }

    private Optional<LocalDate> findResumePoint(RunOptions options) {
        if (!options.useStore()) {
            log.warn("Database unavailable; cannot resume from checkpoint");
            return Optional.empty();
        }
        try {
            return articleStore.findBackfillProgress(properties.getSourceName())
                    .filter(p -> p.status().isResumable())
                    .map(BackfillProgress::lastCompletedDate);
        } catch (RuntimeException e) {
            log.warn("Could not read backfill checkpoint: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void saveProgress(RunOptions options, LocalDate date, BackfillStatus status) {
        if (!options.useStore()) return;
        try {
            articleStore.saveBackfillProgress(properties.getSourceName(), date, status);
        } catch (RuntimeException e) {
            log.warn("Failed to save backfill progress for {}: {}", date, e.getMessage());
        }
    }

    private void logProgress(BackfillStats stats, LocalDate current, LocalDate start) {
        long daysRemaining = ChronoUnit.DAYS.between(start, current);
        log.info("Progress: {} days completed, {} articles, current date {}, ETA {}",
                stats.getDaysCompleted(), stats.getTotalArticles(), current,
                BackfillStats.format(stats.eta(clock.instant(), daysRemaining)));
    }

    private void logSummary(BackfillStats stats) {
        log.info("=".repeat(60));
        log.info("BACKFILL SUMMARY");
        log.info("=".repeat(60));
        log.info("Days processed: {}/{}", stats.getDaysCompleted(), stats.getTotalDays());
        log.info("Total articles: {}", stats.getTotalArticles());
        log.info("New articles: {}", stats.getNewArticles());
        log.info("Updated articles: {}", stats.getUpdatedArticles());
        log.info("Errors: {}", stats.getErrors());
        log.info("Duration: {}", BackfillStats.format(stats.elapsed(clock.instant())));
        log.info("Status: {}", stats.getFinalStatus() == BackfillStatus.PAUSED ? "PAUSED" : "COMPLETED");
        log.info("=".repeat(60));
    }

    private void probePause() {
        long ms = properties.getBackfill().getProbeDelayMs();
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Totals for one scrape_runs row covering several backfill days. */
    private static class BatchTally {
        private int days;
        private LocalDate oldest;
        private LocalDate newest;
        private OffsetDateTime startedAt;
        private OffsetDateTime completedAt;
        private int total;
        private int successful;
        private int failed;
        private int inserted;
        private int updated;
        private boolean proxyUsed;
        private double durationSeconds;
        private final List<String> errors = new ArrayList<>();

        void add(DailyArticles daily) {
            RunMetadata m = daily.getMetadata();
            days++;
            oldest = daily.getDate();
            if (newest == null) newest = daily.getDate();
            if (startedAt == null) startedAt = m.getStartTime();
            completedAt = m.getEndTime();
            total += m.getTotalArticles();
            successful += m.getSuccessfulArticles();
            failed += m.getFailedArticles();
            proxyUsed |= m.isProxyUsed();
            durationSeconds += m.getDurationSeconds() == null ? 0 : m.getDurationSeconds();
            errors.addAll(m.getErrors());
            InsertResult stored = daily.getStoreResult();
            if (stored != null) {
                inserted += stored.getInserted();
                updated += stored.getUpdated();
                errors.addAll(stored.getErrors());
            }
        }

        ScrapeRunRecord toRecord(String source) {
            return ScrapeRunRecord.builder()
                    .source(source)
                    .runType(RunType.BACKFILL)
                    .startDate(oldest)
                    .endDate(newest)
                    .startedAt(startedAt)
                    .completedAt(completedAt)
                    .status(successful == 0 && !errors.isEmpty() ? "failed" : "completed")
                    .totalArticles(total)
                    .successfulArticles(successful)
                    .failedArticles(failed)
                    .newArticles(inserted)
                    .updatedArticles(updated)
                    .errors(errors.isEmpty() ? null : List.copyOf(errors))
                    .proxyUsed(proxyUsed)
                    .durationSeconds(durationSeconds)
                    .build();
        }
    }
}
