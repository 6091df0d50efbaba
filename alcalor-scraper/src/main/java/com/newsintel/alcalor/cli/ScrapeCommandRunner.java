package com.newsintel.alcalor.cli;

import com.newsintel.alcalor.config.ScraperProperties;
import com.newsintel.alcalor.model.DailyArticles;
import com.newsintel.alcalor.model.RunOptions;
import com.newsintel.alcalor.model.RunType;
import com.newsintel.alcalor.output.ArticleStore;
import com.newsintel.alcalor.service.ArticlePipeline;
import com.newsintel.alcalor.service.ArticlePipelineFactory;
import com.newsintel.alcalor.service.BackfillRequest;
import com.newsintel.alcalor.service.BackfillService;
import com.newsintel.alcalor.service.ShutdownSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Command-line entry point. Parses the arguments, decides which sinks are usable and
 * hands off to the pipeline or the backfill service.
 *
 * Exit codes: 0 success, 1 failed health check or unhandled error, 2 usage error.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Duration SHUTDOWN_DRAIN_TIMEOUT = Duration.ofMinutes(10);

    private final ArticlePipelineFactory pipelineFactory;
    private final BackfillService backfillService;
    private final ArticleStore articleStore;
    private final ScraperProperties properties;
    private final Clock clock;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        ScrapeOptions options;
        try {
            options = ScrapeOptions.parse(args.getSourceArgs());
        } catch (CliUsageException e) {
            log.error("{}", e.getMessage());
            log.info("\n{}", ScrapeOptions.USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        if (options.isHelp()) {
            log.info("\n{}", ScrapeOptions.USAGE);
            return;
        }

        try {
            exitCode = execute(options);
        } catch (RuntimeException e) {
            log.error("Fatal error: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    int execute(ScrapeOptions options) {
        if (options.isHealthCheck()) {
            return healthCheck() ? EXIT_OK : EXIT_FAILURE;
        }

        int requested = options.getConcurrent() != null
                ? options.getConcurrent()
                : properties.getConcurrency().getDefaultWorkers();
        int workers = properties.getConcurrency().clamp(requested);
        if (workers != requested) {
            log.warn("Concurrency {} out of range; using {}", requested, workers);
        }

        boolean writeFiles = !options.isDbOnly();
        boolean useStore = !options.isNoDb() && connectStore();
        if (!writeFiles && !useStore) {
            log.warn("Database unavailable with --db-only; writing JSON files instead");
            writeFiles = true;
        }
        RunType runType = options.isBackfill() ? RunType.BACKFILL
                : options.isToday() ? RunType.DAILY
                : RunType.MANUAL;
        RunOptions runOptions = new RunOptions(workers, writeFiles, useStore, runType);

        log.info("=".repeat(60));
        log.info("AlCalorPolitico Scraper");
        log.info("=".repeat(60));
        log.info("Output directory: {}", properties.getOutput().getDir());
        log.info("Concurrent requests: {}", workers);
        log.info("Proxy: {}", properties.getProxy().isEnabled() ? properties.getProxy().maskedUrl() : "disabled");
        log.info("JSON output: {}", writeFiles ? "enabled" : "disabled");
        log.info("Database: {}", useStore ? "enabled" : "disabled");
        log.info("=".repeat(60));

        if (options.isBackfill()) {
            runBackfill(options, runOptions);
        } else {
            try (ArticlePipeline pipeline = pipelineFactory.open(runOptions)) {
                if (options.getDate() != null) {
                    pipeline.scrapeDate(options.getDate());
                } else if (options.isToday()) {
                    scrapeToday(pipeline);
                } else {
                    List<DailyArticles> days = pipeline.scrapeRange(options.getStartDate(), options.getEndDate());
                    int articles = days.stream().mapToInt(DailyArticles::getTotalArticles).sum();
                    log.info("Range {} to {}: {} articles over {} days",
                            options.getStartDate(), options.getEndDate(), articles, days.size());
                }
            }
        }

        log.info("=".repeat(60));
        log.info("Scraping completed!");
        log.info("=".repeat(60));
        return EXIT_OK;
    }

    private void scrapeToday(ArticlePipeline pipeline) {
        LocalDate today = LocalDate.now(clock);
        int rescrapeDays = Math.max(0, properties.getToday().getRescrapeDays());
        if (rescrapeDays == 0) {
            pipeline.scrapeDate(today);
        } else {
            log.info("Scraping {} to {} (re-scrape window {} days)", today.minusDays(rescrapeDays), today, rescrapeDays);
            pipeline.scrapeRange(today.minusDays(rescrapeDays), today);
        }
    }

    private void runBackfill(ScrapeOptions options, RunOptions runOptions) {
        ShutdownSignal signal = new ShutdownSignal();
        Thread hook = new Thread(() -> {
            log.warn("Shutdown signal received. Completing current date...");
            signal.request();
            if (!signal.awaitDrained(SHUTDOWN_DRAIN_TIMEOUT)) {
                log.warn("Backfill did not drain within {}", SHUTDOWN_DRAIN_TIMEOUT);
            }
        }, "backfill-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            backfillService.run(
                    new BackfillRequest(options.getStartDate(), options.getEndDate(), options.isResume()),
                    runOptions, signal);
        } finally {
            signal.markDrained();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down; hook stays registered");
            }
        }
    }

    /**
     * Create the schema if needed. A store that cannot be reached turns the run into a
     * file-only run rather than failing it.
     */
    private boolean connectStore() {
        try {
            articleStore.ensureSchema();
            return true;
        } catch (RuntimeException e) {
            log.warn("Database connection failed: {}", e.getMessage());
            log.warn("Continuing with JSON-only mode");
            return false;
        }
    }

    private boolean healthCheck() {
        if (!articleStore.isHealthy()) {
            log.error("Database health check: FAILED");
            return false;
        }
        log.info("Database health check: OK");
        try {
            String source = properties.getSourceName();
            log.info("Articles stored for {}: {}", source, articleStore.countArticles(source));
            articleStore.publicationDateRange(source).ifPresent(range ->
                    log.info("Publication dates: {} to {}", range.earliest(), range.latest()));
        } catch (RuntimeException e) {
            log.warn("Could not read article statistics: {}", e.getMessage());
        }
        return true;
    }
}
