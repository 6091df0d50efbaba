package com.newsintel.alcalor.service;

import com.newsintel.alcalor.config.ScraperProperties;
import com.newsintel.alcalor.model.Article;
import com.newsintel.alcalor.model.ArticleRef;
import com.newsintel.alcalor.model.DailyArticles;
import com.newsintel.alcalor.model.ExtractionResult;
import com.newsintel.alcalor.model.ExtractionResult.FailureKind;
import com.newsintel.alcalor.model.InsertResult;
import com.newsintel.alcalor.model.RunMetadata;
import com.newsintel.alcalor.model.RunOptions;
import com.newsintel.alcalor.model.RunType;
import com.newsintel.alcalor.model.ScrapeRunRecord;
import com.newsintel.alcalor.output.OutputRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scrapes one date at a time: list the day's articles, extract them concurrently,
 * aggregate, persist.
 *
 * Per date the pipeline moves through DISCOVERING, FETCHING, AGGREGATING, PERSISTING
 * and DONE. Extraction tasks share one limiter of {@code workers} permits and each
 * returns its own {@link ExtractionResult}; the fan-in waits for every task and
 * aggregates on the calling thread. Dates are never processed in parallel.
 *
 * One instance owns a worker pool and must be closed. The HTTP connection pool behind
 * the {@link PageFetcher} is shared across all dates of the run.
 */
@Slf4j
public class ArticlePipeline implements AutoCloseable {

    enum Stage { DISCOVERING, FETCHING, AGGREGATING, PERSISTING, DONE }

    private final PageFetcher fetcher;
    private final PageParser parser;
    private final OutputRouter outputRouter;
    private final ScraperProperties properties;
    private final RunOptions options;
    private final Clock clock;

    private final ExecutorService executor;
    private final Semaphore limiter;

    public ArticlePipeline(PageFetcher fetcher, PageParser parser, OutputRouter outputRouter,
                           ScraperProperties properties, RunOptions options, Clock clock) {
        this.fetcher = fetcher;
        this.parser = parser;
        this.outputRouter = outputRouter;
        this.properties = properties;
        this.options = options;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(options.workers(), workerThreads());
        this.limiter = new Semaphore(options.workers());
    }

    public RunOptions getOptions() {
        return options;
    }

    /**
     * Fetch and parse the archive listing for one date.
     *
     * @return article references in page order, empty for a day without articles
     * @throws FetchException when the listing page itself could not be retrieved
     */
    public List<ArticleRef> listArticles(LocalDate date) throws FetchException {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getSite().archiveUrl())
                .queryParam("fn", date.toString())
                .toUriString();
        log.info("Fetching archive for {}: {}", date, url);
        return parser.parseListing(fetcher.fetch(url), date);
    }

    /**
     * Fetch and parse one article under the shared limiter. Never throws: every failure
     * comes back as a failed {@link ExtractionResult}.
     *
     * @param total size of the day's listing, used for progress lines only
     */
    public ExtractionResult extractArticle(ArticleRef ref, int total) {
        try {
            limiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExtractionResult.failure(ref.url(), FailureKind.UNEXPECTED, "Interrupted before fetch");
        }
        try {
            log.info("[{}/{}] Scraping: {}", ref.position(), total, ref.url());
            String html = fetcher.fetch(ref.url());
            Article article = parser.parseDetail(html, ref.url());
            log.debug("Successfully extracted: {}", article.getTitle());
            fetcher.courtesyPause(options.workers());
            return ExtractionResult.success(article);

        } catch (FetchException e) {
            log.error("Error extracting {}: {}", ref.url(), e.getMessage());
            FailureKind kind = e.getKind() == FetchException.Kind.PERMANENT
                    ? FailureKind.FETCH_PERMANENT
                    : FailureKind.FETCH_TRANSIENT;
            return ExtractionResult.failure(ref.url(), kind, e.getMessage());

        } catch (RuntimeException e) {
            log.error("Error extracting {}: {}", ref.url(), e.getMessage(), e);
            return ExtractionResult.failure(ref.url(), FailureKind.UNEXPECTED, e.toString());

        } finally {
            limiter.release();
        }
    }

    /**
     * Scrape every article published on {@code date}. Listing, extraction and sink
     * failures are recorded in the returned metadata; this method does not throw.
     */
    public DailyArticles scrapeDate(LocalDate date) {
        RunMetadata metadata = RunMetadata.start(date, fetcher.isProxied(), clock);
        log.info("Starting scrape for {}", date);

        DailyArticles daily;
        try {
            daily = runStages(date, metadata);
        } catch (RuntimeException e) {
            log.error("Critical error scraping {}: {}", date, e.getMessage(), e);
            metadata.recordError(e.toString());
            if (metadata.getEndTime() == null) {
                metadata.finish(clock);
            }
            daily = DailyArticles.empty(metadata);
        }

        if (options.runType() != RunType.BACKFILL) {
            outputRouter.writeScrapeRun(
                    ScrapeRunRecord.forDate(properties.getSourceName(), options.runType(),
                            daily.getMetadata(), daily.getStoreResult()),
                    options);
        }
        enter(Stage.DONE, date);
        return daily;
    }

    /**
     * Scrape an inclusive date range, oldest first, one date at a time.
     */
    public List<DailyArticles> scrapeRange(LocalDate start, LocalDate end) {
        List<DailyArticles> results = new ArrayList<>();
        for (LocalDate current = start; !current.isAfter(end); current = current.plusDays(1)) {
            results.add(scrapeDate(current));
        }
        log.info("Completed scraping {} days", results.size());
        return results;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private DailyArticles runStages(LocalDate date, RunMetadata metadata) {
        enter(Stage.DISCOVERING, date);
        List<ArticleRef> refs;
        try {
            refs = listArticles(date);
        } catch (FetchException e) {
            log.error("Error getting URLs for {}: {}", date, e.getMessage());
            metadata.recordError("Listing failed: " + e.getMessage());
            refs = List.of();
        }

        metadata.setTotalArticles(refs.size());
        if (refs.isEmpty()) {
            log.warn("No articles found for {}", date);
            metadata.finish(clock);
            return DailyArticles.empty(metadata);
        }

        enter(Stage.FETCHING, date);
        List<ExtractionResult> outcomes = fanOut(refs);

        enter(Stage.AGGREGATING, date);
        List<Article> articles = new ArrayList<>(outcomes.size());
        for (ExtractionResult outcome : outcomes) {
            if (outcome.isSuccess()) {
                articles.add(outcome.article());
                metadata.recordSuccess();
            } else {
                metadata.recordFailure(outcome.url() + ": " + outcome.error());
            }
        }
        metadata.finish(clock);
        log.info("Completed {}: {}/{} articles in {}s ({} articles/sec)",
                date, metadata.getSuccessfulArticles(), metadata.getTotalArticles(),
                String.format("%.2f", metadata.getDurationSeconds()),
                String.format("%.2f", metadata.articlesPerSecond()));

        DailyArticles daily = new DailyArticles(date, List.copyOf(articles), metadata, null);

        enter(Stage.PERSISTING, date);
        InsertResult storeResult = outputRouter.write(daily, options);
        return daily.withStoreResult(storeResult);
    }

    /**
     * Submit one task per reference and wait for all of them. Results come back in
     * completion order.
     */
    private List<ExtractionResult> fanOut(List<ArticleRef> refs) {
        CompletionService<ExtractionResult> completion = new ExecutorCompletionService<>(executor);
        for (ArticleRef ref : refs) {
            completion.submit(() -> extractArticle(ref, refs.size()));
        }

        List<ExtractionResult> outcomes = new ArrayList<>(refs.size());
        for (int done = 0; done < refs.size(); done++) {
            try {
                outcomes.add(completion.take().get());
            } catch (ExecutionException e) {
                // extractArticle converts exceptions itself; only an Error gets here
                outcomes.add(ExtractionResult.failure("unknown", FailureKind.UNEXPECTED,
                        String.valueOf(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted while waiting for {} extraction(s)", refs.size() - done);
                for (int i = done; i < refs.size(); i++) {
                    outcomes.add(ExtractionResult.failure("unknown", FailureKind.UNEXPECTED,
                            "Interrupted before completion"));
                }
                break;
            }
        }
        return outcomes;
    }

    private void enter(Stage stage, LocalDate date) {
        log.debug("{} -> {}", date, stage);
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "article-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
