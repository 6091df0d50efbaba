package com.newsintel.alcalor.service;

import com.newsintel.alcalor.config.ScraperProperties;
import com.newsintel.alcalor.model.ArticleRef;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackfillServiceTest {

    private static final String SOURCE = "alcalorpolitico";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private static final RunOptions WITH_STORE = new RunOptions(5, false, true, RunType.BACKFILL);
    private static final RunOptions FILES_ONLY = new RunOptions(5, true, false, RunType.BACKFILL);

    private ArticlePipeline pipeline;
    private ArticleStore store;
    private OutputRouter outputRouter;
    private ScraperProperties properties;
    private BackfillService service;

    @BeforeEach
    void setUp() {
        pipeline = mock(ArticlePipeline.class);
        ArticlePipelineFactory factory = mock(ArticlePipelineFactory.class);
        when(factory.open(any())).thenReturn(pipeline);
        store = mock(ArticleStore.class);
        outputRouter = mock(OutputRouter.class);

        properties = new ScraperProperties();
        properties.getBackfill().setProbeDelayMs(0);

        when(pipeline.scrapeDate(any())).thenAnswer(inv -> day(inv.getArgument(0), 2, 0));

        service = new BackfillService(factory, store, outputRouter, properties, CLOCK);
    }

    @Nested
    class Walk {

        @Test
        @DisplayName("walks from the end date backwards to the start date")
        void newestFirst() {
            BackfillStats stats = service.run(
                    new BackfillRequest(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 3), false),
                    WITH_STORE, new ShutdownSignal());

            InOrder order = inOrder(pipeline);
            order.verify(pipeline).scrapeDate(LocalDate.of(2024, 3, 3));
            order.verify(pipeline).scrapeDate(LocalDate.of(2024, 3, 2));
            order.verify(pipeline).scrapeDate(LocalDate.of(2024, 3, 1));
            assertThat(stats.getDaysCompleted()).isEqualTo(3);
            assertThat(stats.getTotalArticles()).isEqualTo(6);
            assertThat(stats.getFinalStatus()).isEqualTo(BackfillStatus.COMPLETED);
            verify(store).saveBackfillProgress(SOURCE, LocalDate.of(2024, 3, 1), BackfillStatus.COMPLETED);
        }

        @Test
        void endDefaultsToYesterday() {
            service.run(new BackfillRequest(LocalDate.of(2024, 5, 31), null, false), WITH_STORE, new ShutdownSignal());

            verify(pipeline, times(1)).scrapeDate(any());
            verify(pipeline).scrapeDate(LocalDate.of(2024, 5, 31));
        }

        @Test
        @DisplayName("progress is checkpointed after every day, including days with failures")
        void checkpointsEveryDay() {
            when(pipeline.scrapeDate(LocalDate.of(2024, 3, 2))).thenReturn(day(LocalDate.of(2024, 3, 2), 0, 4));

            BackfillStats stats = service.run(
                    new BackfillRequest(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 3), false),
                    WITH_STORE, new ShutdownSignal());

            InOrder order = inOrder(store);
            order.verify(store).saveBackfillProgress(SOURCE, LocalDate.of(2024, 3, 3), BackfillStatus.IN_PROGRESS);
            order.verify(store).saveBackfillProgress(SOURCE, LocalDate.of(2024, 3, 2), BackfillStatus.IN_PROGRESS);
            order.verify(store).saveBackfillProgress(SOURCE, LocalDate.of(2024, 3, 1), BackfillStatus.IN_PROGRESS);
            order.verify(store).saveBackfillProgress(SOURCE, LocalDate.of(2024, 3, 1), BackfillStatus.COMPLETED);
            assertThat(stats.getErrors()).isEqualTo(4);
        }

        @Test
        void talliesStoreOutcomes() {
            InsertResult stored = InsertResult.forBatch(2);
            stored.setInserted(1);
            stored.setUpdated(1);
            when(pipeline.scrapeDate(any())).thenAnswer(inv -> day(inv.getArgument(0), 2, 0).withStoreResult(stored));

            BackfillStats stats = service.run(
                    new BackfillRequest(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2), false),
                    WITH_STORE, new ShutdownSignal());

            assertThat(stats.getNewArticles()).isEqualTo(2);
            assertThat(stats.getUpdatedArticles()).isEqualTo(2);
        }

        @Test
        void fileOnlyRunNeverTouchesTheStore() {
            service.run(new BackfillRequest(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2), true),
                    FILES_ONLY, new ShutdownSignal());

            verify(store, never()).findBackfillProgress(any());
            verify(store, never()).saveBackfillProgress(any(), any(), any());
        }

        @Test
        @DisplayName("one scrape run row per batch of days")
        void recordsBatchRuns() {
            properties.getBackfill().setBatchSize(2);

            service.run(new BackfillRequest(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 3), false),
                    WITH_STORE, new ShutdownSignal());

            ArgumentCaptor<ScrapeRunRecord> runs = ArgumentCaptor.forClass(ScrapeRunRecord.class);
            verify(outputRouter, times(2)).writeScrapeRun(runs.capture(), eq(WITH_STORE));
            ScrapeRunRecord first = runs.getAllValues().get(0);
            assertThat(first.getRunType()).isEqualTo(RunType.BACKFILL);
            assertThat(first.getStartDate()).isEqualTo(LocalDate.of(2024, 3, 2));
            assertThat(first.getEndDate()).isEqualTo(LocalDate.of(2024, 3, 3));
            assertThat(first.getSuccessfulArticles()).isEqualTo(4);
            ScrapeRunRecord second = runs.getAllValues().get(1);
            assertThat(second.getStartDate()).isEqualTo(LocalDate.of(2024, 3, 1));
            assertThat(second.getEndDate()).isEqualTo(LocalDate.of(2024, 3, 1));
        }
    }

    @Nested
    class Resume {

        @Test
        @DisplayName("resuming from a checkpoint of 2024-03-10 starts at 2024-03-09")
        void resumesOneDayBelowCheckpoint() {
            when(store.findBackfillProgress(SOURCE)).thenReturn(Optional.of(
                    new BackfillProgress(SOURCE, LocalDate.of(2024, 3, 10), BackfillStatus.IN_PROGRESS)));

            service.run(new BackfillRequest(LocalDate.of(2024, 3, 8), null, true), WITH_STORE, new ShutdownSignal());

            InOrder order = inOrder(pipeline);
            order.verify(pipeline).scrapeDate(LocalDate.of(2024, 3, 9));
            order.verify(pipeline).scrapeDate(LocalDate.of(2024, 3, 8));
            verify(pipeline, times(2)).scrapeDate(any());
        }

        @Test
        void pausedCheckpointIsResumable() {
            when(store.findBackfillProgress(SOURCE)).thenReturn(Optional.of(
                    new BackfillProgress(SOURCE, LocalDate.of(2024, 3, 10), BackfillStatus.PAUSED)));

            service.run(new BackfillRequest(LocalDate.of(2024, 3, 9), null, true), WITH_STORE, new ShutdownSignal());

            verify(pipeline).scrapeDate(LocalDate.of(2024, 3, 9));
            verify(pipeline, times(1)).scrapeDate(any());
        }

        @Test
        void completedCheckpointIsNotAResumePoint() {
            when(store.findBackfillProgress(SOURCE)).thenReturn(Optional.of(
                    new BackfillProgress(SOURCE, LocalDate.of(2024, 3, 10), BackfillStatus.COMPLETED)));

            service.run(new BackfillRequest(LocalDate.of(2024, 5, 30), null, true), WITH_STORE, new ShutdownSignal());

            verify(pipeline).scrapeDate(LocalDate.of(2024, 5, 31));
            verify(pipeline).scrapeDate(LocalDate.of(2024, 5, 30));
        }

        @Test
        @DisplayName("a checkpoint already at the start date is closed as completed")
        void checkpointAtStartIsMarkedCompleted() {
            LocalDate start = LocalDate.of(2024, 3, 1);
            when(store.findBackfillProgress(SOURCE)).thenReturn(Optional.of(
                    new BackfillProgress(SOURCE, start, BackfillStatus.IN_PROGRESS)));

            BackfillStats stats = service.run(new BackfillRequest(start, null, true), WITH_STORE, new ShutdownSignal());

            assertThat(stats.getFinalStatus()).isEqualTo(BackfillStatus.COMPLETED);
            verify(pipeline, never()).scrapeDate(any());
            verify(store).saveBackfillProgress(SOURCE, start, BackfillStatus.COMPLETED);
        }
    }

    @Nested
    class Shutdown {

        @Test
        @DisplayName("a stop request finishes the current day and pauses")
        void pausesAfterInFlightDay() {
            ShutdownSignal signal = new ShutdownSignal();
            AtomicInteger calls = new AtomicInteger();
            when(pipeline.scrapeDate(any())).thenAnswer(inv -> {
                if (calls.incrementAndGet() == 2) signal.request();
                return day(inv.getArgument(0), 1, 0);
            });

            BackfillStats stats = service.run(
                    new BackfillRequest(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 10), false),
                    WITH_STORE, signal);

            assertThat(stats.getDaysCompleted()).isEqualTo(2);
            assertThat(stats.getFinalStatus()).isEqualTo(BackfillStatus.PAUSED);
            verify(pipeline, never()).scrapeDate(LocalDate.of(2024, 3, 8));
            verify(store).saveBackfillProgress(SOURCE, LocalDate.of(2024, 3, 9), BackfillStatus.PAUSED);
        }

        @Test
        void stopBeforeFirstDayLeavesCheckpointAlone() {
            ShutdownSignal signal = new ShutdownSignal();
            signal.request();

            BackfillStats stats = service.run(
                    new BackfillRequest(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 10), false),
                    WITH_STORE, signal);

            assertThat(stats.getFinalStatus()).isEqualTo(BackfillStatus.PAUSED);
            verify(pipeline, never()).scrapeDate(any());
            verify(store, never()).saveBackfillProgress(any(), any(), any());
        }

        @Test
        void stopDuringLastDayStillCompletes() {
            ShutdownSignal signal = new ShutdownSignal();
            when(pipeline.scrapeDate(any())).thenAnswer(inv -> {
                signal.request();
                return day(inv.getArgument(0), 1, 0);
            });

            BackfillStats stats = service.run(
                    new BackfillRequest(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 1), false),
                    WITH_STORE, signal);

            assertThat(stats.getFinalStatus()).isEqualTo(BackfillStatus.COMPLETED);
        }
    }

    @Nested
    class Discovery {

        @Test
        @DisplayName("binary search converges on the first day with articles")
        void findsEarliestDate() throws Exception {
            LocalDate firstDay = LocalDate.of(2010, 5, 5);
            when(pipeline.listArticles(any())).thenAnswer(inv -> {
                LocalDate date = inv.getArgument(0);
                return date.isBefore(firstDay) ? List.of() : List.of(new ArticleRef("u", 1));
            });

            assertThat(service.discoverEarliestDate(pipeline)).isEqualTo(firstDay);
        }

        @Test
        void emptyUpperBoundFallsBackToFloor() throws Exception {
            when(pipeline.listArticles(any())).thenReturn(List.of());

            assertThat(service.discoverEarliestDate(pipeline)).isEqualTo(LocalDate.of(2003, 1, 1));
            verify(pipeline, times(1)).listArticles(any());
        }

        @Test
        @DisplayName("a probe that keeps failing counts as an empty day")
        void failingProbeIsRetriedThenTreatedAsEmpty() throws Exception {
            when(pipeline.listArticles(any())).thenThrow(FetchException.transientFailure("u", 3, new RuntimeException("down")));

            assertThat(service.discoverEarliestDate(pipeline)).isEqualTo(LocalDate.of(2003, 1, 1));
            verify(pipeline, times(2)).listArticles(LocalDate.of(2023, 6, 2));
        }

        @Test
        void runWithoutStartDateDiscoversIt() throws Exception {
            when(pipeline.listArticles(any())).thenReturn(List.of());

            service.run(new BackfillRequest(null, LocalDate.of(2003, 1, 2), false), FILES_ONLY, new ShutdownSignal());

            verify(pipeline).scrapeDate(LocalDate.of(2003, 1, 2));
            verify(pipeline).scrapeDate(LocalDate.of(2003, 1, 1));
            verify(pipeline, times(2)).scrapeDate(any());
        }

        @Test
        void configuredStartDateSkipsDiscovery() throws Exception {
            properties.getBackfill().setStartDate("2024-05-30");

            service.run(new BackfillRequest(null, null, false), FILES_ONLY, new ShutdownSignal());

            verify(pipeline, never()).listArticles(any());
            verify(pipeline, times(2)).scrapeDate(any());
        }
    }

    private static DailyArticles day(LocalDate date, int successful, int failed) {
        RunMetadata metadata = RunMetadata.start(date, false, CLOCK);
        metadata.setTotalArticles(successful + failed);
        for (int i = 0; i < successful; i++) metadata.recordSuccess();
        for (int i = 0; i < failed; i++) metadata.recordFailure("failed " + i);
        metadata.finish(CLOCK);
        return new DailyArticles(date, List.of(), metadata, null);
    }
}
