package com.newsintel.alcalor.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-date run record. Created when the date starts, updated while the fan-in is
 * aggregated, finalised with {@link #finish(Clock)} and then only read.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"date", "start_time", "end_time", "total_articles", "successful_articles",
        "failed_articles", "errors", "proxy_used", "duration_seconds"})
public class RunMetadata {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private OffsetDateTime startTime;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private OffsetDateTime endTime;      // null until finished

    private int totalArticles;
    private int successfulArticles;
    private int failedArticles;
    private List<String> errors = new ArrayList<>();
    private boolean proxyUsed;
    private Double durationSeconds;      // null until finished

    public static RunMetadata start(LocalDate date, boolean proxyUsed, Clock clock) {
        RunMetadata metadata = new RunMetadata();
        metadata.setDate(date);
        metadata.setProxyUsed(proxyUsed);
        metadata.setStartTime(OffsetDateTime.now(clock));
        return metadata;
    }

    public void recordSuccess() {
        successfulArticles++;
    }

    public void recordFailure(String error) {
        failedArticles++;
        if (error != null) {
            errors.add(error);
        }
    }

    public void recordError(String error) {
        errors.add(error);
    }

    public void finish(Clock clock) {
        endTime = OffsetDateTime.now(clock);
        durationSeconds = Duration.between(startTime, endTime).toMillis() / 1000.0;
    }

    /** Articles per second over the whole run, 0 when nothing was timed. */
    public double articlesPerSecond() {
        if (durationSeconds == null || durationSeconds <= 0) {
            return 0.0;
        }
        return totalArticles / durationSeconds;
    }
}
