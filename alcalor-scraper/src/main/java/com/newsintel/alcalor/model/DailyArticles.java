package com.newsintel.alcalor.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything produced for one date: the extracted articles and the run record.
 */
@Value
@JsonPropertyOrder({"date", "total_articles", "articles", "metadata"})
public class DailyArticles {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate date;

    List<Article> articles;

    RunMetadata metadata;

    /** Result of the database write, null when the store was not used for this date */
    @JsonIgnore
    InsertResult storeResult;

    public static DailyArticles empty(RunMetadata metadata) {
        return new DailyArticles(metadata.getDate(), List.of(), metadata, null);
    }

    @JsonProperty("total_articles")
    public int getTotalArticles() {
        return articles.size();
    }

    public DailyArticles withStoreResult(InsertResult result) {
        return new DailyArticles(date, articles, metadata, result);
    }
}
