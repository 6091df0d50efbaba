package com.newsintel.alcalor.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * One article as extracted from its detail page.
 *
 * Only {@code url} is guaranteed. Every other field is null when the page did not
 * carry it; that is an extraction result, not an error. Instances are immutable and
 * a re-scrape of the same id produces a new instance that replaces the stored one.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"article_id", "url", "title", "subtitle", "section", "source", "location",
        "date", "body", "body_html", "images", "keywords", "scraped_at"})
public class Article {

    // ── Identity ────────────────────────────────────────────────────────────
    /** Numeric token before ".html" in the URL, e.g. "123456" */
    String articleId;

    String url;

    // ── Header region ───────────────────────────────────────────────────────
    String title;
    String subtitle;
    String section;

    /** Byline: the agency or author line around the location span */
    @JsonProperty("source")
    String byline;

    /** Raw location text, usually "City, State DD/MM/YYYY" */
    String location;

    /** Publication date parsed out of the location text */
    @JsonProperty("date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate publicationDate;

    // ── Body ────────────────────────────────────────────────────────────────
    String body;
    String bodyHtml;

    @Builder.Default
    List<ArticleImage> images = List.of();

    @Builder.Default
    List<String> keywords = List.of();

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    OffsetDateTime scrapedAt;

    public Optional<String> findArticleId() {
        return Optional.ofNullable(articleId);
    }

    public Optional<LocalDate> findPublicationDate() {
        return Optional.ofNullable(publicationDate);
    }
}
