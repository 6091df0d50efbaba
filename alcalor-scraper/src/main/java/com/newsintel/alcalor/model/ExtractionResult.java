package com.newsintel.alcalor.model;

/**
 * What one extraction task hands back to the fan-in: either an article or a
 * failure description. Tasks never throw across the join.
 */
public record ExtractionResult(String url, Article article, FailureKind failureKind, String error) {

    public enum FailureKind {
        /** Transport errors outlasted every retry */
        FETCH_TRANSIENT,
        /** HTTP status error, not retried */
        FETCH_PERMANENT,
        /** Anything thrown while parsing or otherwise inside the task */
        UNEXPECTED
    }

    public static ExtractionResult success(Article article) {
        return new ExtractionResult(article.getUrl(), article, null, null);
    }

    public static ExtractionResult failure(String url, FailureKind kind, String error) {
        return new ExtractionResult(url, null, kind, error);
    }

    public boolean isSuccess() {
        return article != null;
    }
}
