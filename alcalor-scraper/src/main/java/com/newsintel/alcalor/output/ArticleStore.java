package com.newsintel.alcalor.output;

import com.newsintel.alcalor.model.Article;
import com.newsintel.alcalor.model.BackfillProgress;
import com.newsintel.alcalor.model.BackfillStatus;
import com.newsintel.alcalor.model.InsertResult;
import com.newsintel.alcalor.model.PublicationDateRange;
import com.newsintel.alcalor.model.ScrapeRunRecord;
import com.newsintel.alcalor.model.UpsertOutcome;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for articles, run bookkeeping and the backfill checkpoint.
 */
public interface ArticleStore {

    /** Create tables and indexes when missing. Fails when the store is unreachable. */
    void ensureSchema();

    boolean isHealthy();

    /**
     * Insert or overwrite the article keyed by (source, article id). Every mutable field
     * is replaced and the image list is replaced wholesale.
     *
     * @throws IllegalArgumentException when the article has no id
     */
    UpsertOutcome upsert(Article article, String source);

    /**
     * Sequential upserts. A failing item is recorded in the result and the rest of the
     * batch still runs; nothing is rolled back.
     */
    default InsertResult bulkUpsert(List<Article> articles, String source) {
        InsertResult result = InsertResult.forBatch(articles.size());
        for (Article article : articles) {
            try {
                result.record(upsert(article, source));
            } catch (RuntimeException e) {
                result.recordError("Failed to insert article "
                        + article.findArticleId().orElse(article.getUrl()) + ": " + e.getMessage());
            }
        }
        return result;
    }

    Optional<BackfillProgress> findBackfillProgress(String source);

    /** Overwrites the single checkpoint row for the source. */
    void saveBackfillProgress(String source, LocalDate lastCompletedDate, BackfillStatus status);

    void recordScrapeRun(ScrapeRunRecord run);

    long countArticles(String source);

    Optional<PublicationDateRange> publicationDateRange(String source);
}
