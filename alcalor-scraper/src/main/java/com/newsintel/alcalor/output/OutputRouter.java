package com.newsintel.alcalor.output;

import com.newsintel.alcalor.config.ScraperProperties;
import com.newsintel.alcalor.model.DailyArticles;
import com.newsintel.alcalor.model.InsertResult;
import com.newsintel.alcalor.model.RunOptions;
import com.newsintel.alcalor.model.ScrapeRunRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes a finished day to the JSON files and/or the database, depending on the
 * run options. Sink failures are logged and never abort the run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final JsonFileWriter jsonFileWriter;
    private final ArticleStore articleStore;
    private final ScraperProperties properties;

    /**
     * @return the database result, or null when the store was not written
     */
    public InsertResult write(DailyArticles daily, RunOptions options) {
        if (options.writeFiles()) {
            try {
                jsonFileWriter.write(daily);
            } catch (RuntimeException e) {
                log.error("Failed to save JSON for {}: {}", daily.getDate(), e.getMessage());
                daily.getMetadata().recordError("JSON write failed: " + e.getMessage());
            }
        }

        if (!options.useStore() || daily.getArticles().isEmpty()) {
            return null;
        }

        InsertResult result = articleStore.bulkUpsert(daily.getArticles(), properties.getSourceName());
        log.info("Database: {} new, {} updated", result.getInserted(), result.getUpdated());
        if (!result.getErrors().isEmpty()) {
            log.warn("Database errors: {}", result.getErrors().size());
            result.getErrors().forEach(err -> log.debug("  {}", err));
        }
        return result;
    }

    public void writeScrapeRun(ScrapeRunRecord run, RunOptions options) {
        if (!options.useStore()) return;
        try {
            articleStore.recordScrapeRun(run);
        } catch (Exception e) {
            log.warn("Failed to write scrape run metadata: {}", e.getMessage());
        }
    }
}
