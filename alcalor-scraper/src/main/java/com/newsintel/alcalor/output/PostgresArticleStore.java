package com.newsintel.alcalor.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsintel.alcalor.model.Article;
import com.newsintel.alcalor.model.ArticleImage;
import com.newsintel.alcalor.model.BackfillProgress;
import com.newsintel.alcalor.model.BackfillStatus;
import com.newsintel.alcalor.model.PublicationDateRange;
import com.newsintel.alcalor.model.ScrapeRunRecord;
import com.newsintel.alcalor.model.UpsertOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed {@link ArticleStore}.
 *
 * articles is unique on (source, article_id) so several site scrapers can share the
 * table. Images live in article_images and are rewritten on every upsert.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PostgresArticleStore implements ArticleStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS articles
            (
                id                  UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                source              VARCHAR(50) NOT NULL,
                article_id          VARCHAR(50) NOT NULL,
                url                 TEXT NOT NULL,
                title               TEXT,
                subtitle            TEXT,
                section             VARCHAR(100),
                author              VARCHAR(255),
                location            TEXT,
                publication_date    DATE,
                body                TEXT,
                body_html           TEXT,
                keywords            TEXT[],
                scraped_at          TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at          TIMESTAMPTZ,
                CONSTRAINT unique_source_article UNIQUE (source, article_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS article_images
            (
                id                  UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                article_id          UUID NOT NULL REFERENCES articles(id) ON DELETE CASCADE,
                url                 TEXT NOT NULL,
                caption             TEXT,
                position            INT DEFAULT 0,
                created_at          TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS scrape_runs
            (
                id                  UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                source              VARCHAR(50) NOT NULL,
                run_type            VARCHAR(20) NOT NULL,
                target_date         DATE,
                start_date          DATE,
                end_date            DATE,
                started_at          TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                completed_at        TIMESTAMPTZ,
                total_articles      INT DEFAULT 0,
                successful_articles INT DEFAULT 0,
                failed_articles     INT DEFAULT 0,
                new_articles        INT DEFAULT 0,
                updated_articles    INT DEFAULT 0,
                errors              JSONB,
                status              VARCHAR(20) DEFAULT 'running',
                proxy_used          BOOLEAN DEFAULT FALSE,
                duration_seconds    FLOAT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS backfill_progress
            (
                id                  UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                source              VARCHAR(50) NOT NULL,
                last_completed_date DATE NOT NULL,
                started_at          TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at          TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                status              VARCHAR(20) DEFAULT 'in_progress',
                CONSTRAINT unique_source_backfill UNIQUE (source)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_articles_source_date ON articles(source, publication_date)",
            "CREATE INDEX IF NOT EXISTS idx_articles_scraped_at ON articles(scraped_at)",
            "CREATE INDEX IF NOT EXISTS idx_articles_section ON articles(section)",
            "CREATE INDEX IF NOT EXISTS idx_scrape_runs_source_date ON scrape_runs(source, target_date)",
            "CREATE INDEX IF NOT EXISTS idx_article_images_article_id ON article_images(article_id)",
            "CREATE INDEX IF NOT EXISTS idx_articles_title_fts ON articles "
                    + "USING gin(to_tsvector('spanish', COALESCE(title, '')))",
            "CREATE INDEX IF NOT EXISTS idx_articles_body_fts ON articles "
                    + "USING gin(to_tsvector('spanish', COALESCE(body, '')))"
    );

    private static final String UPSERT_ARTICLE = """
            INSERT INTO articles (
                source, article_id, url, title, subtitle, section,
                author, location, publication_date, body, body_html,
                keywords, scraped_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (source, article_id) DO UPDATE SET
                url = EXCLUDED.url,
                title = EXCLUDED.title,
                subtitle = EXCLUDED.subtitle,
                section = EXCLUDED.section,
                author = EXCLUDED.author,
                location = EXCLUDED.location,
                publication_date = EXCLUDED.publication_date,
                body = EXCLUDED.body,
                body_html = EXCLUDED.body_html,
                keywords = EXCLUDED.keywords,
                scraped_at = EXCLUDED.scraped_at,
                updated_at = NOW()
            RETURNING id, (xmax = 0) AS was_inserted
            """;

    private record UpsertedRow(UUID id, boolean inserted) {}

    @Override
    public void ensureSchema() {
        log.info("Ensuring PostgreSQL schema exists...");
        SCHEMA.forEach(jdbcTemplate::execute);
        log.info("PostgreSQL schema ready.");
    }

    @Override
    public boolean isHealthy() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return Objects.equals(one, 1);
        } catch (Exception e) {
            log.error("Health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public UpsertOutcome upsert(Article article, String source) {
        String articleId = article.findArticleId()
                .orElseThrow(() -> new IllegalArgumentException("Article has no id: " + article.getUrl()));

        UpsertedRow row = transactionTemplate.execute(status -> {
            warnOnIdCollision(source, articleId, article.getUrl());

            UpsertedRow upserted = jdbcTemplate.query(
                    con -> prepareUpsert(con, article, source, articleId),
                    rs -> {
                        rs.next();
                        return new UpsertedRow(rs.getObject("id", UUID.class), rs.getBoolean("was_inserted"));
                    });

            if (!upserted.inserted()) {
                jdbcTemplate.update("DELETE FROM article_images WHERE article_id = ?", upserted.id());
            }
            insertImages(upserted.id(), article.getImages());
            return upserted;
        });

        return row.inserted() ? UpsertOutcome.INSERTED : UpsertOutcome.UPDATED;
    }

    @Override
    public Optional<BackfillProgress> findBackfillProgress(String source) {
        List<BackfillProgress> rows = jdbcTemplate.query("""
                SELECT source, last_completed_date, status FROM backfill_progress
                WHERE source = ?
                """,
                (rs, i) -> new BackfillProgress(
                        rs.getString("source"),
                        rs.getObject("last_completed_date", LocalDate.class),
                        BackfillStatus.fromDbValue(rs.getString("status"))),
                source);
        return rows.stream().findFirst();
    }

    @Override
    public void saveBackfillProgress(String source, LocalDate lastCompletedDate, BackfillStatus status) {
        jdbcTemplate.update("""
                INSERT INTO backfill_progress (source, last_completed_date, status, started_at, updated_at)
                VALUES (?, ?, ?, NOW(), NOW())
                ON CONFLICT (source) DO UPDATE SET
                    last_completed_date = EXCLUDED.last_completed_date,
                    status = EXCLUDED.status,
                    updated_at = NOW()
                """, source, lastCompletedDate, status.dbValue());
    }

    @Override
    public void recordScrapeRun(ScrapeRunRecord run) {
        jdbcTemplate.update("""
                INSERT INTO scrape_runs (
                    source, run_type, target_date, start_date, end_date,
                    started_at, completed_at, total_articles, successful_articles,
                    failed_articles, new_articles, updated_articles,
                    errors, status, proxy_used, duration_seconds
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), ?, ?, ?)
                """,
                run.getSource(),
                run.getRunType().dbValue(),
                run.getTargetDate(),
                run.getStartDate(),
                run.getEndDate(),
                run.getStartedAt() != null ? run.getStartedAt() : OffsetDateTime.now(ZoneOffset.UTC),
                run.getCompletedAt(),
                run.getTotalArticles(),
                run.getSuccessfulArticles(),
                run.getFailedArticles(),
                run.getNewArticles(),
                run.getUpdatedArticles(),
                toJson(run.getErrors()),
                run.getStatus(),
                run.isProxyUsed(),
                run.getDurationSeconds());
    }

    @Override
    public long countArticles(String source) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM articles WHERE source = ?", Long.class, source);
        return count == null ? 0 : count;
    }

    @Override
    public Optional<PublicationDateRange> publicationDateRange(String source) {
        return jdbcTemplate.query("""
                SELECT MIN(publication_date) AS earliest, MAX(publication_date) AS latest
                FROM articles WHERE source = ?
                """,
                rs -> {
                    if (!rs.next() || rs.getObject("earliest") == null) return Optional.<PublicationDateRange>empty();
                    return Optional.of(new PublicationDateRange(
                            rs.getObject("earliest", LocalDate.class),
                            rs.getObject("latest", LocalDate.class)));
                },
                source);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private PreparedStatement prepareUpsert(Connection con, Article a, String source, String articleId)
            throws SQLException {
        PreparedStatement ps = con.prepareStatement(UPSERT_ARTICLE);
        ps.setString(1, source);
        ps.setString(2, articleId);
        ps.setString(3, a.getUrl());
        ps.setString(4, a.getTitle());
        ps.setString(5, a.getSubtitle());
        ps.setString(6, a.getSection());
        ps.setString(7, a.getByline());
        ps.setString(8, a.getLocation());
        if (a.getPublicationDate() != null) {
            ps.setObject(9, a.getPublicationDate());
        } else {
            ps.setNull(9, Types.DATE);
        }
        ps.setString(10, a.getBody());
        ps.setString(11, a.getBodyHtml());
        ps.setArray(12, con.createArrayOf("text", a.getKeywords().toArray()));
        ps.setObject(13, a.getScrapedAt() != null ? a.getScrapedAt() : OffsetDateTime.now(ZoneOffset.UTC));
        return ps;
    }

    private void insertImages(UUID articleRowId, List<ArticleImage> images) {
        if (images.isEmpty()) return;
        List<Object[]> rows = new ArrayList<>(images.size());
        for (int i = 0; i < images.size(); i++) {
            ArticleImage img = images.get(i);
            rows.add(new Object[]{articleRowId, img.url(), img.caption(), i});
        }
        jdbcTemplate.batchUpdate(
                "INSERT INTO article_images (article_id, url, caption, position) VALUES (?, ?, ?, ?)", rows);
    }

    /**
     * The site's ids are assumed unique per source. When a stored row with the same id
     * points at a different URL the new article still wins, but the overwrite is logged.
     */
    private void warnOnIdCollision(String source, String articleId, String url) {
        List<String> existing = jdbcTemplate.queryForList(
                "SELECT url FROM articles WHERE source = ? AND article_id = ?", String.class, source, articleId);
        if (!existing.isEmpty() && !existing.get(0).equals(url)) {
            log.warn("Article id {} collision: overwriting {} with {}", articleId, existing.get(0), url);
        }
    }

    private String toJson(List<String> errors) {
        if (errors == null || errors.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(errors);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise run errors: {}", e.getMessage());
            return null;
        }
    }
}
