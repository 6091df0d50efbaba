package com.newsintel.alcalor.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsintel.alcalor.config.ScraperProperties;
import com.newsintel.alcalor.model.DailyArticles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;

/**
 * Writes one day of articles to JSON files.
 *
 * Output paths:
 *   {outputDir}/articles/articles_YYYYMMDD.json   (date, total_articles, articles, metadata)
 *   {outputDir}/metadata/metadata_YYYYMMDD.json   (metadata only)
 *
 * Files are UTF-8, pretty printed, non-ASCII left unescaped. Re-running a date
 * overwrites both files.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonFileWriter {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final ObjectMapper objectMapper;
    private final ScraperProperties properties;

    public Path write(DailyArticles daily) {
        Path outputDir = Paths.get(properties.getOutput().getDir());
        String stamp = daily.getDate().format(FILE_DATE);

        Path articlesPath = outputDir.resolve("articles").resolve("articles_" + stamp + ".json");
        Path metadataPath = outputDir.resolve("metadata").resolve("metadata_" + stamp + ".json");

        writeJson(articlesPath, daily);
        writeJson(metadataPath, daily.getMetadata());

        log.info("Saved {} articles to {}", daily.getTotalArticles(), articlesPath);
        return articlesPath;
    }

    private void writeJson(Path path, Object value) {
        ensureDirectory(path.getParent());
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), value);
        } catch (IOException e) {
            log.error("Failed to write JSON file {}: {}", path, e.getMessage(), e);
            throw new UncheckedIOException("JSON write failed: " + path, e);
        }
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
