package com.newsintel.alcalor.service;

import com.newsintel.alcalor.config.ScraperProperties;
import com.newsintel.alcalor.model.Article;
import com.newsintel.alcalor.model.ArticleImage;
import com.newsintel.alcalor.model.ArticleRef;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the two page shapes of alcalorpolitico.com.
 *
 * Listing (notasarchivo.php?fn=YYYY-MM-DD):
 *   div.contenido holds the day's links; article links look like /informacion/slug-123456.html
 *
 * Detail:
 *   div#areasuperiorColumna    p#seccion, h1 title, h2 subtitle, h3 byline + span#lugar
 *   div.cuerponota             body, with ad (ins) and script nodes inside it
 *   script $.iLightBox([...])  gallery, or a#galerianotas thumbnail when absent
 *   meta[name=keywords]        comma separated keywords
 */
@Component
@Slf4j
public class AlcalorPageParser implements PageParser {

    static final String ARTICLE_PREFIX = "/informacion/";
    static final String ARTICLE_SUFFIX = ".html";

    private static final Pattern ARTICLE_ID = Pattern.compile("-(\\d+)\\.html$");
    private static final Pattern LOCATION_DATE = Pattern.compile("(\\d{2})/(\\d{2})/(\\d{4})");
    private static final String SECTION_LABEL = "Sección:";

    private final String baseUrl;
    private final LightboxGalleryParser galleryParser;

    @Autowired
    public AlcalorPageParser(ScraperProperties properties) {
        this(properties.getSite().getBaseUrl());
    }

    AlcalorPageParser(String baseUrl) {
        this.baseUrl = baseUrl;
        this.galleryParser = new LightboxGalleryParser(baseUrl);
    }

    @Override
    public List<ArticleRef> parseListing(String html, LocalDate forDate) {
        Document doc = Jsoup.parse(html, baseUrl);
        Element content = doc.selectFirst("div.contenido");
        if (content == null) {
            log.warn("No content div found for {}", forDate);
            return List.of();
        }

        List<ArticleRef> refs = new ArrayList<>();
        for (Element link : content.select("a[href]")) {
            String href = link.attr("href");
            if (href.startsWith(ARTICLE_PREFIX) && href.endsWith(ARTICLE_SUFFIX)) {
                refs.add(new ArticleRef(baseUrl + href, refs.size() + 1));
            }
        }

        log.info("Found {} articles for {}", refs.size(), forDate);
        return refs;
    }

    @Override
    public Article parseDetail(String html, String sourceUrl) {
        Document doc = Jsoup.parse(html, baseUrl);
        Article.ArticleBuilder article = Article.builder()
                .url(sourceUrl)
                .articleId(extractArticleId(sourceUrl))
                .scrapedAt(OffsetDateTime.now(ZoneOffset.UTC));

        parseHeader(doc, article);
        // gallery first: body cleanup removes script nodes inside the body container
        article.images(extractImages(doc));
        parseBody(doc, article);
        article.keywords(extractKeywords(doc));

        return article.build();
    }

    /**
     * @return trailing numeric token before ".html", or null when the URL has none
     */
    public static String extractArticleId(String url) {
        if (url == null) return null;
        Matcher m = ARTICLE_ID.matcher(url);
        return m.find() ? m.group(1) : null;
    }

    /**
     * First DD/MM/YYYY found in the text as a date, or null when absent or not a real date.
     */
    public static LocalDate extractDate(String text) {
        if (text == null) return null;
        Matcher m = LOCATION_DATE.matcher(text);
        if (!m.find()) return null;
        try {
            return LocalDate.of(Integer.parseInt(m.group(3)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)));
        } catch (DateTimeException e) {
            log.debug("Ignoring impossible date in '{}'", text);
            return null;
        }
    }

    // ── Detail sections ──────────────────────────────────────────────────────

    private void parseHeader(Document doc, Article.ArticleBuilder article) {
        Element header = doc.selectFirst("div#areasuperiorColumna");
        if (header == null) {
            log.debug("No header region on page");
            return;
        }

        Element section = header.selectFirst("p#seccion");
        if (section != null) {
            article.section(emptyToNull(section.text().replace(SECTION_LABEL, "").trim()));
        }

        article.title(textOf(header.selectFirst("h1")));
        article.subtitle(textOf(header.selectFirst("h2")));

        Element byline = header.selectFirst("h3");
        if (byline == null) return;

        Element place = byline.selectFirst("span#lugar");
        if (place != null) {
            String location = place.text().trim();
            article.location(emptyToNull(location));
            article.publicationDate(extractDate(location));
            article.byline(emptyToNull(byline.text().replace(location, "").trim()));
        }
    }

    private void parseBody(Document doc, Article.ArticleBuilder article) {
        Element body = doc.selectFirst("div.cuerponota");
        if (body == null) {
            log.debug("No body container on page");
            return;
        }

        body.select("ins, script").remove();
        article.bodyHtml(body.outerHtml());
        article.body(emptyToNull(BodyText.extract(body)));
    }

    private List<ArticleImage> extractImages(Document doc) {
        List<ArticleImage> images = new ArrayList<>();
        for (Element script : doc.select("script")) {
            images.addAll(galleryParser.parse(script.data()));
        }
        if (!images.isEmpty()) return List.copyOf(images);

        // Single-image articles have no gallery script, only a thumbnail link
        Element thumbnail = doc.selectFirst("a#galerianotas img[src]");
        if (thumbnail != null) {
            String src = thumbnail.attr("src").replace("/previas/", "/originales/");
            return List.of(new ArticleImage(src.startsWith("http") ? src : baseUrl + src, ""));
        }
        return List.of();
    }

    private List<String> extractKeywords(Document doc) {
        Element meta = doc.selectFirst("meta[name=keywords]");
        if (meta == null || meta.attr("content").isBlank()) return List.of();
        return Arrays.stream(meta.attr("content").split(","))
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .toList();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String textOf(Element element) {
        return element == null ? null : emptyToNull(element.text().trim());
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
