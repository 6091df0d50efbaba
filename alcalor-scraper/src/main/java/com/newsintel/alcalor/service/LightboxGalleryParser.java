package com.newsintel.alcalor.service;

import com.newsintel.alcalor.model.ArticleImage;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the image list out of the gallery script on article pages:
 *
 * <pre>
 *   $.iLightBox([
 *       { URL: "/fotos/originales/1.jpg", caption: "Caption one" },
 *       { URL: "/fotos/originales/2.jpg", caption: "Caption two" }
 *   ]);
 * </pre>
 *
 * Only this literal shape is recognised. Entries with other keys or ordering are skipped.
 */
public class LightboxGalleryParser {

    static final String MARKER = "$.iLightBox";

    private static final Pattern ARRAY = Pattern.compile("\\$\\.iLightBox\\(\\s*\\[([^\\]]+)\\]", Pattern.DOTALL);
    private static final Pattern ENTRY = Pattern.compile(
            "\\{\\s*URL:\\s*\"([^\"]+)\"\\s*,\\s*caption:\\s*\"([^\"]+)\"\\s*\\}");

    private final String baseUrl;

    public LightboxGalleryParser(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public boolean appliesTo(String script) {
        return script != null && script.contains(MARKER);
    }

    /**
     * @return images in script order, empty when the script holds no gallery
     */
    public List<ArticleImage> parse(String script) {
        if (!appliesTo(script)) return List.of();

        Matcher array = ARRAY.matcher(script);
        if (!array.find()) return List.of();

        List<ArticleImage> images = new ArrayList<>();
        Matcher entry = ENTRY.matcher(array.group(1));
        while (entry.find()) {
            images.add(new ArticleImage(absolute(entry.group(1)), Parser.unescapeEntities(entry.group(2), false)));
        }
        return images;
    }

    private String absolute(String url) {
        return url.startsWith("http://") || url.startsWith("https://") ? url : baseUrl + url;
    }
}
