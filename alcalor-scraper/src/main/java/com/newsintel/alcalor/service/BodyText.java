package com.newsintel.alcalor.service;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Plain-text rendering of an article body: one line per non-blank text node, so a
 * {@code <br>} only separates lines and never leaves a blank one.
 */
public final class BodyText {

    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\n\\s*\n+");

    private BodyText() {
    }

    public static String extract(Element container) {
        List<String> lines = new ArrayList<>();
        NodeTraversor.traverse((NodeVisitor) (node, depth) -> {
            if (node instanceof TextNode text) {
                String line = text.text().trim();
                if (!line.isEmpty()) {
                    lines.add(line);
                }
            }
        }, container);
        // text nodes are already decoded once; entities double-escaped in the source survive that
        return collapseBlankLines(Parser.unescapeEntities(String.join("\n", lines), false));
    }

    /**
     * Collapses every run of blank lines to exactly one. Idempotent.
     */
    public static String collapseBlankLines(String text) {
        if (text == null) return null;
        return BLANK_LINE_RUN.matcher(text).replaceAll("\n\n").strip();
    }
}
