package com.newsintel.alcalor.model;

/**
 * Gallery image attached to an article. Caption is empty when the page has none.
 */
public record ArticleImage(String url, String caption) {

    public ArticleImage {
        caption = caption == null ? "" : caption;
    }
}
