package com.newsintel.alcalor.model;

/**
 * Article link found on a listing page. {@code position} is the 1-based order of
 * appearance in the listing markup.
 */
public record ArticleRef(String url, int position) {
}
