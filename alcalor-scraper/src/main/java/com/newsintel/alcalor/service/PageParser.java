package com.newsintel.alcalor.service;

import com.newsintel.alcalor.model.Article;
import com.newsintel.alcalor.model.ArticleRef;

import java.time.LocalDate;
import java.util.List;

/**
 * Turns raw page text into structured results. Implementations never fail on
 * missing markup: an absent container yields an empty listing, an absent field
 * yields a null on the article.
 */
public interface PageParser {

    /**
     * @return article links in order of appearance; empty when the day has none
     */
    List<ArticleRef> parseListing(String html, LocalDate forDate);

    /**
     * @return the article; only {@code url} is guaranteed to be set
     */
    Article parseDetail(String html, String sourceUrl);
}
