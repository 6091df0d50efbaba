package com.newsintel.alcalor.service;

import com.newsintel.alcalor.config.ScraperProperties;
import com.newsintel.alcalor.model.RunOptions;
import com.newsintel.alcalor.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Opens an {@link ArticlePipeline} sized for one run.
 */
@Component
@RequiredArgsConstructor
public class ArticlePipelineFactory {

    private final PageFetcher fetcher;
    private final PageParser parser;
    private final OutputRouter outputRouter;
    private final ScraperProperties properties;
    private final Clock clock;

    public ArticlePipeline open(RunOptions options) {
        return new ArticlePipeline(fetcher, parser, outputRouter, properties, options, clock);
    }
}
