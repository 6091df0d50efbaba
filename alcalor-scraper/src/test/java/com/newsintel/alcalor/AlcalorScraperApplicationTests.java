package com.newsintel.alcalor;

import com.newsintel.alcalor.cli.ScrapeCommandRunner;
import com.newsintel.alcalor.service.PageParser;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Context smoke test. No database is needed: the pool connects lazily and the runner
 * exits on the missing command-line mode before touching the store.
 */
@SpringBootTest
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:postgresql://localhost:1/unused",
        "scraper.output.dir=target/test-output"
})
class AlcalorScraperApplicationTests {

    @Autowired
    private ScrapeCommandRunner runner;

    @Autowired
    private PageParser pageParser;

    @Autowired
    private Retry siteFetchRetry;

    @Test
    void contextLoads() {
        assertThat(pageParser).isNotNull();
        assertThat(siteFetchRetry.getRetryConfig().getMaxAttempts()).isEqualTo(3);
        assertThat(runner.getExitCode()).isEqualTo(2);
    }
}
