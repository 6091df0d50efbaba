package com.newsintel.alcalor.service;

import com.newsintel.alcalor.config.HttpClientConfig;
import com.newsintel.alcalor.config.ScraperProperties;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class PageFetcherTest {

    private static final String URL = "https://www.alcalorpolitico.com/informacion/nota-123.html";

    private MockRestServiceServer server;
    private PageFetcher fetcher;
    private ScraperProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ScraperProperties();
        properties.getHttp().setMaxRetries(3);
        properties.getHttp().setRetryDelaySeconds(0);
        properties.getHttp().setMaxRetryDelaySeconds(0);
        properties.getHttp().setRequestDelaySeconds(0);

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        Retry retry = Retry.of("test", HttpClientConfig.siteRetryConfig(properties.getHttp()));
        fetcher = new PageFetcher(restTemplate, retry, properties);
    }

    @Test
    @DisplayName("body is decoded as ISO-8859-1 whatever the advertised charset")
    void decodesWithSiteEncoding() throws Exception {
        byte[] latin1 = "<p>Información de Córdoba</p>".getBytes(StandardCharsets.ISO_8859_1);
        server.expect(once(), requestTo(URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("User-Agent", properties.getSite().getUserAgent()))
                .andRespond(withSuccess(latin1, MediaType.parseMediaType("text/html; charset=UTF-8")));

        String html = fetcher.fetch(URL);

        assertThat(html).isEqualTo("<p>Información de Córdoba</p>");
        server.verify();
    }

    @Test
    void retriesTransportFailures() throws Exception {
        server.expect(times(2), requestTo(URL)).andRespond(withException(new SocketTimeoutException("timed out")));
        server.expect(once(), requestTo(URL)).andRespond(withSuccess("ok", MediaType.TEXT_HTML));

        assertThat(fetcher.fetch(URL)).isEqualTo("ok");
        server.verify();
    }

    @Test
    void givesUpAfterMaxAttempts() {
        server.expect(times(3), requestTo(URL)).andRespond(withException(new IOException("connection reset")));

        FetchException e = catchThrowableOfType(() -> fetcher.fetch(URL), FetchException.class);

        assertThat(e.getKind()).isEqualTo(FetchException.Kind.TRANSIENT);
        assertThat(e.getAttempts()).isEqualTo(3);
        assertThat(e.getStatusCode()).isNull();
        assertThat(e.getUrl()).isEqualTo(URL);
        server.verify();
    }

    @Test
    @DisplayName("an error status fails immediately without retrying")
    void statusErrorsAreNotRetried() {
        server.expect(once(), requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        FetchException e = catchThrowableOfType(() -> fetcher.fetch(URL), FetchException.class);

        assertThat(e.getKind()).isEqualTo(FetchException.Kind.PERMANENT);
        assertThat(e.getStatusCode()).isEqualTo(404);
        assertThat(e.getAttempts()).isEqualTo(1);
        server.verify();
    }

    @Test
    void emptyBodyIsEmptyString() throws Exception {
        server.expect(once(), requestTo(URL)).andRespond(withStatus(HttpStatus.OK));

        assertThat(fetcher.fetch(URL)).isEmpty();
    }

    @Test
    void reportsProxyUsage() {
        assertThat(fetcher.isProxied()).isFalse();
        properties.getProxy().setUrl("http://proxy.local:8080");
        assertThat(fetcher.isProxied()).isTrue();
    }
}
