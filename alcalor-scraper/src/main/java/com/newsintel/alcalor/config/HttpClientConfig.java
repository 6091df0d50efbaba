package com.newsintel.alcalor.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * HTTP plumbing for talking to the news site.
 *
 * One pooled client is shared by every fetch in the process, so a run with 20 workers
 * walking several years of archive never opens more than max-connections sockets.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    public static final String SITE_RETRY = "siteFetch";

    @Bean(destroyMethod = "close")
    public CloseableHttpClient siteHttpClient(ScraperProperties properties) {
        ScraperProperties.Http http = properties.getHttp();
        Timeout timeout = Timeout.ofSeconds(http.getRequestTimeoutSeconds());

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(http.getMaxConnections())
                .setMaxConnPerRoute(http.getMaxKeepAliveConnections())
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(timeout)
                        .setSocketTimeout(timeout)
                        .build())
                .build();

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(timeout)
                .setResponseTimeout(timeout)
                .setRedirectsEnabled(true)
                .build();

        TimeValue keepAlive = TimeValue.ofSeconds(http.getKeepAliveSeconds());
        HttpClientBuilder builder = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .setKeepAliveStrategy((response, context) -> keepAlive)
                .evictIdleConnections(keepAlive);

        ScraperProperties.Proxy proxy = properties.getProxy();
        if (proxy.isEnabled()) {
            URI uri = proxy.uri();
            HttpHost proxyHost = new HttpHost(uri.getScheme(), uri.getHost(), uri.getPort());
            builder.setProxy(proxyHost);

            if (proxy.hasCredentials()) {
                BasicCredentialsProvider credentials = new BasicCredentialsProvider();
                credentials.setCredentials(new AuthScope(proxyHost),
                        new UsernamePasswordCredentials(proxy.getUsername(), proxy.getPassword().toCharArray()));
                builder.setDefaultCredentialsProvider(credentials);
            }
            log.info("Using proxy: {}", proxy.maskedUrl());
        }

        return builder.build();
    }

    @Bean
    public RestTemplate siteRestTemplate(CloseableHttpClient siteHttpClient) {
        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(siteHttpClient));
    }

    @Bean
    public Retry siteFetchRetry(RetryRegistry retryRegistry, ScraperProperties properties) {
        Retry retry = retryRegistry.retry(SITE_RETRY, siteRetryConfig(properties.getHttp()));
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} (attempt {}): {}",
                event.getName(), event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    /**
     * Exponential backoff starting at retry-delay and capped at max-retry-delay.
     * Only transport failures (I/O, timeouts) are retried; HTTP status errors are final.
     */
    public static RetryConfig siteRetryConfig(ScraperProperties.Http http) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, http.getMaxRetries()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1L, http.getRetryDelaySeconds() * 1000L), 2.0,
                        Math.max(1L, http.getMaxRetryDelaySeconds() * 1000L)))
                .retryExceptions(ResourceAccessException.class)
                .build();
    }
}
