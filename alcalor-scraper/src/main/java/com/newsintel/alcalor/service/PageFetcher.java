package com.newsintel.alcalor.service;

import com.newsintel.alcalor.config.ScraperProperties;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thin GET client over the news site.
 *
 * Bodies are read as bytes and decoded with the configured site encoding. The site's
 * Content-Type charset does not always match what it serves, so it is ignored.
 *
 * Transport failures are retried with exponential backoff by the shared Resilience4j
 * retry; a 4xx/5xx answer fails immediately.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PageFetcher {

    private final RestTemplate siteRestTemplate;
    private final Retry siteFetchRetry;
    private final ScraperProperties properties;

    /**
     * @param url absolute page URL
     * @return decoded page text, empty when the server sent no body
     * @throws FetchException when the page could not be retrieved
     */
    public String fetch(String url) throws FetchException {
        log.debug("Fetching: {}", url);
        AtomicInteger attempts = new AtomicInteger();
        try {
            byte[] body = siteFetchRetry.executeCallable(() -> {
                attempts.incrementAndGet();
                return get(url);
            });
            return body == null ? "" : new String(body, properties.getSite().charset());

        } catch (RestClientResponseException e) {
            log.debug("HTTP {} for {}", e.getStatusCode().value(), url);
            throw FetchException.permanent(url, e.getStatusCode().value(), attempts.get(), e);

        } catch (ResourceAccessException e) {
            log.warn("Giving up on {} after {} attempt(s): {}", url, attempts.get(), e.getMessage());
            throw FetchException.transientFailure(url, attempts.get(), e);

        } catch (Exception e) {
            // executeCallable declares Exception; anything else here is a client-side fault
            throw FetchException.transientFailure(url, attempts.get(), e);
        }
    }

    /**
     * Sleep after a successful article fetch. The delay is divided by the worker count so
     * the aggregate request rate against the site stays roughly the same at any concurrency.
     */
    public void courtesyPause(int workers) {
        Duration delay = properties.getHttp().requestDelay().dividedBy(Math.max(1, workers));
        sleepMs(delay.toMillis());
    }

    public boolean isProxied() {
        return properties.getProxy().isEnabled();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private byte[] get(String url) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, properties.getSite().getUserAgent());
        ResponseEntity<byte[]> response = siteRestTemplate.exchange(
                URI.create(url), HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
        return response.getBody();
    }

    private void sleepMs(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
