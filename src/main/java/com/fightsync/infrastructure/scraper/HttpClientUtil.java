package com.fightsync.infrastructure.scraper;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Utility for making HTTP requests to source endpoints.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;
    private static final Timeout TIMEOUT = Timeout.ofSeconds(30);

    private static final List<String> USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15",
        "Mozilla/5.0 (X11; Linux x86_64; rv:125.0) Gecko/20100101 Firefox/125.0",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:125.0) Gecko/20100101 Firefox/125.0"
    );

    // Markers of anti-bot interstitials served in place of the API response
    private static final List<String> CHALLENGE_MARKERS = List.of(
        "cf-challenge", "cf_chl_", "challenge-platform", "just a moment...",
        "attention required", "captcha", "access denied");

    private HttpClientUtil() {
    }

    /**
     * The server refused the request (403 or 429) or served a challenge page. Never retried.
     */
    public static class BlockedResponseException extends IOException {

        private final int statusCode;

        public BlockedResponseException(int statusCode, String message) {
            super(message);
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    static String randomUserAgent() {
        return USER_AGENTS.get(ThreadLocalRandom.current().nextInt(USER_AGENTS.size()));
    }

    static boolean isBlockingStatus(int statusCode) {
        return statusCode == 403 || statusCode == 429;
    }

    /**
     * An HTML body carrying a known anti-bot marker, whatever the status code.
     */
    static boolean isChallengePage(String contentType, String body) {
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("text/html") || body == null) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return CHALLENGE_MARKERS.stream().anyMatch(lower::contains);
    }

    /**
     * Adds up to half of the delay again at random so retries from several
     * instances do not line up.
     */
    static long withJitter(long delay) {
        if (delay <= 0) {
            return 0;
        }
        return delay + ThreadLocalRandom.current().nextLong(delay / 2 + 1);
    }

    /**
     * Makes a GET request expecting a JSON body, retrying transient failures
     * with jittered exponential backoff. Blocking responses are not retried.
     *
     * @param maxAttempts total attempts, at least 1
     * @param backoffMs base delay before the second attempt; doubled for each one after
     */
    public static String getJson(String url, Map<String, String> headers, int maxAttempts, long backoffMs) throws IOException {
        IOException last = null;
        long delay = backoffMs;
        for (int attempt = 1; attempt <= Math.max(1, maxAttempts); attempt++) {
            try {
                return getJson(url, headers);
            } catch (BlockedResponseException e) {
                throw e;
            } catch (IOException e) {
                last = e;
                if (attempt < maxAttempts) {
                    long wait = withJitter(delay);
                    logger.warn("Request to {} failed (attempt {}/{}): {}. Retrying in {}ms",
                        url, attempt, maxAttempts, e.getMessage(), wait);
                    sleep(wait);
                    delay *= 2;
                }
            }
        }
        throw last;
    }

    /**
     * Makes a single GET request and returns the JSON body as a string.
     */
    public static String getJson(String url, Map<String, String> headers) throws IOException {
        RequestConfig config = RequestConfig.custom()
            .setConnectionRequestTimeout(TIMEOUT)
            .setResponseTimeout(TIMEOUT)
            .build();

        try (CloseableHttpClient httpClient = HttpClients.custom().setDefaultRequestConfig(config).build()) {
            HttpGet request = new HttpGet(url);
            request.addHeader("accept", "application/json, text/plain, */*");
            request.addHeader("user-agent", randomUserAgent());

            // Configured headers override the defaults
            if (headers != null) {
                headers.forEach(request::setHeader);
            }

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                String responseBody;
                String contentType = null;

                HttpEntity entity = response.getEntity();
                if (entity != null && entity.getContentType() != null) {
                    contentType = entity.getContentType();
                }

                try {
                    responseBody = entity != null ? EntityUtils.toString(entity) : "";
                } catch (ParseException e) {
                    throw new IOException("Failed to parse response", e);
                }

                if (isBlockingStatus(statusCode)) {
                    logger.warn("Request to {} refused with status {}", url, statusCode);
                    throw new BlockedResponseException(statusCode, "Access refused with HTTP " + statusCode);
                }

                if (isChallengePage(contentType, responseBody)) {
                    logger.warn("Request to {} answered with a challenge page (status {})", url, statusCode);
                    logResponseBodyPreview(responseBody);
                    throw new BlockedResponseException(statusCode, "Challenge page served with HTTP " + statusCode);
                }

                if (statusCode >= 200 && statusCode < 300) {
                    // A missing content-type is still parsed as JSON
                    if (contentType != null && !contentType.isEmpty()
                        && !contentType.toLowerCase(Locale.ROOT).startsWith("application/json")) {
                        logger.error("Expected JSON but received content-type: {}. URL: {}", contentType, url);
                        logResponseBodyPreview(responseBody);
                        throw new IOException("Expected JSON response but received: " + contentType);
                    }
                    return responseBody;
                }

                logger.error("HTTP request failed with status {}: {}", statusCode, url);
                logResponseBodyPreview(responseBody);
                throw new IOException("HTTP request failed with status " + statusCode);
            }
        }
    }

    private static void sleep(long millis) throws IOException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting to retry", e);
        }
    }
}
