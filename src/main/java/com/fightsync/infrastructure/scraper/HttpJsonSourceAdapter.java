package com.fightsync.infrastructure.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fightsync.domain.exception.SourceBlockedException;
import com.fightsync.domain.exception.SourceException;
import com.fightsync.domain.model.SourcePayload;
import com.fightsync.domain.ports.SourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Source adapter for any endpoint that serves the normalized JSON payload
 * understood by {@link SourcePayloadParser}.
 */
public class HttpJsonSourceAdapter implements SourceAdapter {

    private static final Logger logger = LoggerFactory.getLogger(HttpJsonSourceAdapter.class);

    private final String sourceName;
    private final String url;
    private final Map<String, String> headers;
    private final SourcePayloadParser parser;
    private final int maxAttempts;
    private final long backoffMs;

    public HttpJsonSourceAdapter(String sourceName, String url, Map<String, String> headers,
                                 SourcePayloadParser parser, int maxAttempts, long backoffMs) {
        this.sourceName = sourceName;
        this.url = url;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.parser = parser;
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
    }

    @Override
    public String getSourceName() {
        return sourceName;
    }

    @Override
    public SourcePayload fetchUpcoming(int limit) throws SourceException {
        logger.info("Fetching upcoming events from {} ({})", sourceName, url);
        String body;
        try {
            body = fetch();
        } catch (HttpClientUtil.BlockedResponseException e) {
            throw new SourceBlockedException(sourceName, e.getStatusCode(), e.getMessage());
        } catch (IOException e) {
            throw new SourceException(sourceName, "Failed to fetch " + url + ": " + e.getMessage(), e);
        }

        try {
            SourcePayload payload = parser.parse(sourceName, body, limit);
            logger.info("Parsed {} events and {} fighters from {}", payload.events().size(), payload.fighters().size(), sourceName);
            return payload;
        } catch (JsonProcessingException e) {
            throw new SourceException(sourceName, "Malformed payload: " + e.getOriginalMessage(), e);
        }
    }

    String fetch() throws IOException {
        return HttpClientUtil.getJson(url, headers, maxAttempts, backoffMs);
    }
}
