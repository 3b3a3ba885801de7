package com.fightsync.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fightsync.domain.model.AuditLevel;
import com.fightsync.domain.ports.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Audit sink that writes one JSON line per alert to the {@code AUDIT} logger.
 * logback-spring.xml routes that logger to its own file.
 */
public class LoggingAuditSink implements AuditSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingAuditSink.class);
    private static final Logger audit = LoggerFactory.getLogger("AUDIT");
    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void record(AuditLevel level, String message, Map<String, Object> context) {
        String details;
        try {
            details = OBJECT_MAPPER.writeValueAsString(context != null ? context : Map.of());
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize audit context for '{}': {}", message, e.getOriginalMessage());
            details = String.valueOf(context);
        }

        if (level == AuditLevel.ERROR) {
            audit.error("{} {}", message, details);
        } else if (level == AuditLevel.WARNING) {
            audit.warn("{} {}", message, details);
        } else {
            audit.info("{} {}", message, details);
        }
    }
}
