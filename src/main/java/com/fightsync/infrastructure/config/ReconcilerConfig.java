package com.fightsync.infrastructure.config;

import com.fightsync.application.usecase.GetReconcilerStatusUseCase;
import com.fightsync.application.usecase.ReconcileCatalogUseCase;
import com.fightsync.application.usecase.ReconciliationSettings;
import com.fightsync.domain.matching.DefaultEventMatcher;
import com.fightsync.domain.matching.EventMatcher;
import com.fightsync.domain.ports.AuditSink;
import com.fightsync.domain.ports.CatalogStore;
import com.fightsync.domain.ports.ScrapeRunRepository;
import com.fightsync.domain.ports.SourceAdapter;
import com.fightsync.domain.ports.StrikeLedgerStore;
import com.fightsync.domain.validation.RecordValidator;
import com.fightsync.infrastructure.audit.LoggingAuditSink;
import com.fightsync.infrastructure.persistence.JsonFileStrikeLedgerStore;
import com.fightsync.infrastructure.scraper.HttpJsonSourceAdapter;
import com.fightsync.infrastructure.scraper.SourcePayloadParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the reconciliation use cases and their non-Mongo adapters.
 */
@Configuration
@EnableConfigurationProperties(ReconcilerProperties.class)
public class ReconcilerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ReconcilerConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public List<SourceAdapter> sourceAdapters(ReconcilerProperties properties) {
        SourcePayloadParser parser = new SourcePayloadParser(ZoneId.of(properties.getZone()));
        List<SourceAdapter> adapters = new ArrayList<>();
        for (ReconcilerProperties.Source source : properties.getSources()) {
            if (!source.isEnabled()) {
                logger.info("Source {} is disabled", source.getName());
                continue;
            }
            if (source.getName() == null || source.getUrl() == null || source.getUrl().isBlank()) {
                logger.warn("Ignoring source without name or url: {}", source.getName());
                continue;
            }
            adapters.add(new HttpJsonSourceAdapter(source.getName(), source.getUrl(), source.getHeaders(),
                parser, properties.getHttpMaxAttempts(), properties.getHttpBackoffMs()));
        }
        logger.info("Configured {} sources", adapters.size());
        return adapters;
    }

    @Bean
    public StrikeLedgerStore strikeLedgerStore(ReconcilerProperties properties) {
        return new JsonFileStrikeLedgerStore(Path.of(properties.getLedgerDirectory()));
    }

    @Bean
    public EventMatcher eventMatcher(ReconcilerProperties properties) {
        return new DefaultEventMatcher(properties.getPromotionPrefixes());
    }

    @Bean
    public RecordValidator recordValidator() {
        return new RecordValidator();
    }

    @Bean
    public AuditSink auditSink() {
        return new LoggingAuditSink();
    }

    @Bean
    public ReconcileCatalogUseCase reconcileCatalogUseCase(
            CatalogStore catalogStore,
            StrikeLedgerStore strikeLedgerStore,
            ScrapeRunRepository scrapeRunRepository,
            AuditSink auditSink,
            EventMatcher eventMatcher,
            RecordValidator recordValidator,
            ReconcilerProperties properties,
            Clock clock) {
        ReconciliationSettings settings = new ReconciliationSettings(
            properties.effectiveEventCancelThreshold(),
            properties.effectiveFightCancelThreshold(),
            properties.getFetchLimit(),
            ZoneId.of(properties.getZone()));
        logger.info("Cancel thresholds: events={}, fights={}",
            settings.eventCancelThreshold(), settings.fightCancelThreshold());

        return new ReconcileCatalogUseCase(sourceAdapters(properties), catalogStore, strikeLedgerStore, scrapeRunRepository,
            auditSink, eventMatcher, recordValidator, settings, clock);
    }

    @Bean
    public GetReconcilerStatusUseCase getReconcilerStatusUseCase(
            StrikeLedgerStore strikeLedgerStore, ScrapeRunRepository scrapeRunRepository) {
        return new GetReconcilerStatusUseCase(strikeLedgerStore, scrapeRunRepository);
    }
}
