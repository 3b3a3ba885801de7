package com.fightsync.infrastructure.cli;

import com.fightsync.application.usecase.GetReconcilerStatusUseCase;
import com.fightsync.application.usecase.ReconcileCatalogUseCase;
import com.fightsync.application.usecase.ReconciliationSummary;
import com.fightsync.domain.model.CatalogChange;
import com.fightsync.domain.model.ScrapeRunRecord;
import com.fightsync.infrastructure.config.ReconcilerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * check     run one reconciliation pass (default)
 * status    print the strike ledger and the latest run, read-only
 * schedule  print when the configured cron expression fires next
 * </pre>
 */
@Component
public class ReconcilerCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ReconcilerCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final ReconcileCatalogUseCase reconcileCatalogUseCase;
    private final GetReconcilerStatusUseCase getReconcilerStatusUseCase;
    private final ReconcilerProperties properties;
    private final Clock clock;

    private int exitCode = EXIT_OK;

    public ReconcilerCommandRunner(
            ReconcileCatalogUseCase reconcileCatalogUseCase,
            GetReconcilerStatusUseCase getReconcilerStatusUseCase,
            ReconcilerProperties properties,
            Clock clock) {
        this.reconcileCatalogUseCase = reconcileCatalogUseCase;
        this.getReconcilerStatusUseCase = getReconcilerStatusUseCase;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        String command = commands.isEmpty() ? "check" : commands.get(0);
        exitCode = dispatch(command);
    }

    int dispatch(String command) {
        try {
            switch (command) {
                case "check":
                    return check();
                case "status":
                    return status();
                case "schedule":
                    return schedule();
                default:
                    logger.error("Unknown command '{}'. Usage: [check|status|schedule]", command);
                    return EXIT_USAGE;
            }
        } catch (Exception e) {
            logger.error("Command '{}' failed", command, e);
            return EXIT_FAILURE;
        }
    }

    private int check() throws Exception {
        ReconciliationSummary summary = reconcileCatalogUseCase.execute();

        logger.info("Scraper check complete: status={}, phase={}", summary.status(), summary.finalPhase());
        logger.info("   Events processed: {}", summary.eventsProcessed());
        logger.info("   Fights processed: {}", summary.fightsProcessed());
        logger.info("   Events by source: {}", summary.eventsBySource());
        logger.info("   Changes detected: {}", summary.changes().size());
        for (CatalogChange change : summary.changes()) {
            logger.info("   - {} {} ({})", change.type(), change.eventName(), change.detail());
        }
        logger.info("   Warnings: {}", summary.warnings().size());
        logger.info("   Errors: {}", summary.errors().size());
        for (String error : summary.errors()) {
            logger.info("   - {}", error);
        }
        logger.info("   Execution time: {}ms", summary.executionTimeMs());
        return EXIT_OK;
    }

    private int status() throws Exception {
        GetReconcilerStatusUseCase.Status status = getReconcilerStatusUseCase.execute();

        logger.info("Missing events ({}):", status.missingEvents().size());
        status.missingEvents().forEach((eventId, entry) ->
            logger.info("   {} missed {} time(s), last {}", eventId, entry.count(), entry.lastSeen()));

        logger.info("Missing fights ({} events):", status.missingFights().size());
        status.missingFights().forEach((eventId, fights) ->
            fights.forEach((key, entry) ->
                logger.info("   {} / {} missed {} time(s), last {}", eventId, key, entry.count(), entry.lastSeen())));

        if (status.latestRun().isPresent()) {
            ScrapeRunRecord run = status.latestRun().get();
            logger.info("Latest run {}: {} started {} ended {} (found {}, added {}, cancelled {})",
                run.getId(), run.getStatus(), run.getStartTime(), run.getEndTime(),
                run.getEventsFound(), run.getEventsAdded(), run.getEventsCancelled());
            if (run.getErrorMessage() != null) {
                logger.info("   Error: {}", run.getErrorMessage());
            }
        } else {
            logger.info("No runs recorded yet");
        }
        return EXIT_OK;
    }

    private int schedule() {
        CronExpression cron = CronExpression.parse(properties.getScheduleCron());
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(ZoneId.of(properties.getZone()));
        ZonedDateTime next = cron.next(now);
        logger.info("Schedule '{}' ({}): next run at {}", properties.getScheduleCron(), properties.getZone(), next);
        return EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
