package com.fightsync.application.usecase;

import com.fightsync.domain.model.ScrapeRunRecord;
import com.fightsync.domain.model.StrikeEntry;
import com.fightsync.domain.ports.ScrapeRunRepository;
import com.fightsync.domain.ports.StrikeLedgerStore;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the strike ledger and the latest run. Never writes.
 */
public class GetReconcilerStatusUseCase {

    public record Status(
        Map<String, StrikeEntry> missingEvents,
        Map<String, Map<String, StrikeEntry>> missingFights,
        Optional<ScrapeRunRecord> latestRun) {
    }

    private final StrikeLedgerStore ledgerStore;
    private final ScrapeRunRepository runRepository;

    public GetReconcilerStatusUseCase(StrikeLedgerStore ledgerStore, ScrapeRunRepository runRepository) {
        this.ledgerStore = ledgerStore;
        this.runRepository = runRepository;
    }

    public Status execute() throws IOException {
        ledgerStore.load();
        return new Status(ledgerStore.eventEntries(), ledgerStore.fightEntries(), runRepository.findLatest());
    }
}
