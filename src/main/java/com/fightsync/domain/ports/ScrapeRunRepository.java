package com.fightsync.domain.ports;

import com.fightsync.domain.model.ScrapeRunRecord;

import java.util.Optional;

/**
 * Port for the append-only run audit trail.
 */
public interface ScrapeRunRepository {

    /**
     * Inserts the record of a run that is starting.
     */
    void start(ScrapeRunRecord record);

    /**
     * Stores the final state of a run. Called once per run.
     */
    void finish(ScrapeRunRecord record);

    Optional<ScrapeRunRecord> findLatest();
}
