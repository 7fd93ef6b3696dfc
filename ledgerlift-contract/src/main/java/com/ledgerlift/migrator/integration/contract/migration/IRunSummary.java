package com.ledgerlift.migrator.integration.contract.migration;

import com.ledgerlift.migrator.integration.enumerations.DiscoveryStatus;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate over all batch outcomes of one run.
 * {@code totalSuccesses + totalFailures == totalUsers} always holds.
 */
public interface IRunSummary {

    String getRunId();

    int getTotalUsers();

    int getTotalSuccesses();

    int getTotalFailures();

    /**
     * Number of batches the planner produced.
     *
     * @return planned batch count
     */
    int getPlannedBatches();

    /**
     * Number of batches that ran before completion or abort.
     *
     * @return completed batch count
     */
    int getCompletedBatches();

    boolean isAborted();

    DiscoveryStatus getDiscoveryStatus();

    int getDiscoveryQueryFailures();

    List<IMigrationOutcome> getOutcomes();

    Instant getStartedAt();

    Instant getCompletedAt();
}
