package com.ledgerlift.migrator.integration.models.migration;

import com.ledgerlift.migrator.integration.contract.migration.IMigrationOutcome;
import com.ledgerlift.migrator.integration.contract.migration.IRunSummary;
import com.ledgerlift.migrator.integration.enumerations.DiscoveryStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class RunSummary implements IRunSummary {

    private final String runId;
    private final int totalUsers;
    private final int totalSuccesses;
    private final int totalFailures;
    private final int plannedBatches;
    private final int completedBatches;
    private final boolean aborted;
    private final DiscoveryStatus discoveryStatus;
    private final int discoveryQueryFailures;
    private final List<IMigrationOutcome> outcomes;
    private final Instant startedAt;
    private final Instant completedAt;

    @Builder
    public RunSummary(String runId,
                      int totalUsers,
                      int totalSuccesses,
                      int totalFailures,
                      int plannedBatches,
                      int completedBatches,
                      boolean aborted,
                      DiscoveryStatus discoveryStatus,
                      int discoveryQueryFailures,
                      List<IMigrationOutcome> outcomes,
                      Instant startedAt,
                      Instant completedAt) {
        if (totalSuccesses + totalFailures != totalUsers) {
            throw new IllegalArgumentException("totalSuccesses [" + totalSuccesses + "] + totalFailures ["
                    + totalFailures + "] must equal totalUsers [" + totalUsers + "]");
        }
        if (completedBatches > plannedBatches) {
            throw new IllegalArgumentException("completedBatches [" + completedBatches
                    + "] exceeds plannedBatches [" + plannedBatches + "]");
        }
        this.runId = runId;
        this.totalUsers = totalUsers;
        this.totalSuccesses = totalSuccesses;
        this.totalFailures = totalFailures;
        this.plannedBatches = plannedBatches;
        this.completedBatches = completedBatches;
        this.aborted = aborted;
        this.discoveryStatus = discoveryStatus;
        this.discoveryQueryFailures = discoveryQueryFailures;
        this.outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }
}
