package com.ledgerlift.migrator.integration.contract.migration;

import java.time.Instant;
import java.util.List;

/**
 * Folds batch outcomes into a run summary and renders it.
 */
public interface IMigrationReporter {

    IRunSummary summarize(String runId,
                          IDiscoveryResult discovery,
                          int plannedBatches,
                          List<IMigrationOutcome> outcomes,
                          boolean aborted,
                          Instant startedAt,
                          Instant completedAt);

    /**
     * Renders a deterministic, human-readable report.
     *
     * @param summary run summary
     * @return report text
     */
    String render(IRunSummary summary);
}
