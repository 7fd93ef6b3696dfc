package com.ledgerlift.migrator.integration.contract.migration;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs discovery, planning, execution, verification and reporting in strict sequence.
 *
 * <p>A run always completes with a summary, including runs with failed batches,
 * failed discovery or an abort between batches. Only invalid configuration fails
 * the returned {@link Mono}.</p>
 */
public interface IMigrationOrchestrator {

    /**
     * Discovers participants from the ledger and migrates them.
     *
     * @param control abort handle
     * @return run summary
     */
    Mono<IRunSummary> run(IRunControl control);

    /**
     * Migrates an explicit participant list, skipping discovery.
     *
     * @param participants participants to migrate
     * @param control abort handle
     * @return run summary
     */
    Mono<IRunSummary> run(List<IParticipantAddress> participants, IRunControl control);

    /**
     * Re-migrates the given participants one at a time.
     *
     * @param participants participants to repair
     * @return repair outcome
     */
    Mono<IMigrationOutcome> repair(List<IParticipantAddress> participants);
}
