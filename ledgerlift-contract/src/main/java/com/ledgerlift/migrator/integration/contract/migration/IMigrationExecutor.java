package com.ledgerlift.migrator.integration.contract.migration;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Submits batches to the service's bulk migration operation.
 *
 * <p>Batches run strictly one after another in index order. A batch whose submission or
 * confirmation fails is recorded as a full-batch failure and the next batch still runs.
 * The underlying operation is idempotent per participant, so re-running the whole
 * sequence after a partial failure is the supported recovery path.</p>
 */
public interface IMigrationExecutor {

    /**
     * Executes the batches sequentially, checking the control for abort between batches.
     *
     * @param batches batches in index order
     * @param control abort handle
     * @return one outcome per executed batch, in index order
     */
    Flux<IMigrationOutcome> execute(List<IBatch> batches, IRunControl control);

    /**
     * Executes a single batch: sample, submit, await confirmation, verify.
     *
     * @param batch batch to migrate
     * @return batch outcome, never an error signal
     */
    Mono<IMigrationOutcome> executeBatch(IBatch batch);

    /**
     * Migrates participants one at a time through the single-participant operation.
     * Operator-invoked repair path for participants flagged during verification.
     *
     * @param participants participants to repair
     * @return aggregated outcome reported under batch index {@code -1}
     */
    Mono<IMigrationOutcome> repair(List<IParticipantAddress> participants);
}
