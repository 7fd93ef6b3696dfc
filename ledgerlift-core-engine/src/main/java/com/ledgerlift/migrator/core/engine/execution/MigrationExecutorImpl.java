package com.ledgerlift.migrator.core.engine.execution;

import com.ledgerlift.migrator.core.engine.config.MigrationConfig;
import com.ledgerlift.migrator.core.exception.codes.LedgerLiftErrorCodes;
import com.ledgerlift.migrator.integration.contract.migration.IBatch;
import com.ledgerlift.migrator.integration.contract.migration.IBulkMigrationReceipt;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationExecutor;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationOutcome;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationVerifier;
import com.ledgerlift.migrator.integration.contract.migration.IRunControl;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantSnapshot;
import com.ledgerlift.migrator.integration.contract.service.IMigrationServiceClient;
import com.ledgerlift.migrator.integration.enumerations.BatchOutcomeStatus;
import com.ledgerlift.migrator.integration.exception.LedgerLiftRuntimeException;
import com.ledgerlift.migrator.integration.models.migration.MigrationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Submits batches one at a time and turns every receipt or failure into an outcome.
 *
 * <p>Per batch: snapshot a sample of participants, call the bulk migration, read the
 * completion event if there is one, then verify the sample. A failure of one batch is
 * recorded and the next batch runs.</p>
 */
@Slf4j
public class MigrationExecutorImpl implements IMigrationExecutor {

    public static final int REPAIR_BATCH_INDEX = -1;

    private final IMigrationServiceClient service;
    private final IMigrationVerifier verifier;
    private final int sampleSize;
    private final Duration callTimeout;

    public MigrationExecutorImpl(IMigrationServiceClient service, IMigrationVerifier verifier, MigrationConfig config) {
        config.validate();
        this.service = service;
        this.verifier = verifier;
        this.sampleSize = config.getSampleSize();
        this.callTimeout = config.getCallTimeout();
    }

    @Override
    public Flux<IMigrationOutcome> execute(List<IBatch> batches, IRunControl control) {
        return Flux.fromIterable(batches)
                .concatMap(batch -> Mono.defer(() -> {
                    if (control.isAborted()) {
                        log.info("Run aborted, skipping batch [{}]", batch.getIndex());
                        return Mono.empty();
                    }
                    return executeBatch(batch);
                }), 1);
    }

    @Override
    public Mono<IMigrationOutcome> executeBatch(IBatch batch) {
        List<IParticipantAddress> sample = batch.getParticipants().subList(0, Math.min(sampleSize, batch.size()));
        log.info("Migrating batch [{}] with [{}] participants", batch.getIndex(), batch.size());

        return snapshot(sample)
                .flatMap(preSnapshots -> submit(batch)
                        .flatMap(outcome -> verify(outcome, sample, preSnapshots)))
                .doOnNext(outcome -> log.info("Batch [{}] finished with [{}]: [{}] migrated, [{}] failed",
                        outcome.getBatchIndex(), outcome.getStatus(), outcome.getSuccessCount(), outcome.getFailureCount()));
    }

    @Override
    public Mono<IMigrationOutcome> repair(List<IParticipantAddress> participants) {
        return Mono.defer(() -> repairSequentially(participants));
    }

    private Mono<IMigrationOutcome> repairSequentially(List<IParticipantAddress> participants) {
        log.info("Repairing [{}] participants one at a time", participants.size());
        List<String> failed = new ArrayList<>();
        return Flux.fromIterable(participants)
                .concatMap(participant -> service.migrateParticipant(participant)
                        .timeout(callTimeout)
                        .map(receipt -> {
                            if (receipt.isReverted()) {
                                failed.add(participant.toHex() + " (" + receipt.getRevertReason().orElse("reverted") + ")");
                                return false;
                            }
                            return true;
                        })
                        .defaultIfEmpty(false)
                        .onErrorResume(error -> {
                            log.warn("Repair of [{}] failed: {}", participant.toHex(), ExceptionUtils.getRootCauseMessage(error));
                            failed.add(participant.toHex() + " (" + ExceptionUtils.getRootCauseMessage(error) + ")");
                            return Mono.just(false);
                        }))
                .filter(Boolean::booleanValue)
                .count()
                .map(successes -> {
                    int total = participants.size();
                    int migrated = successes.intValue();
                    IMigrationOutcome outcome = MigrationOutcome.builder()
                            .batchIndex(REPAIR_BATCH_INDEX)
                            .totalUsers(total)
                            .successCount(migrated)
                            .failureCount(total - migrated)
                            .status(migrated == 0 && total > 0 ? BatchOutcomeStatus.SUBMISSION_FAILED : BatchOutcomeStatus.CONFIRMED_INFERRED)
                            .failureReason(failed.isEmpty() ? null : String.join("; ", failed))
                            .build();
                    log.info("Repair finished: [{}] of [{}] participants migrated", migrated, total);
                    return outcome;
                });
    }

    private Mono<Map<IParticipantAddress, IParticipantSnapshot>> snapshot(List<IParticipantAddress> sample) {
        return Flux.fromIterable(sample)
                .concatMap(participant -> service.getParticipantSnapshot(participant)
                        .timeout(callTimeout)
                        .map(snapshot -> Map.entry(participant, snapshot))
                        .onErrorResume(error -> {
                            log.warn("Pre-migration snapshot of [{}] failed, recording as absent: {}",
                                    participant.toHex(), ExceptionUtils.getRootCauseMessage(error));
                            return Mono.empty();
                        }))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private Mono<MigrationOutcome> submit(IBatch batch) {
        return service.bulkMigrate(batch.getParticipants())
                .timeout(callTimeout)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("no receipt returned")))
                .map(receipt -> toOutcome(batch, receipt))
                .onErrorResume(error -> Mono.just(failedOutcome(batch, error)));
    }

    private MigrationOutcome toOutcome(IBatch batch, IBulkMigrationReceipt receipt) {
        if (receipt.isReverted()) {
            String reason = receipt.getRevertReason().orElse("transaction reverted");
            log.warn(batchFailure(batch, reason));
            return MigrationOutcome.failed(batch.getIndex(), batch.size(), BatchOutcomeStatus.REVERTED,
                    receipt.getTxReference(), reason);
        }
        if (receipt.hasResultEvent()) {
            int reportedTotal = receipt.getReportedTotalUsers().orElseThrow();
            if (reportedTotal != batch.size()) {
                log.warn("Batch [{}] completion event reports [{}] users for a batch of [{}]",
                        batch.getIndex(), reportedTotal, batch.size());
            }
            return MigrationOutcome.confirmed(batch.getIndex(), batch.size(),
                    receipt.getReportedSuccessCount().orElseThrow(), receipt.getTxReference(),
                    BatchOutcomeStatus.CONFIRMED_WITH_EVENT);
        }
        log.info("Batch [{}] confirmed in tx [{}] without a completion event; counting all participants as migrated",
                batch.getIndex(), receipt.getTxReference());
        return MigrationOutcome.confirmed(batch.getIndex(), batch.size(), batch.size(), receipt.getTxReference(),
                BatchOutcomeStatus.CONFIRMED_INFERRED);
    }

    private MigrationOutcome failedOutcome(IBatch batch, Throwable error) {
        BatchOutcomeStatus status = error instanceof TimeoutException
                ? BatchOutcomeStatus.TIMED_OUT
                : BatchOutcomeStatus.SUBMISSION_FAILED;
        String reason = error instanceof TimeoutException
                ? "no confirmation within " + callTimeout
                : ExceptionUtils.getRootCauseMessage(error);
        log.warn(batchFailure(batch, reason));
        return MigrationOutcome.failed(batch.getIndex(), batch.size(), status, null, reason);
    }

    private static String batchFailure(IBatch batch, String reason) {
        return LedgerLiftRuntimeException.render(LedgerLiftErrorCodes.BATCH_SUBMISSION_FAILED, Map.of(
                "batchIndex", String.valueOf(batch.getIndex()),
                "batchSize", String.valueOf(batch.size()),
                "reason", reason));
    }

    private Mono<IMigrationOutcome> verify(MigrationOutcome outcome, List<IParticipantAddress> sample,
                                           Map<IParticipantAddress, IParticipantSnapshot> preSnapshots) {
        if (!outcome.getStatus().isConfirmed() || sample.isEmpty()) {
            return Mono.just((IMigrationOutcome) outcome);
        }
        return verifier.verify(sample, preSnapshots)
                .<IMigrationOutcome>map(outcome::withVerificationNotes)
                .onErrorResume(error -> {
                    log.warn("Verification of batch [{}] failed: {}", outcome.getBatchIndex(),
                            ExceptionUtils.getRootCauseMessage(error));
                    return Mono.just(outcome);
                });
    }
}
