package com.ledgerlift.migrator.core.engine.verification;

import com.ledgerlift.migrator.core.engine.config.MigrationConfig;
import com.ledgerlift.migrator.core.exception.codes.LedgerLiftErrorCodes;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationVerifier;
import com.ledgerlift.migrator.integration.contract.migration.IVerificationNote;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantSnapshot;
import com.ledgerlift.migrator.integration.contract.service.IMigrationServiceClient;
import com.ledgerlift.migrator.integration.exception.LedgerLiftRuntimeException;
import com.ledgerlift.migrator.integration.models.migration.VerificationNote;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares sampled participants before and after migration.
 *
 * <p>Stake count and premium flag must match exactly. Pending step rewards, pending
 * MET rewards and referral count may grow while the batch runs but must not shrink.</p>
 */
@Slf4j
public class MigrationVerifierImpl implements IMigrationVerifier {

    private final IMigrationServiceClient service;
    private final Duration callTimeout;

    public MigrationVerifierImpl(IMigrationServiceClient service, MigrationConfig config) {
        this.service = service;
        this.callTimeout = config.getCallTimeout();
    }

    @Override
    public Mono<List<IVerificationNote>> verify(List<IParticipantAddress> sampled,
                                                Map<IParticipantAddress, IParticipantSnapshot> preSnapshots) {
        return Flux.fromIterable(sampled)
                .concatMap(participant -> service.getParticipantSnapshot(participant)
                        .timeout(callTimeout)
                        .map(after -> compare(participant, preSnapshots.get(participant), after))
                        .switchIfEmpty(Mono.fromSupplier(() -> compare(participant, preSnapshots.get(participant), null)))
                        .onErrorResume(error -> {
                            log.warn("Post-migration query for [{}] failed: {}",
                                    participant.toHex(), ExceptionUtils.getRootCauseMessage(error));
                            return Mono.just(VerificationNote.unavailable(participant,
                                    "post-migration query failed: " + ExceptionUtils.getRootCauseMessage(error)));
                        }))
                .collectList();
    }

    @Override
    public IVerificationNote compare(IParticipantAddress participant, IParticipantSnapshot before, IParticipantSnapshot after) {
        if (before == null) {
            return VerificationNote.unavailable(participant, "no pre-migration snapshot");
        }
        if (after == null) {
            return VerificationNote.unavailable(participant, "no post-migration snapshot");
        }

        List<String> differences = new ArrayList<>();
        if (before.getStakeCount() != after.getStakeCount()) {
            differences.add("stakeCount " + before.getStakeCount() + " -> " + after.getStakeCount());
        }
        if (before.isPremium() != after.isPremium()) {
            differences.add("premium " + before.isPremium() + " -> " + after.isPremium());
        }
        if (after.getPendingStepsRewards().compareTo(before.getPendingStepsRewards()) < 0) {
            differences.add("pendingStepsRewards " + before.getPendingStepsRewards() + " -> " + after.getPendingStepsRewards());
        }
        if (after.getPendingMetsRewards().compareTo(before.getPendingMetsRewards()) < 0) {
            differences.add("pendingMetsRewards " + before.getPendingMetsRewards() + " -> " + after.getPendingMetsRewards());
        }
        if (after.getReferralCount() < before.getReferralCount()) {
            differences.add("referralCount " + before.getReferralCount() + " -> " + after.getReferralCount());
        }

        log.debug("Participant [{}] after migration: stakes [{}], premium [{}], pending steps [{}], pending METs [{}]",
                participant.toHex(), after.getStakeCount(), after.isPremium(),
                after.getPendingStepsRewards(), after.getPendingMetsRewards());

        if (differences.isEmpty()) {
            return VerificationNote.consistent(participant);
        }
        log.warn(LedgerLiftRuntimeException.render(LedgerLiftErrorCodes.VERIFICATION_INCONSISTENT, Map.of(
                "participant", participant.toHex(),
                "differences", String.join(", ", differences))));
        return VerificationNote.inconsistent(participant, differences);
    }
}
