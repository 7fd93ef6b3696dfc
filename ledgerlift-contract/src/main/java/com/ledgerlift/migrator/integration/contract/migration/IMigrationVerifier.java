package com.ledgerlift.migrator.integration.contract.migration;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantSnapshot;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Compares sampled participants before and after migration.
 *
 * <p>Diagnostic aid only. Inconsistencies are reported, never corrected, and never
 * roll a run back.</p>
 */
public interface IMigrationVerifier {

    /**
     * Re-queries each sampled participant and compares it against its pre-migration snapshot.
     *
     * @param sampled participants sampled before the batch ran
     * @param preSnapshots snapshots captured before migration; may lack entries
     * @return one note per sampled participant, in sample order
     */
    Mono<List<IVerificationNote>> verify(List<IParticipantAddress> sampled,
                                         Map<IParticipantAddress, IParticipantSnapshot> preSnapshots);

    /**
     * Compares two snapshots of the same participant.
     *
     * @param participant participant under verification
     * @param before pre-migration snapshot, or null when none was captured
     * @param after post-migration snapshot, or null when the re-query failed
     * @return verification note
     */
    IVerificationNote compare(IParticipantAddress participant, IParticipantSnapshot before, IParticipantSnapshot after);
}
