package com.ledgerlift.migrator.integration.models.migration;

import com.ledgerlift.migrator.integration.contract.migration.IDiscoveryResult;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantSet;
import com.ledgerlift.migrator.integration.enumerations.DiscoveryStatus;
import com.ledgerlift.migrator.integration.models.participant.ParticipantSet;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Optional;

@Data
@Builder
public class DiscoveryResult implements IDiscoveryResult {

    @Builder.Default
    private final IParticipantSet participants = ParticipantSet.empty();
    private final DiscoveryStatus status;
    private final Long windowUsed;
    @Builder.Default
    private final List<QueryFailure> queryFailures = List.of();
    private final int skippedEvents;

    @Override
    public Optional<Long> getWindowUsed() {
        return Optional.ofNullable(windowUsed);
    }

    /**
     * Result for an explicit participant list supplied by the operator instead of a scan.
     */
    public static DiscoveryResult supplied(IParticipantSet participants) {
        return DiscoveryResult.builder()
                .participants(participants)
                .status(participants.isEmpty() ? DiscoveryStatus.NOTHING_FOUND : DiscoveryStatus.DISCOVERED)
                .build();
    }
}
