package com.ledgerlift.migrator.integration.models.migration;

import com.ledgerlift.migrator.integration.contract.migration.IVerificationNote;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.enumerations.VerificationStatus;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Optional;

@Data
@Builder
public class VerificationNote implements IVerificationNote {

    private final IParticipantAddress participant;
    private final VerificationStatus status;
    @Builder.Default
    private final List<String> differences = List.of();
    private final String detail;

    @Override
    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    public static VerificationNote consistent(IParticipantAddress participant) {
        return VerificationNote.builder()
                .participant(participant)
                .status(VerificationStatus.CONSISTENT)
                .build();
    }

    public static VerificationNote inconsistent(IParticipantAddress participant, List<String> differences) {
        return VerificationNote.builder()
                .participant(participant)
                .status(VerificationStatus.INCONSISTENT)
                .differences(List.copyOf(differences))
                .build();
    }

    public static VerificationNote unavailable(IParticipantAddress participant, String detail) {
        return VerificationNote.builder()
                .participant(participant)
                .status(VerificationStatus.UNAVAILABLE)
                .detail(detail)
                .build();
    }
}
