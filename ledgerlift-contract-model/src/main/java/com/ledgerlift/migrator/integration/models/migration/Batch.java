package com.ledgerlift.migrator.integration.models.migration;

import com.ledgerlift.migrator.integration.contract.migration.IBatch;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import lombok.Data;

import java.util.List;

@Data
public class Batch implements IBatch {

    private final int index;
    private final List<IParticipantAddress> participants;

    public Batch(int index, List<? extends IParticipantAddress> participants) {
        if (index < 0) {
            throw new IllegalArgumentException("Batch index must be >= 0, got [" + index + "]");
        }
        this.index = index;
        this.participants = List.copyOf(participants);
    }
}
