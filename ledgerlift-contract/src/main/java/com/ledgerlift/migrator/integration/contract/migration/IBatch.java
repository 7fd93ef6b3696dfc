package com.ledgerlift.migrator.integration.contract.migration;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;

import java.util.List;

/**
 * An ordered slice of the participant set, submitted as one bulk migration call.
 */
public interface IBatch {

    /**
     * Zero-based sequence index within the run.
     *
     * @return batch index
     */
    int getIndex();

    List<IParticipantAddress> getParticipants();

    default int size() {
        return getParticipants().size();
    }
}
