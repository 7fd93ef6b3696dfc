package com.ledgerlift.migrator.integration.contract.participant;

import java.util.List;

/**
 * Participants discovered during one run, in discovery order, without duplicates.
 */
public interface IParticipantSet {

    boolean contains(IParticipantAddress participant);

    int size();

    boolean isEmpty();

    /**
     * Returns the participants in the order they were first discovered.
     *
     * @return immutable ordered view
     */
    List<IParticipantAddress> asList();
}
