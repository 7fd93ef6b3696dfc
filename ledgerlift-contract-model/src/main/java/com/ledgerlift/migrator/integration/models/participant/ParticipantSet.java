package com.ledgerlift.migrator.integration.models.participant;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantSet;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Insertion-ordered participant set. Not thread safe; owned by a single run.
 */
@ToString
@EqualsAndHashCode
public class ParticipantSet implements IParticipantSet {

    private final Set<ParticipantAddress> members = new LinkedHashSet<>();

    public static ParticipantSet empty() {
        return new ParticipantSet();
    }

    public static ParticipantSet of(Collection<? extends IParticipantAddress> participants) {
        ParticipantSet set = new ParticipantSet();
        set.addAll(participants);
        return set;
    }

    /**
     * Adds a participant.
     *
     * @return true when the participant was not yet present
     */
    public boolean add(IParticipantAddress participant) {
        return members.add(ParticipantAddress.from(participant));
    }

    public void addAll(Collection<? extends IParticipantAddress> participants) {
        participants.forEach(this::add);
    }

    public void addAll(IParticipantSet other) {
        addAll(other.asList());
    }

    @Override
    public boolean contains(IParticipantAddress participant) {
        return participant != null && members.contains(ParticipantAddress.from(participant));
    }

    @Override
    public int size() {
        return members.size();
    }

    @Override
    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public List<IParticipantAddress> asList() {
        return List.copyOf(members);
    }
}
