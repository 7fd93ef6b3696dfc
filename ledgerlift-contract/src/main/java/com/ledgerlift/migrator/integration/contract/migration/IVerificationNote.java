package com.ledgerlift.migrator.integration.contract.migration;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.enumerations.VerificationStatus;

import java.util.List;
import java.util.Optional;

/**
 * Result of comparing one sampled participant before and after migration.
 * Diagnostic only.
 */
public interface IVerificationNote {

    IParticipantAddress getParticipant();

    VerificationStatus getStatus();

    /**
     * Human-readable descriptions of each field that differs, empty unless inconsistent.
     *
     * @return differing fields
     */
    List<String> getDifferences();

    Optional<String> getDetail();
}
