package com.ledgerlift.migrator.integration.contract.authorization;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;

/**
 * Typed-data domain binding a signature to one deployment of one service version.
 */
public interface IDomainSeparator {

    String getName();

    String getVersion();

    long getChainId();

    IParticipantAddress getVerifyingContract();
}
