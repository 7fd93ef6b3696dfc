package com.ledgerlift.migrator.integration.models.authorization;

import com.ledgerlift.migrator.integration.contract.authorization.IDomainSeparator;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class DomainSeparator implements IDomainSeparator {

    private final String name;
    private final String version;
    private final long chainId;
    private final IParticipantAddress verifyingContract;
}
