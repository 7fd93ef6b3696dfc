package com.ledgerlift.migrator.integration.contract.service;

import com.ledgerlift.migrator.integration.contract.authorization.IPrivilegedCallReceipt;
import com.ledgerlift.migrator.integration.contract.authorization.IPrivilegedCallRequest;
import com.ledgerlift.migrator.integration.contract.migration.IBulkMigrationReceipt;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantSnapshot;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.List;

/**
 * Call surface of the new service version.
 *
 * <p>Each {@code Mono} completes once the underlying transaction is confirmed, or
 * signals an error when submission itself fails. Migration calls are idempotent per
 * participant on the service side.</p>
 */
public interface IMigrationServiceClient {

    Mono<IBulkMigrationReceipt> bulkMigrate(List<IParticipantAddress> participants);

    Mono<IBulkMigrationReceipt> migrateParticipant(IParticipantAddress participant);

    Mono<IParticipantSnapshot> getParticipantSnapshot(IParticipantAddress participant);

    /**
     * Current authorization nonce of {@code caller}; consumed by each accepted privileged call.
     *
     * @param caller participant
     * @return nonce
     */
    Mono<BigInteger> getNonce(IParticipantAddress caller);

    Mono<IPrivilegedCallReceipt> submitPrivileged(IPrivilegedCallRequest request);
}
