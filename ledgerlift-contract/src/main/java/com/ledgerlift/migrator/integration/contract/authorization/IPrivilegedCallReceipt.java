package com.ledgerlift.migrator.integration.contract.authorization;

import com.ledgerlift.migrator.integration.enumerations.AuthorizationRejectionReason;

import java.util.Optional;

/**
 * Service answer to a privileged call submission.
 */
public interface IPrivilegedCallReceipt {

    boolean isAccepted();

    Optional<AuthorizationRejectionReason> getRejectionReason();

    Optional<String> getTxReference();

    Optional<String> getDetail();
}
