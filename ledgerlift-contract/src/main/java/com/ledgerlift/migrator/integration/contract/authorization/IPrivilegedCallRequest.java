package com.ledgerlift.migrator.integration.contract.authorization;

import java.util.List;

/**
 * A privileged call as submitted to the service: the caller's own arguments plus the
 * authority's co-signature over the authorization message.
 */
public interface IPrivilegedCallRequest {

    IAuthorizationMessage getMessage();

    IAuthorizationSignature getSignature();

    /**
     * Canonical function signature, for example {@code deposit(uint256,uint256,uint256,bytes)}.
     *
     * @return operation signature
     */
    String getOperationSignature();

    List<Object> getArguments();
}
