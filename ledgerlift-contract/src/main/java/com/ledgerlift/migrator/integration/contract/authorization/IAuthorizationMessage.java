package com.ledgerlift.migrator.integration.contract.authorization;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;

import java.math.BigInteger;

/**
 * The structured message co-signed by the authority for one privileged call:
 * {@code FunctionCall(address caller,bytes4 selector,uint256 nonce,uint256 deadline)}.
 */
public interface IAuthorizationMessage {

    IParticipantAddress getCaller();

    /**
     * Four-byte operation selector. Returns a copy.
     *
     * @return selector bytes
     */
    byte[] getOperationSelector();

    BigInteger getNonce();

    /**
     * Expiry as epoch seconds.
     *
     * @return deadline
     */
    long getDeadline();
}
