package com.ledgerlift.migrator.integration.models.authorization;

import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationMessage;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;
import java.util.HexFormat;

@Getter
@EqualsAndHashCode
public class AuthorizationMessage implements IAuthorizationMessage {

    public static final int SELECTOR_LENGTH = 4;

    private final IParticipantAddress caller;
    private final byte[] operationSelector;
    private final BigInteger nonce;
    private final long deadline;

    @Builder(toBuilder = true)
    public AuthorizationMessage(IParticipantAddress caller, byte[] operationSelector, BigInteger nonce, long deadline) {
        if (caller == null) {
            throw new IllegalArgumentException("Caller must not be null");
        }
        if (operationSelector == null || operationSelector.length != SELECTOR_LENGTH) {
            throw new IllegalArgumentException("Operation selector must be exactly " + SELECTOR_LENGTH + " bytes");
        }
        if (nonce == null || nonce.signum() < 0) {
            throw new IllegalArgumentException("Nonce must be a non-negative integer");
        }
        this.caller = caller;
        this.operationSelector = operationSelector.clone();
        this.nonce = nonce;
        this.deadline = deadline;
    }

    @Override
    public byte[] getOperationSelector() {
        return operationSelector.clone();
    }

    @Override
    public String toString() {
        return "AuthorizationMessage(caller=" + caller.toHex()
                + ", selector=0x" + HexFormat.of().formatHex(operationSelector)
                + ", nonce=" + nonce
                + ", deadline=" + deadline + ")";
    }
}
