package com.ledgerlift.migrator.core.exception;

import com.ledgerlift.migrator.core.exception.codes.LedgerLiftErrorCodes;
import com.ledgerlift.migrator.integration.contract.ILedgerLiftErrorInfo;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationOutcome;
import com.ledgerlift.migrator.integration.enumerations.AuthorizationRejectionReason;
import com.ledgerlift.migrator.integration.exception.LedgerLiftRuntimeException;
import lombok.Getter;

import java.util.Map;

/**
 * Fatal to one privileged call, never to a migration run.
 */
@Getter
public class AuthorizationException extends LedgerLiftRuntimeException {

    private final AuthorizationRejectionReason reason;
    private final transient IAuthorizationOutcome outcome;

    public AuthorizationException(AuthorizationRejectionReason reason, Map<String, String> templateVariables,
                                  IAuthorizationOutcome outcome) {
        super(errorInfoFor(reason), templateVariables);
        this.reason = reason;
        this.outcome = outcome;
    }

    public static ILedgerLiftErrorInfo errorInfoFor(AuthorizationRejectionReason reason) {
        return switch (reason) {
            case EXPIRED_AUTHORIZATION -> LedgerLiftErrorCodes.EXPIRED_AUTHORIZATION;
            case STALE_NONCE -> LedgerLiftErrorCodes.STALE_NONCE;
            case SIGNATURE_MISMATCH -> LedgerLiftErrorCodes.SIGNATURE_MISMATCH;
            case SUBMISSION_FAILED -> LedgerLiftErrorCodes.PRIVILEGED_CALL_FAILED;
        };
    }
}
