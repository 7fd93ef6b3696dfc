package com.ledgerlift.migrator.integration.contract.authorization;

import com.ledgerlift.migrator.integration.enumerations.AuthorizationRejectionReason;
import com.ledgerlift.migrator.integration.enumerations.AuthorizationState;

import java.util.List;
import java.util.Optional;

/**
 * Terminal result of one privileged-call attempt.
 */
public interface IAuthorizationOutcome {

    /**
     * Final state, {@link AuthorizationState#ACCEPTED} or {@link AuthorizationState#REJECTED}.
     *
     * @return final state
     */
    AuthorizationState getState();

    Optional<AuthorizationRejectionReason> getReason();

    /**
     * Message that was signed, empty when the attempt failed before signing.
     *
     * @return signed message
     */
    Optional<IAuthorizationMessage> getMessage();

    Optional<IAuthorizationSignature> getSignature();

    Optional<String> getTxReference();

    Optional<String> getDetail();

    /**
     * States visited by this attempt, in order.
     *
     * @return state history
     */
    List<AuthorizationState> getStateHistory();

    default boolean isAccepted() {
        return getState() == AuthorizationState.ACCEPTED;
    }
}
