package com.ledgerlift.migrator.integration.contract.authorization;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Drives one privileged call through CREATED, SIGNED, SUBMITTED and a terminal state.
 *
 * <p>A fresh nonce is fetched from the service for every attempt; signatures are never
 * cached or reused.</p>
 */
public interface IPrivilegedCallCoordinator {

    /**
     * Runs the call and reports rejection as an outcome rather than an error signal.
     *
     * @param caller participant making the call
     * @param operationSignature canonical function signature
     * @param arguments call arguments, forwarded unchanged
     * @return terminal outcome
     */
    Mono<IAuthorizationOutcome> execute(IParticipantAddress caller, String operationSignature, List<Object> arguments);

    /**
     * Submits an already signed request. Used to resubmit a request, which the service
     * must reject once its nonce was consumed.
     *
     * @param request signed request
     * @return terminal outcome
     */
    Mono<IAuthorizationOutcome> submit(IPrivilegedCallRequest request);

    /**
     * Like {@link #execute}, but signals an authorization exception on rejection.
     *
     * @param caller participant making the call
     * @param operationSignature canonical function signature
     * @param arguments call arguments
     * @return accepted outcome
     */
    Mono<IAuthorizationOutcome> executeOrThrow(IParticipantAddress caller, String operationSignature, List<Object> arguments);
}
