package com.ledgerlift.migrator.core.engine.authorization;

import com.ledgerlift.migrator.core.engine.config.MigrationConfig;
import com.ledgerlift.migrator.core.exception.AuthorizationException;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationMessage;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationOutcome;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationSigner;
import com.ledgerlift.migrator.integration.contract.authorization.IPrivilegedCallCoordinator;
import com.ledgerlift.migrator.integration.contract.authorization.IPrivilegedCallReceipt;
import com.ledgerlift.migrator.integration.contract.authorization.IPrivilegedCallRequest;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.contract.service.IMigrationServiceClient;
import com.ledgerlift.migrator.integration.enumerations.AuthorizationRejectionReason;
import com.ledgerlift.migrator.integration.enumerations.AuthorizationState;
import com.ledgerlift.migrator.integration.models.authorization.AuthorizationOutcome;
import com.ledgerlift.migrator.integration.models.authorization.PrivilegedCallRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs privileged calls through the co-signing protocol.
 *
 * <p>State machine per attempt:</p>
 * <pre>
 * CREATED --sign--> SIGNED --submit--> SUBMITTED --verify--> ACCEPTED | REJECTED
 * </pre>
 *
 * <p>Every attempt reads the caller's nonce from the service and signs a new message;
 * nothing is cached between attempts. Failures before verification end in
 * {@code REJECTED(SUBMISSION_FAILED)}.</p>
 */
@Slf4j
public class PrivilegedCallCoordinator implements IPrivilegedCallCoordinator {

    private final IAuthorizationSigner signer;
    private final IMigrationServiceClient service;
    private final Duration callTimeout;
    private final Duration authorizationTtl;
    private final Clock clock;

    public PrivilegedCallCoordinator(IAuthorizationSigner signer, IMigrationServiceClient service,
                                     MigrationConfig config, Clock clock) {
        config.validate();
        this.signer = signer;
        this.service = service;
        this.callTimeout = config.getCallTimeout();
        this.authorizationTtl = config.getAuthorizationTtl();
        this.clock = clock;
    }

    public PrivilegedCallCoordinator(IAuthorizationSigner signer, IMigrationServiceClient service, MigrationConfig config) {
        this(signer, service, config, Clock.systemUTC());
    }

    @Override
    public Mono<IAuthorizationOutcome> execute(IParticipantAddress caller, String operationSignature, List<Object> arguments) {
        return Mono.defer(() -> attempt(caller, operationSignature, arguments));
    }

    @Override
    public Mono<IAuthorizationOutcome> submit(IPrivilegedCallRequest request) {
        return Mono.defer(() -> {
            List<AuthorizationState> history = new ArrayList<>();
            history.add(AuthorizationState.SIGNED);
            return submit(request, history);
        });
    }

    @Override
    public Mono<IAuthorizationOutcome> executeOrThrow(IParticipantAddress caller, String operationSignature,
                                                      List<Object> arguments) {
        return execute(caller, operationSignature, arguments)
                .flatMap(outcome -> {
                    if (outcome.isAccepted()) {
                        return Mono.just(outcome);
                    }
                    AuthorizationRejectionReason reason = outcome.getReason()
                            .orElse(AuthorizationRejectionReason.SUBMISSION_FAILED);
                    return Mono.error(new AuthorizationException(reason, templateVariables(caller, operationSignature, outcome), outcome));
                });
    }

    // One attempt; history belongs to this subscription only
    private Mono<IAuthorizationOutcome> attempt(IParticipantAddress caller, String operationSignature, List<Object> arguments) {
        List<AuthorizationState> history = new ArrayList<>();
        history.add(AuthorizationState.CREATED);

        return service.getNonce(caller)
                .timeout(callTimeout)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Service returned no nonce")))
                .map(nonce -> signer.createMessage(caller, operationSignature, nonce, deadline()))
                .flatMap(message -> signer.sign(message)
                        .timeout(callTimeout)
                        .map(signature -> {
                            history.add(AuthorizationState.SIGNED);
                            log.debug("Signed privileged call [{}] for caller [{}] with nonce [{}]",
                                    operationSignature, caller.toHex(), message.getNonce());
                            return (IPrivilegedCallRequest) PrivilegedCallRequest.builder()
                                    .message(message)
                                    .signature(signature)
                                    .operationSignature(operationSignature)
                                    .arguments(arguments == null ? List.of() : List.copyOf(arguments))
                                    .build();
                        }))
                .flatMap(request -> submit(request, history))
                .onErrorResume(error -> {
                    log.warn("Privileged call [{}] for caller [{}] failed before submission: {}",
                            operationSignature, caller.toHex(), ExceptionUtils.getRootCauseMessage(error));
                    return Mono.just(rejected(history, AuthorizationRejectionReason.SUBMISSION_FAILED, null, null,
                            ExceptionUtils.getRootCauseMessage(error)));
                });
    }

    private Mono<IAuthorizationOutcome> submit(IPrivilegedCallRequest request, List<AuthorizationState> history) {
        IAuthorizationMessage message = request.getMessage();
        history.add(AuthorizationState.SUBMITTED);
        return service.submitPrivileged(request)
                .timeout(callTimeout)
                .map(receipt -> toOutcome(request, receipt, history))
                .onErrorResume(error -> {
                    log.warn("Privileged call [{}] for caller [{}] could not be submitted: {}",
                            request.getOperationSignature(), message.getCaller().toHex(),
                            ExceptionUtils.getRootCauseMessage(error));
                    return Mono.just(rejected(history, AuthorizationRejectionReason.SUBMISSION_FAILED, request, null,
                            ExceptionUtils.getRootCauseMessage(error)));
                });
    }

    private IAuthorizationOutcome toOutcome(IPrivilegedCallRequest request, IPrivilegedCallReceipt receipt,
                                            List<AuthorizationState> history) {
        if (receipt.isAccepted()) {
            history.add(AuthorizationState.ACCEPTED);
            log.info("Privileged call [{}] for caller [{}] accepted in tx [{}]",
                    request.getOperationSignature(), request.getMessage().getCaller().toHex(),
                    receipt.getTxReference().orElse("-"));
            return AuthorizationOutcome.builder()
                    .state(AuthorizationState.ACCEPTED)
                    .message(request.getMessage())
                    .signature(request.getSignature())
                    .txReference(receipt.getTxReference().orElse(null))
                    .stateHistory(List.copyOf(history))
                    .build();
        }
        AuthorizationRejectionReason reason = receipt.getRejectionReason()
                .orElse(AuthorizationRejectionReason.SUBMISSION_FAILED);
        log.warn("Privileged call [{}] for caller [{}] rejected with [{}]",
                request.getOperationSignature(), request.getMessage().getCaller().toHex(), reason);
        return rejected(history, reason, request, receipt.getTxReference().orElse(null), receipt.getDetail().orElse(null));
    }

    private static IAuthorizationOutcome rejected(List<AuthorizationState> history, AuthorizationRejectionReason reason,
                                                  IPrivilegedCallRequest request, String txReference, String detail) {
        history.add(AuthorizationState.REJECTED);
        return AuthorizationOutcome.builder()
                .state(AuthorizationState.REJECTED)
                .reason(reason)
                .message(request == null ? null : request.getMessage())
                .signature(request == null ? null : request.getSignature())
                .txReference(txReference)
                .detail(detail)
                .stateHistory(List.copyOf(history))
                .build();
    }

    private long deadline() {
        return clock.instant().plus(authorizationTtl).getEpochSecond();
    }

    private static Map<String, String> templateVariables(IParticipantAddress caller, String operationSignature,
                                                         IAuthorizationOutcome outcome) {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("caller", caller.toHex());
        variables.put("operation", operationSignature);
        variables.put("reason", outcome.getDetail().orElse("rejected"));
        outcome.getMessage().ifPresent(message -> {
            variables.put("nonce", message.getNonce().toString());
            variables.put("deadline", String.valueOf(message.getDeadline()));
        });
        return variables;
    }
}
