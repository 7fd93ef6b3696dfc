package com.ledgerlift.migrator.core.engine.authorization;

import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationMessage;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationSignature;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationSigner;
import com.ledgerlift.migrator.integration.contract.authorization.IDomainSeparator;
import com.ledgerlift.migrator.integration.contract.authorization.ISigningAuthority;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.models.authorization.AuthorizationMessage;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * Binds a signing authority to one domain and produces typed-data signatures over
 * {@code FunctionCall} messages.
 */
@RequiredArgsConstructor
public class Eip712AuthorizationSigner implements IAuthorizationSigner {

    @Getter
    private final IDomainSeparator domain;
    @Getter
    private final ISigningAuthority authority;

    @Override
    public IAuthorizationMessage createMessage(IParticipantAddress caller, String operationSignature,
                                               BigInteger nonce, long deadline) {
        return AuthorizationMessage.builder()
                .caller(caller)
                .operationSelector(FunctionSelector.of(operationSignature))
                .nonce(nonce)
                .deadline(deadline)
                .build();
    }

    @Override
    public byte[] digest(IAuthorizationMessage message) {
        return Eip712Codec.digest(domain, message);
    }

    @Override
    public Mono<IAuthorizationSignature> sign(IAuthorizationMessage message) {
        return authority.sign(domain, message);
    }

    @Override
    public boolean verify(IAuthorizationMessage message, IAuthorizationSignature signature,
                          IParticipantAddress expectedSigner) {
        return Eip712SignatureVerifier.verify(domain, message, signature, expectedSigner);
    }
}
