package com.ledgerlift.migrator.integration.contract.authorization;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * Produces and checks domain-separated signatures over authorization messages.
 *
 * <p>A signature is valid for exactly one (domain, caller, selector, nonce, deadline)
 * tuple. Changing any field, including the selector, invalidates it.</p>
 */
public interface IAuthorizationSigner {

    IDomainSeparator getDomain();

    /**
     * Builds an authorization message for {@code caller} and the given operation.
     *
     * @param caller participant on whose behalf the call is made
     * @param operationSignature canonical function signature
     * @param nonce current nonce for the caller
     * @param deadline expiry as epoch seconds
     * @return message
     */
    IAuthorizationMessage createMessage(IParticipantAddress caller, String operationSignature,
                                        BigInteger nonce, long deadline);

    /**
     * Computes {@code keccak256(0x19 0x01 || domainSeparator || structHash)}.
     *
     * @param message authorization message
     * @return 32-byte digest
     */
    byte[] digest(IAuthorizationMessage message);

    Mono<IAuthorizationSignature> sign(IAuthorizationMessage message);

    /**
     * Returns true when {@code signature} over {@code message} recovers to {@code expectedSigner}.
     *
     * @param message authorization message
     * @param signature signature to check
     * @param expectedSigner expected authority
     * @return whether the signature is valid
     */
    boolean verify(IAuthorizationMessage message, IAuthorizationSignature signature, IParticipantAddress expectedSigner);
}
