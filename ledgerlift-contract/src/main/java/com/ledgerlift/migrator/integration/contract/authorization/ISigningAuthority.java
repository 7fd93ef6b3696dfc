package com.ledgerlift.migrator.integration.contract.authorization;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import reactor.core.publisher.Mono;

/**
 * The separate party whose signature co-authorizes privileged calls.
 *
 * <p>The key material never leaves the implementation. Remote signers (HSM, custody
 * service) implement this interface as well as in-process keys.</p>
 */
public interface ISigningAuthority {

    /**
     * Signs the typed-data digest of {@code message} under {@code domain}.
     *
     * @param domain domain separator
     * @param message authorization message
     * @return recoverable signature
     */
    Mono<IAuthorizationSignature> sign(IDomainSeparator domain, IAuthorizationMessage message);

    /**
     * Address derived from the authority's public key, as registered with the service.
     *
     * @return authority address
     */
    IParticipantAddress getAuthorityAddress();
}
