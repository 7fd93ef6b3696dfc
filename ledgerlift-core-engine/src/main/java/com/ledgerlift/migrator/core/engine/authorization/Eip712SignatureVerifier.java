package com.ledgerlift.migrator.core.engine.authorization;

import com.ledgerlift.migrator.core.engine.crypto.Secp256k1;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationMessage;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationSignature;
import com.ledgerlift.migrator.integration.contract.authorization.IDomainSeparator;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.models.participant.ParticipantAddress;

import java.util.Optional;

/**
 * Recovers the signer of an authorization message, the way the service does it.
 */
public final class Eip712SignatureVerifier {

    private Eip712SignatureVerifier() {
    }

    public static Optional<ParticipantAddress> recoverSigner(IDomainSeparator domain,
                                                             IAuthorizationMessage message,
                                                             IAuthorizationSignature signature) {
        return Secp256k1.recoverAddress(Eip712Codec.digest(domain, message), signature);
    }

    public static boolean verify(IDomainSeparator domain,
                                 IAuthorizationMessage message,
                                 IAuthorizationSignature signature,
                                 IParticipantAddress expectedSigner) {
        if (signature == null || expectedSigner == null) {
            return false;
        }
        return recoverSigner(domain, message, signature)
                .map(signer -> signer.equals(ParticipantAddress.from(expectedSigner)))
                .orElse(false);
    }
}
