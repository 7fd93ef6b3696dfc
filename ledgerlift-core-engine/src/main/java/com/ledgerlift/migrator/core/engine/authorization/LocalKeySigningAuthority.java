package com.ledgerlift.migrator.core.engine.authorization;

import com.ledgerlift.migrator.core.engine.crypto.Secp256k1;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationMessage;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationSignature;
import com.ledgerlift.migrator.integration.contract.authorization.IDomainSeparator;
import com.ledgerlift.migrator.integration.contract.authorization.ISigningAuthority;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.models.participant.ParticipantAddress;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * Signing authority holding a secp256k1 private key in process.
 */
@Slf4j
public class LocalKeySigningAuthority implements ISigningAuthority {

    private final BigInteger privateKey;
    private final ParticipantAddress address;

    public LocalKeySigningAuthority(BigInteger privateKey) {
        if (!Secp256k1.isValidPrivateKey(privateKey)) {
            throw new IllegalArgumentException("Private key is outside the secp256k1 range");
        }
        this.privateKey = privateKey;
        this.address = Secp256k1.addressOf(Secp256k1.publicKeyOf(privateKey));
    }

    public static LocalKeySigningAuthority fromHex(String privateKeyHex) {
        String digits = privateKeyHex.startsWith("0x") ? privateKeyHex.substring(2) : privateKeyHex;
        return new LocalKeySigningAuthority(new BigInteger(digits, 16));
    }

    @Override
    public Mono<IAuthorizationSignature> sign(IDomainSeparator domain, IAuthorizationMessage message) {
        return Mono.fromCallable(() -> {
            IAuthorizationSignature signature = Secp256k1.sign(Eip712Codec.digest(domain, message), privateKey);
            log.debug("Authority [{}] signed [{}]", address, message);
            return signature;
        });
    }

    @Override
    public IParticipantAddress getAuthorityAddress() {
        return address;
    }

    @Override
    public String toString() {
        return "LocalKeySigningAuthority(" + address + ")";
    }
}
