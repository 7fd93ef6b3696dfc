package com.ledgerlift.migrator.core.engine.authorization;

import com.ledgerlift.migrator.core.engine.crypto.Keccak256;
import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationMessage;
import com.ledgerlift.migrator.integration.contract.authorization.IDomainSeparator;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * Typed structured-data hashing for authorization messages.
 *
 * <pre>
 * digest = keccak256(0x19 0x01 || hashDomain(domain) || hashMessage(message))
 * </pre>
 */
public final class Eip712Codec {

    public static final String DOMAIN_TYPE =
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";
    public static final String FUNCTION_CALL_TYPE =
            "FunctionCall(address caller,bytes4 selector,uint256 nonce,uint256 deadline)";

    private static final byte[] DOMAIN_TYPE_HASH = Keccak256.hash(DOMAIN_TYPE);
    private static final byte[] FUNCTION_CALL_TYPE_HASH = Keccak256.hash(FUNCTION_CALL_TYPE);
    private static final int WORD = 32;

    private Eip712Codec() {
    }

    public static byte[] hashDomain(IDomainSeparator domain) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(5 * WORD);
        out.writeBytes(DOMAIN_TYPE_HASH);
        out.writeBytes(Keccak256.hash(domain.getName()));
        out.writeBytes(Keccak256.hash(domain.getVersion()));
        out.writeBytes(uint256(BigInteger.valueOf(domain.getChainId())));
        out.writeBytes(address(domain.getVerifyingContract()));
        return Keccak256.hash(out.toByteArray());
    }

    public static byte[] hashMessage(IAuthorizationMessage message) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(5 * WORD);
        out.writeBytes(FUNCTION_CALL_TYPE_HASH);
        out.writeBytes(address(message.getCaller()));
        out.writeBytes(fixedBytes(message.getOperationSelector()));
        out.writeBytes(uint256(message.getNonce()));
        out.writeBytes(uint256(BigInteger.valueOf(message.getDeadline())));
        return Keccak256.hash(out.toByteArray());
    }

    public static byte[] digest(IDomainSeparator domain, IAuthorizationMessage message) {
        return Keccak256.hash(new byte[]{0x19, 0x01}, hashDomain(domain), hashMessage(message));
    }

    static byte[] uint256(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("Value does not fit uint256 [" + value + "]");
        }
        byte[] raw = value.toByteArray();
        byte[] word = new byte[WORD];
        int length = Math.min(raw.length, WORD);
        System.arraycopy(raw, raw.length - length, word, WORD - length, length);
        return word;
    }

    static byte[] address(IParticipantAddress address) {
        byte[] word = new byte[WORD];
        System.arraycopy(address.toBytes(), 0, word, WORD - IParticipantAddress.LENGTH, IParticipantAddress.LENGTH);
        return word;
    }

    // bytesN values are right padded
    static byte[] fixedBytes(byte[] value) {
        byte[] word = new byte[WORD];
        System.arraycopy(value, 0, word, 0, value.length);
        return word;
    }
}
