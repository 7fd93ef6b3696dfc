package com.ledgerlift.migrator.integration.contract.authorization;

import java.math.BigInteger;

/**
 * A recoverable secp256k1 signature in the 65-byte {@code r || s || v} layout.
 */
public interface IAuthorizationSignature {

    int LENGTH = 65;

    BigInteger getR();

    BigInteger getS();

    /**
     * Recovery byte, 27 or 28.
     *
     * @return v
     */
    int getV();

    byte[] toBytes();

    String toHex();
}
