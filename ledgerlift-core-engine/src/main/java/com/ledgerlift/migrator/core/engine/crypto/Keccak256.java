package com.ledgerlift.migrator.core.engine.crypto;

import org.bouncycastle.crypto.digests.KeccakDigest;

import java.nio.charset.StandardCharsets;

/**
 * Original Keccak-256 (pre-NIST padding), as used for ledger hashing.
 */
public final class Keccak256 {

    public static final int DIGEST_LENGTH = 32;

    private Keccak256() {
    }

    public static byte[] hash(byte[]... parts) {
        KeccakDigest digest = new KeccakDigest(256);
        for (byte[] part : parts) {
            digest.update(part, 0, part.length);
        }
        byte[] result = new byte[DIGEST_LENGTH];
        digest.doFinal(result, 0);
        return result;
    }

    public static byte[] hash(String utf8) {
        return hash(utf8.getBytes(StandardCharsets.UTF_8));
    }
}
