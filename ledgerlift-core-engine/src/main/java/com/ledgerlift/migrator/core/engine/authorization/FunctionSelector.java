package com.ledgerlift.migrator.core.engine.authorization;

import com.ledgerlift.migrator.core.engine.crypto.Keccak256;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Four-byte operation selector: the first four bytes of keccak256 over the canonical
 * function signature, for example {@code deposit(uint256,uint256,uint256,bytes)}.
 */
public final class FunctionSelector {

    private FunctionSelector() {
    }

    public static byte[] of(String operationSignature) {
        if (operationSignature == null || operationSignature.isBlank()
                || !operationSignature.contains("(") || !operationSignature.endsWith(")")
                || operationSignature.contains(" ")) {
            throw new IllegalArgumentException("Not a canonical function signature [" + operationSignature + "]");
        }
        return Arrays.copyOf(Keccak256.hash(operationSignature), 4);
    }

    public static String toHex(byte[] selector) {
        return "0x" + HexFormat.of().formatHex(selector);
    }
}
