package com.ledgerlift.migrator.integration.models.authorization;

import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationSignature;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * 65-byte {@code r || s || v} signature with {@code v} in {27, 28}.
 */
@Getter
@EqualsAndHashCode
public class AuthorizationSignature implements IAuthorizationSignature {

    private static final int WORD = 32;

    private final BigInteger r;
    private final BigInteger s;
    private final int v;

    public AuthorizationSignature(BigInteger r, BigInteger s, int v) {
        if (r == null || s == null || r.signum() <= 0 || s.signum() <= 0) {
            throw new IllegalArgumentException("Signature components r and s must be positive");
        }
        if (r.bitLength() > 256 || s.bitLength() > 256) {
            throw new IllegalArgumentException("Signature components must fit in 32 bytes");
        }
        if (v != 27 && v != 28) {
            throw new IllegalArgumentException("Signature recovery byte must be 27 or 28, got [" + v + "]");
        }
        this.r = r;
        this.s = s;
        this.v = v;
    }

    public static AuthorizationSignature fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Signature must be exactly " + LENGTH + " bytes");
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(bytes, 0, WORD));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(bytes, WORD, 2 * WORD));
        int v = bytes[2 * WORD] & 0xFF;
        return new AuthorizationSignature(r, s, v < 27 ? v + 27 : v);
    }

    public static AuthorizationSignature fromHex(String hex) {
        String digits = hex.startsWith("0x") ? hex.substring(2) : hex;
        return fromBytes(HexFormat.of().parseHex(digits));
    }

    @Override
    public byte[] toBytes() {
        byte[] out = new byte[LENGTH];
        writeWord(r, out, 0);
        writeWord(s, out, WORD);
        out[2 * WORD] = (byte) v;
        return out;
    }

    @Override
    public String toHex() {
        return "0x" + HexFormat.of().formatHex(toBytes());
    }

    private static void writeWord(BigInteger value, byte[] out, int offset) {
        byte[] raw = value.toByteArray();
        int length = Math.min(raw.length, WORD);
        System.arraycopy(raw, raw.length - length, out, offset + WORD - length, length);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
