package com.ledgerlift.migrator.core.engine.crypto;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * Mixed-case checksum rendering of addresses, for reports and logs.
 */
public final class ChecksumAddress {

    private ChecksumAddress() {
    }

    public static String render(IParticipantAddress address) {
        String hex = address.toHex().substring(2);
        String hashHex = HexFormat.of().formatHex(Keccak256.hash(hex.getBytes(StandardCharsets.US_ASCII)));
        StringBuilder sb = new StringBuilder(42).append("0x");
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            if (c >= 'a' && c <= 'f' && Character.digit(hashHex.charAt(i), 16) >= 8) {
                sb.append(Character.toUpperCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
