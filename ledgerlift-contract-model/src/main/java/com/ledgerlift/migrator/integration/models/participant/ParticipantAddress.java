package com.ledgerlift.migrator.integration.models.participant;

import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import lombok.EqualsAndHashCode;

import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Immutable participant address. Equality and hashing use the canonical lowercase form.
 */
@EqualsAndHashCode
public final class ParticipantAddress implements IParticipantAddress {

    private static final Pattern HEX_40 = Pattern.compile("^[0-9a-fA-F]{40}$");
    private static final HexFormat HEX = HexFormat.of();

    public static final ParticipantAddress ZERO = new ParticipantAddress("0x" + "0".repeat(40));

    private final String hex;

    private ParticipantAddress(String canonicalHex) {
        this.hex = canonicalHex;
    }

    /**
     * Parses {@code 0x}-prefixed or bare 40-digit hex text in any letter case.
     *
     * @param text address text
     * @return parsed address
     * @throws IllegalArgumentException when the text is not a 20-byte hex address
     */
    public static ParticipantAddress of(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Participant address must not be null");
        }
        String trimmed = text.trim();
        String digits = trimmed.startsWith("0x") || trimmed.startsWith("0X") ? trimmed.substring(2) : trimmed;
        if (!HEX_40.matcher(digits).matches()) {
            throw new IllegalArgumentException("Invalid participant address [" + text + "]");
        }
        return new ParticipantAddress("0x" + digits.toLowerCase(Locale.ROOT));
    }

    public static ParticipantAddress of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Participant address must be exactly " + LENGTH + " bytes");
        }
        return new ParticipantAddress("0x" + HEX.formatHex(bytes));
    }

    public static boolean isValid(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.trim();
        String digits = trimmed.startsWith("0x") || trimmed.startsWith("0X") ? trimmed.substring(2) : trimmed;
        return HEX_40.matcher(digits).matches();
    }

    @Override
    public String toHex() {
        return hex;
    }

    @Override
    public byte[] toBytes() {
        return HEX.parseHex(hex.substring(2));
    }

    /**
     * Returns the address left-padded to a 32-byte ABI word.
     *
     * @return 32-byte word
     */
    public byte[] toAbiWord() {
        byte[] word = new byte[32];
        System.arraycopy(toBytes(), 0, word, 32 - LENGTH, LENGTH);
        return word;
    }

    /**
     * Converts any address implementation into this canonical model.
     */
    public static ParticipantAddress from(IParticipantAddress address) {
        if (address instanceof ParticipantAddress participantAddress) {
            return participantAddress;
        }
        return of(address.toHex());
    }

    @Override
    public String toString() {
        return hex;
    }
}
