package com.ledgerlift.migrator.integration.contract.participant;

/**
 * A 20-byte participant identity on the ledger.
 *
 * <p>Implementations compare by canonical form only: two textual encodings of the
 * same key (mixed case, with or without {@code 0x}) are equal and hash alike.</p>
 */
public interface IParticipantAddress {

    int LENGTH = 20;

    /**
     * Returns the canonical encoding: {@code 0x} followed by 40 lowercase hex digits.
     *
     * @return canonical hex form
     */
    String toHex();

    /**
     * Returns a copy of the raw 20 address bytes.
     *
     * @return address bytes
     */
    byte[] toBytes();
}
