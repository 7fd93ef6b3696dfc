package com.ledgerlift.migrator.integration.contract.ledger;

import java.util.Map;
import java.util.Optional;

/**
 * A historical event as returned by a ledger query.
 */
public interface ILedgerEvent {

    String getEventKind();

    long getBlockNumber();

    String getTransactionReference();

    /**
     * Decoded event arguments keyed by argument name.
     *
     * @return event fields
     */
    Map<String, String> getFields();

    default Optional<String> getField(String name) {
        return Optional.ofNullable(getFields().get(name));
    }
}
