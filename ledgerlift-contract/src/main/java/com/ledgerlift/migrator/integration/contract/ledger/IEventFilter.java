package com.ledgerlift.migrator.integration.contract.ledger;

/**
 * Selects one event kind over an inclusive block range {@code [startBlock, endBlock]}.
 */
public interface IEventFilter {

    String getEventKind();

    long getStartBlock();

    long getEndBlock();

    default long getBlockSpan() {
        return getEndBlock() - getStartBlock() + 1;
    }
}
