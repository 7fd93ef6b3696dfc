package com.ledgerlift.migrator.integration.contract.ledger;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read access to the external, append-only ledger.
 *
 * <p>Both operations may fail per call. Callers are expected to contain the failure;
 * an implementation must never assume the caller aborts on error.</p>
 */
public interface ILedgerClient {

    /**
     * Returns the current block height.
     *
     * @return latest block number
     */
    Mono<Long> currentHeight();

    /**
     * Returns the events matching the filter in ledger order.
     *
     * @param filter event kind and inclusive block range
     * @return matching events
     */
    Flux<ILedgerEvent> query(IEventFilter filter);
}
