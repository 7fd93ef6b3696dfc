package com.ledgerlift.migrator.integration.contract.migration;

import java.util.Optional;

/**
 * Ledger confirmation of a bulk (or single) migration transaction.
 */
public interface IBulkMigrationReceipt {

    String getTxReference();

    /**
     * Returns true when the transaction was mined but reverted.
     *
     * @return whether the transaction reverted
     */
    boolean isReverted();

    /**
     * Success count from the service's result event, if one was emitted.
     *
     * @return reported success count
     */
    Optional<Integer> getReportedSuccessCount();

    /**
     * Total users from the service's result event, if one was emitted.
     *
     * @return reported total
     */
    Optional<Integer> getReportedTotalUsers();

    Optional<String> getRevertReason();

    default boolean hasResultEvent() {
        return getReportedSuccessCount().isPresent() && getReportedTotalUsers().isPresent();
    }
}
