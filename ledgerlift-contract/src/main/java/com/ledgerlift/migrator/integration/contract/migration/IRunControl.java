package com.ledgerlift.migrator.integration.contract.migration;

/**
 * Cooperative cancellation handle for a run. Checked between batches only.
 */
public interface IRunControl {

    void abort();

    boolean isAborted();
}
