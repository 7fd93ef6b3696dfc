package com.ledgerlift.migrator.integration.enumerations;

public enum BatchOutcomeStatus {
    /** Confirmed, counts taken from the service's result event. */
    CONFIRMED_WITH_EVENT,
    /** Confirmed without a result event; whole batch counted as migrated. */
    CONFIRMED_INFERRED,
    /** Confirmed revert; whole batch counted as failed. */
    REVERTED,
    SUBMISSION_FAILED,
    TIMED_OUT;

    public boolean isConfirmed() {
        return this == CONFIRMED_WITH_EVENT || this == CONFIRMED_INFERRED;
    }
}
