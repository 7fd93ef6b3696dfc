package com.ledgerlift.migrator.integration.contract.migration;

import com.ledgerlift.migrator.integration.enumerations.BatchOutcomeStatus;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one batch. {@code successCount + failureCount == totalUsers} always holds.
 */
public interface IMigrationOutcome {

    int getBatchIndex();

    int getTotalUsers();

    int getSuccessCount();

    int getFailureCount();

    Optional<String> getTxReference();

    BatchOutcomeStatus getStatus();

    /**
     * Root cause message for batches that failed as a whole.
     *
     * @return failure reason
     */
    Optional<String> getFailureReason();

    List<IVerificationNote> getVerificationNotes();
}
