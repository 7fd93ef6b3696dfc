package com.ledgerlift.migrator.integration.models.migration;

import com.ledgerlift.migrator.integration.contract.migration.IMigrationOutcome;
import com.ledgerlift.migrator.integration.contract.migration.IVerificationNote;
import com.ledgerlift.migrator.integration.enumerations.BatchOutcomeStatus;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one batch. The counts are validated on construction.
 */
@Data
public class MigrationOutcome implements IMigrationOutcome {

    private final int batchIndex;
    private final int totalUsers;
    private final int successCount;
    private final int failureCount;
    private final String txReference;
    private final BatchOutcomeStatus status;
    private final String failureReason;
    private final List<IVerificationNote> verificationNotes;

    @Builder(toBuilder = true)
    public MigrationOutcome(int batchIndex,
                            int totalUsers,
                            int successCount,
                            int failureCount,
                            String txReference,
                            BatchOutcomeStatus status,
                            String failureReason,
                            List<IVerificationNote> verificationNotes) {
        if (status == null) {
            throw new IllegalArgumentException("Outcome status must not be null");
        }
        if (totalUsers < 0 || successCount < 0 || failureCount < 0) {
            throw new IllegalArgumentException("Outcome counts must not be negative");
        }
        if (successCount + failureCount != totalUsers) {
            throw new IllegalArgumentException("successCount [" + successCount + "] + failureCount ["
                    + failureCount + "] must equal totalUsers [" + totalUsers + "]");
        }
        this.batchIndex = batchIndex;
        this.totalUsers = totalUsers;
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.txReference = txReference;
        this.status = status;
        this.failureReason = failureReason;
        this.verificationNotes = verificationNotes == null ? List.of() : List.copyOf(verificationNotes);
    }

    @Override
    public Optional<String> getTxReference() {
        return Optional.ofNullable(txReference);
    }

    @Override
    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    /**
     * Confirmed batch. {@code successCount} is clamped to {@code [0, totalUsers]}.
     */
    public static MigrationOutcome confirmed(int batchIndex, int totalUsers, int successCount,
                                             String txReference, BatchOutcomeStatus status) {
        int clamped = Math.max(0, Math.min(successCount, totalUsers));
        return MigrationOutcome.builder()
                .batchIndex(batchIndex)
                .totalUsers(totalUsers)
                .successCount(clamped)
                .failureCount(totalUsers - clamped)
                .txReference(txReference)
                .status(status)
                .build();
    }

    /**
     * Batch that failed as a whole: every participant counts as a failure.
     */
    public static MigrationOutcome failed(int batchIndex, int totalUsers, BatchOutcomeStatus status,
                                          String txReference, String failureReason) {
        return MigrationOutcome.builder()
                .batchIndex(batchIndex)
                .totalUsers(totalUsers)
                .successCount(0)
                .failureCount(totalUsers)
                .txReference(txReference)
                .status(status)
                .failureReason(failureReason)
                .build();
    }

    public MigrationOutcome withVerificationNotes(List<IVerificationNote> notes) {
        return toBuilder().verificationNotes(notes).build();
    }
}
