package com.ledgerlift.migrator.integration.models.migration;

import com.ledgerlift.migrator.integration.contract.migration.IBulkMigrationReceipt;
import lombok.Builder;
import lombok.Data;

import java.util.Optional;

@Data
@Builder
public class BulkMigrationReceipt implements IBulkMigrationReceipt {

    private final String txReference;
    private final boolean reverted;
    private final Integer reportedSuccessCount;
    private final Integer reportedTotalUsers;
    private final String revertReason;

    @Override
    public Optional<Integer> getReportedSuccessCount() {
        return Optional.ofNullable(reportedSuccessCount);
    }

    @Override
    public Optional<Integer> getReportedTotalUsers() {
        return Optional.ofNullable(reportedTotalUsers);
    }

    @Override
    public Optional<String> getRevertReason() {
        return Optional.ofNullable(revertReason);
    }

    /**
     * Confirmed transaction that emitted the bulk completion event.
     */
    public static BulkMigrationReceipt confirmed(String txReference, int successCount, int totalUsers) {
        return BulkMigrationReceipt.builder()
                .txReference(txReference)
                .reportedSuccessCount(successCount)
                .reportedTotalUsers(totalUsers)
                .build();
    }

    /**
     * Confirmed transaction with no parseable completion event.
     */
    public static BulkMigrationReceipt confirmedWithoutEvent(String txReference) {
        return BulkMigrationReceipt.builder()
                .txReference(txReference)
                .build();
    }

    public static BulkMigrationReceipt reverted(String txReference, String reason) {
        return BulkMigrationReceipt.builder()
                .txReference(txReference)
                .reverted(true)
                .revertReason(reason)
                .build();
    }
}
