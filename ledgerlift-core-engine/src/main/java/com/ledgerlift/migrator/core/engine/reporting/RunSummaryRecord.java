package com.ledgerlift.migrator.core.engine.reporting;

import com.ledgerlift.migrator.integration.contract.migration.IMigrationOutcome;
import com.ledgerlift.migrator.integration.contract.migration.IRunSummary;
import com.ledgerlift.migrator.integration.contract.migration.IVerificationNote;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * JSON audit shape of a run summary. Timestamps are ISO-8601 text.
 */
@Getter
@Builder
public class RunSummaryRecord {

    private final String runId;
    private final String startedAt;
    private final String completedAt;
    private final String discoveryStatus;
    private final int discoveryQueryFailures;
    private final int totalUsers;
    private final int totalSuccesses;
    private final int totalFailures;
    private final int plannedBatches;
    private final int completedBatches;
    private final boolean aborted;
    private final List<BatchRecord> batches;

    @Getter
    @Builder
    public static class BatchRecord {
        private final int index;
        private final String status;
        private final int totalUsers;
        private final int successCount;
        private final int failureCount;
        private final String txReference;
        private final String failureReason;
        private final List<NoteRecord> verification;
    }

    @Getter
    @Builder
    public static class NoteRecord {
        private final String participant;
        private final String status;
        private final List<String> differences;
        private final String detail;
    }

    public static RunSummaryRecord from(IRunSummary summary) {
        return RunSummaryRecord.builder()
                .runId(summary.getRunId())
                .startedAt(String.valueOf(summary.getStartedAt()))
                .completedAt(String.valueOf(summary.getCompletedAt()))
                .discoveryStatus(summary.getDiscoveryStatus().name())
                .discoveryQueryFailures(summary.getDiscoveryQueryFailures())
                .totalUsers(summary.getTotalUsers())
                .totalSuccesses(summary.getTotalSuccesses())
                .totalFailures(summary.getTotalFailures())
                .plannedBatches(summary.getPlannedBatches())
                .completedBatches(summary.getCompletedBatches())
                .aborted(summary.isAborted())
                .batches(summary.getOutcomes().stream().map(RunSummaryRecord::batch).toList())
                .build();
    }

    private static BatchRecord batch(IMigrationOutcome outcome) {
        return BatchRecord.builder()
                .index(outcome.getBatchIndex())
                .status(outcome.getStatus().name())
                .totalUsers(outcome.getTotalUsers())
                .successCount(outcome.getSuccessCount())
                .failureCount(outcome.getFailureCount())
                .txReference(outcome.getTxReference().orElse(null))
                .failureReason(outcome.getFailureReason().orElse(null))
                .verification(outcome.getVerificationNotes().stream().map(RunSummaryRecord::note).toList())
                .build();
    }

    private static NoteRecord note(IVerificationNote note) {
        return NoteRecord.builder()
                .participant(note.getParticipant().toHex())
                .status(note.getStatus().name())
                .differences(note.getDifferences())
                .detail(note.getDetail().orElse(null))
                .build();
    }
}
