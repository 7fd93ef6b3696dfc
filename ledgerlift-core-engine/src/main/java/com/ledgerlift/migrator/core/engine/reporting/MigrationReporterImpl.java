package com.ledgerlift.migrator.core.engine.reporting;

import com.ledgerlift.migrator.core.engine.crypto.ChecksumAddress;
import com.ledgerlift.migrator.integration.contract.migration.IDiscoveryResult;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationOutcome;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationReporter;
import com.ledgerlift.migrator.integration.contract.migration.IRunSummary;
import com.ledgerlift.migrator.integration.contract.migration.IVerificationNote;
import com.ledgerlift.migrator.integration.enumerations.DiscoveryStatus;
import com.ledgerlift.migrator.integration.enumerations.VerificationStatus;
import com.ledgerlift.migrator.integration.models.migration.RunSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Folds outcomes into a {@link RunSummary} and renders it as plain text.
 *
 * <p>The rendered report always states which of these applies: no data discovered,
 * discovery error, degraded discovery from the fallback list, migration failures,
 * abort, or success.</p>
 */
public class MigrationReporterImpl implements IMigrationReporter {

    private static final String RULE = "------------------------------------------------------------";

    private MigrationReporterImpl() {}

    private static final class SingletonHelper {
        private static final MigrationReporterImpl INSTANCE = new MigrationReporterImpl();
    }

    public static IMigrationReporter getInstance() {
        return SingletonHelper.INSTANCE;
    }

    @Override
    public IRunSummary summarize(String runId,
                                 IDiscoveryResult discovery,
                                 int plannedBatches,
                                 List<IMigrationOutcome> outcomes,
                                 boolean aborted,
                                 Instant startedAt,
                                 Instant completedAt) {
        List<IMigrationOutcome> ordered = outcomes.stream()
                .sorted(Comparator.comparingInt(IMigrationOutcome::getBatchIndex))
                .toList();
        int totalUsers = 0;
        int successes = 0;
        int failures = 0;
        for (IMigrationOutcome outcome : ordered) {
            totalUsers += outcome.getTotalUsers();
            successes += outcome.getSuccessCount();
            failures += outcome.getFailureCount();
        }
        return RunSummary.builder()
                .runId(runId)
                .totalUsers(totalUsers)
                .totalSuccesses(successes)
                .totalFailures(failures)
                .plannedBatches(plannedBatches)
                .completedBatches(ordered.size())
                .aborted(aborted)
                .discoveryStatus(discovery.getStatus())
                .discoveryQueryFailures(discovery.getQueryFailures().size())
                .outcomes(ordered)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }

    @Override
    public String render(IRunSummary summary) {
        StringBuilder out = new StringBuilder();
        out.append("Migration run ").append(summary.getRunId()).append('\n');
        out.append(RULE).append('\n');
        out.append("Started:    ").append(summary.getStartedAt()).append('\n');
        out.append("Completed:  ").append(summary.getCompletedAt()).append('\n');
        out.append("Discovery:  ").append(summary.getDiscoveryStatus());
        if (summary.getDiscoveryQueryFailures() > 0) {
            out.append(" (").append(summary.getDiscoveryQueryFailures()).append(" failed queries)");
        }
        out.append('\n');
        out.append("Batches:    ").append(summary.getCompletedBatches()).append(" of ")
                .append(summary.getPlannedBatches()).append(" executed");
        if (summary.isAborted()) {
            out.append(" (aborted)");
        }
        out.append('\n');
        out.append("Users:      ").append(summary.getTotalUsers())
                .append(" total, ").append(summary.getTotalSuccesses()).append(" migrated, ")
                .append(summary.getTotalFailures()).append(" failed").append('\n');
        out.append(RULE).append('\n');

        for (IMigrationOutcome outcome : summary.getOutcomes()) {
            renderOutcome(out, outcome);
        }
        if (!summary.getOutcomes().isEmpty()) {
            out.append(RULE).append('\n');
        }

        for (String line : verdict(summary)) {
            out.append(line).append('\n');
        }
        return out.toString();
    }

    private static void renderOutcome(StringBuilder out, IMigrationOutcome outcome) {
        out.append("Batch ").append(outcome.getBatchIndex()).append(": ")
                .append(outcome.getStatus()).append(", ")
                .append(outcome.getSuccessCount()).append('/').append(outcome.getTotalUsers()).append(" migrated");
        outcome.getTxReference().ifPresent(tx -> out.append(", tx ").append(tx));
        outcome.getFailureReason().ifPresent(reason -> out.append(", reason: ").append(reason));
        out.append('\n');

        List<IVerificationNote> notes = outcome.getVerificationNotes();
        if (notes.isEmpty()) {
            return;
        }
        out.append("  verification: ")
                .append(count(notes, VerificationStatus.CONSISTENT)).append(" consistent, ")
                .append(count(notes, VerificationStatus.INCONSISTENT)).append(" inconsistent, ")
                .append(count(notes, VerificationStatus.UNAVAILABLE)).append(" unavailable")
                .append('\n');
        for (IVerificationNote note : notes) {
            if (note.getStatus() == VerificationStatus.INCONSISTENT) {
                out.append("  ! ").append(ChecksumAddress.render(note.getParticipant())).append(": ")
                        .append(String.join(", ", note.getDifferences())).append('\n');
            } else if (note.getStatus() == VerificationStatus.UNAVAILABLE) {
                out.append("  ? ").append(ChecksumAddress.render(note.getParticipant())).append(": ")
                        .append(note.getDetail().orElse("unavailable")).append('\n');
            }
        }
    }

    private static long count(List<IVerificationNote> notes, VerificationStatus status) {
        return notes.stream().filter(note -> note.getStatus() == status).count();
    }

    static List<String> verdict(IRunSummary summary) {
        DiscoveryStatus discovery = summary.getDiscoveryStatus();
        if (discovery == DiscoveryStatus.FAILED) {
            return List.of("Result: DISCOVERY ERROR - the ledger could not be queried; no participants were migrated. "
                    + "An empty result here does not mean there is nothing to migrate.");
        }
        if (summary.getTotalUsers() == 0 && summary.getPlannedBatches() == 0) {
            return List.of("Result: NO DATA DISCOVERED - no participant events were found in any scan window.");
        }

        List<String> lines = new ArrayList<>();
        if (discovery == DiscoveryStatus.FALLBACK) {
            lines.add("Warning: DEGRADED DISCOVERY - participants came from the operator fallback list, not from the ledger.");
        } else if (discovery == DiscoveryStatus.DISCOVERED_PARTIAL) {
            lines.add("Warning: PARTIAL DISCOVERY - some ledger queries failed; the participant set may be incomplete.");
        }
        if (summary.isAborted()) {
            lines.add("Warning: ABORTED - " + (summary.getPlannedBatches() - summary.getCompletedBatches())
                    + " planned batches were not executed.");
        }
        if (summary.getTotalFailures() > 0) {
            lines.add("Result: MIGRATION FAILURE - " + summary.getTotalFailures() + " of " + summary.getTotalUsers()
                    + " participants were not migrated. Re-running the migration is safe.");
        } else if (summary.isAborted()) {
            lines.add("Result: INCOMPLETE - every executed batch succeeded.");
        } else {
            lines.add("Result: SUCCESS - all " + summary.getTotalUsers() + " participants migrated.");
        }
        return lines;
    }
}
