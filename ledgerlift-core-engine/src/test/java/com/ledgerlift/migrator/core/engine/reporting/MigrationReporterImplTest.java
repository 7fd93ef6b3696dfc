package com.ledgerlift.migrator.core.engine.reporting;

import com.ledgerlift.migrator.integration.contract.migration.IDiscoveryResult;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationOutcome;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationReporter;
import com.ledgerlift.migrator.integration.contract.migration.IRunSummary;
import com.ledgerlift.migrator.integration.enumerations.BatchOutcomeStatus;
import com.ledgerlift.migrator.integration.enumerations.DiscoveryStatus;
import com.ledgerlift.migrator.integration.models.migration.DiscoveryResult;
import com.ledgerlift.migrator.integration.models.migration.MigrationOutcome;
import com.ledgerlift.migrator.integration.models.migration.VerificationNote;
import com.ledgerlift.migrator.integration.models.participant.ParticipantAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MigrationReporterImplTest {

    private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant COMPLETED = Instant.parse("2026-03-01T10:05:00Z");

    private final IMigrationReporter reporter = MigrationReporterImpl.getInstance();
    private final ParticipantAddress alice = ParticipantAddress.of("0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed");

    private IDiscoveryResult discovery(DiscoveryStatus status) {
        return DiscoveryResult.builder().status(status).build();
    }

    private IRunSummary summarize(IDiscoveryResult discovery, int planned, List<IMigrationOutcome> outcomes, boolean aborted) {
        return reporter.summarize("run-1", discovery, planned, outcomes, aborted, STARTED, COMPLETED);
    }

    @Nested
    @DisplayName("Summaries")
    class SummaryTests {

        @Test
        @DisplayName("should sum outcome counts and order batches by index")
        void shouldSumOutcomes() {
            // Given
            List<IMigrationOutcome> outcomes = List.of(
                    MigrationOutcome.confirmed(2, 20, 20, "0x03", BatchOutcomeStatus.CONFIRMED_WITH_EVENT),
                    MigrationOutcome.confirmed(0, 50, 50, "0x01", BatchOutcomeStatus.CONFIRMED_WITH_EVENT),
                    MigrationOutcome.failed(1, 50, BatchOutcomeStatus.REVERTED, "0x02", "out of gas"));

            // When
            IRunSummary summary = summarize(discovery(DiscoveryStatus.DISCOVERED), 3, outcomes, false);

            // Then
            assertEquals(120, summary.getTotalUsers());
            assertEquals(70, summary.getTotalSuccesses());
            assertEquals(50, summary.getTotalFailures());
            assertEquals(3, summary.getCompletedBatches());
            assertEquals(List.of(0, 1, 2), summary.getOutcomes().stream().map(IMigrationOutcome::getBatchIndex).toList());
        }
    }

    @Nested
    @DisplayName("Verdicts")
    class VerdictTests {

        @Test
        @DisplayName("should distinguish a discovery error from an empty ledger")
        void shouldDistinguishErrorFromEmpty() {
            IRunSummary failed = summarize(discovery(DiscoveryStatus.FAILED), 0, List.of(), false);
            IRunSummary empty = summarize(discovery(DiscoveryStatus.NOTHING_FOUND), 0, List.of(), false);

            assertTrue(MigrationReporterImpl.verdict(failed).get(0).startsWith("Result: DISCOVERY ERROR"));
            assertTrue(MigrationReporterImpl.verdict(empty).get(0).startsWith("Result: NO DATA DISCOVERED"));
        }

        @Test
        @DisplayName("should report failures with their count")
        void shouldReportFailures() {
            IRunSummary summary = summarize(discovery(DiscoveryStatus.DISCOVERED), 1,
                    List.of(MigrationOutcome.failed(0, 10, BatchOutcomeStatus.TIMED_OUT, null, "timeout")), false);

            assertEquals(List.of("Result: MIGRATION FAILURE - 10 of 10 participants were not migrated. "
                    + "Re-running the migration is safe."), MigrationReporterImpl.verdict(summary));
        }

        @Test
        @DisplayName("should warn about fallback discovery even when migration succeeded")
        void shouldWarnAboutFallback() {
            IRunSummary summary = summarize(discovery(DiscoveryStatus.FALLBACK), 1,
                    List.of(MigrationOutcome.confirmed(0, 2, 2, "0x01", BatchOutcomeStatus.CONFIRMED_INFERRED)), false);

            List<String> verdict = MigrationReporterImpl.verdict(summary);
            assertTrue(verdict.get(0).startsWith("Warning: DEGRADED DISCOVERY"));
            assertEquals("Result: SUCCESS - all 2 participants migrated.", verdict.get(1));
        }

        @Test
        @DisplayName("should mark an aborted run incomplete")
        void shouldMarkAbortIncomplete() {
            IRunSummary summary = summarize(discovery(DiscoveryStatus.DISCOVERED), 3,
                    List.of(MigrationOutcome.confirmed(0, 50, 50, "0x01", BatchOutcomeStatus.CONFIRMED_WITH_EVENT)), true);

            assertEquals(List.of(
                    "Warning: ABORTED - 2 planned batches were not executed.",
                    "Result: INCOMPLETE - every executed batch succeeded."), MigrationReporterImpl.verdict(summary));
        }
    }

    @Nested
    @DisplayName("Rendering")
    class RenderTests {

        @Test
        @DisplayName("should render the same summary identically every time")
        void shouldRenderDeterministically() {
            // Given
            MigrationOutcome outcome = MigrationOutcome.confirmed(0, 3, 3, "0xabc", BatchOutcomeStatus.CONFIRMED_WITH_EVENT)
                    .withVerificationNotes(List.of(
                            VerificationNote.inconsistent(alice, List.of("stakeCount 3 -> 2")),
                            VerificationNote.unavailable(alice, "no pre-migration snapshot")));
            IRunSummary summary = summarize(discovery(DiscoveryStatus.DISCOVERED), 1, List.of(outcome), false);

            // When
            String first = reporter.render(summary);
            String second = reporter.render(summary);

            // Then
            assertEquals(first, second);
            assertTrue(first.contains("Batches:    1 of 1 executed"));
            assertTrue(first.contains("Users:      3 total, 3 migrated, 0 failed"));
            assertTrue(first.contains("  verification: 0 consistent, 1 inconsistent, 1 unavailable"));
            assertTrue(first.contains("  ! 0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed: stakeCount 3 -> 2"));
            assertTrue(first.endsWith("Result: SUCCESS - all 3 participants migrated.\n"));
        }
    }

    @Nested
    @DisplayName("Audit Records")
    class AuditTests {

        @Test
        @DisplayName("should write the summary as JSON named after the run")
        void shouldWriteAuditRecord(@TempDir Path directory) throws Exception {
            // Given
            IRunSummary summary = summarize(discovery(DiscoveryStatus.DISCOVERED), 1,
                    List.of(MigrationOutcome.failed(0, 4, BatchOutcomeStatus.REVERTED, "0x01", "reverted")), false);

            // When
            Path written = new RunSummaryAuditWriter(directory.resolve("audit")).write(summary).block();

            // Then
            assertNotNull(written);
            assertEquals("run-run-1.json", written.getFileName().toString());
            String json = Files.readString(written).replaceAll("\\s", "");
            assertTrue(json.contains("\"runId\":\"run-1\""));
            assertTrue(json.contains("\"status\":\"REVERTED\""));
            assertTrue(json.contains("\"startedAt\":\"2026-03-01T10:00:00Z\""));
        }
    }
}
