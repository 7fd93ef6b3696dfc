package com.ledgerlift.migrator.core.engine.orchestration;

import com.ledgerlift.migrator.core.engine.config.MigrationConfig;
import com.ledgerlift.migrator.core.engine.discovery.EventScannerImpl;
import com.ledgerlift.migrator.core.engine.execution.MigrationExecutorImpl;
import com.ledgerlift.migrator.core.engine.planning.BatchPlannerImpl;
import com.ledgerlift.migrator.core.engine.reporting.MigrationReporterImpl;
import com.ledgerlift.migrator.core.engine.reporting.RunSummaryAuditWriter;
import com.ledgerlift.migrator.core.engine.verification.MigrationVerifierImpl;
import com.ledgerlift.migrator.integration.contract.ledger.ILedgerClient;
import com.ledgerlift.migrator.integration.contract.migration.IBatch;
import com.ledgerlift.migrator.integration.contract.migration.IBatchPlanner;
import com.ledgerlift.migrator.integration.contract.migration.IDiscoveryResult;
import com.ledgerlift.migrator.integration.contract.migration.IEventScanner;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationExecutor;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationOrchestrator;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationOutcome;
import com.ledgerlift.migrator.integration.contract.migration.IMigrationReporter;
import com.ledgerlift.migrator.integration.contract.migration.IRunControl;
import com.ledgerlift.migrator.integration.contract.migration.IRunSummary;
import com.ledgerlift.migrator.integration.contract.participant.IParticipantAddress;
import com.ledgerlift.migrator.integration.contract.service.IMigrationServiceClient;
import com.ledgerlift.migrator.integration.enumerations.DiscoveryStatus;
import com.ledgerlift.migrator.integration.models.migration.DiscoveryResult;
import com.ledgerlift.migrator.integration.models.participant.ParticipantSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Run-level facade: discovery, planning, sequential execution with per-batch
 * verification, then reporting.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * IMigrationOrchestrator orchestrator = MigrationOrchestratorImpl.create(ledger, service, config);
 * IRunSummary summary = orchestrator.run(new RunControl()).block();
 * }</pre>
 */
@Slf4j
public class MigrationOrchestratorImpl implements IMigrationOrchestrator {

    private final IEventScanner scanner;
    private final IBatchPlanner planner;
    private final IMigrationExecutor executor;
    private final IMigrationReporter reporter;
    private final RunSummaryAuditWriter auditWriter;
    private final MigrationConfig config;
    private final Clock clock;

    public MigrationOrchestratorImpl(IEventScanner scanner,
                                     IBatchPlanner planner,
                                     IMigrationExecutor executor,
                                     IMigrationReporter reporter,
                                     MigrationConfig config,
                                     Clock clock) {
        this.scanner = scanner;
        this.planner = planner;
        this.executor = executor;
        this.reporter = reporter;
        this.config = config;
        this.clock = clock;
        this.auditWriter = config.getAuditDirectory().map(RunSummaryAuditWriter::new).orElse(null);
    }

    /**
     * Wires the default component implementations against the given collaborators.
     */
    public static MigrationOrchestratorImpl create(ILedgerClient ledger, IMigrationServiceClient service, MigrationConfig config) {
        config.validate();
        return new MigrationOrchestratorImpl(
                new EventScannerImpl(ledger, config),
                BatchPlannerImpl.getInstance(),
                new MigrationExecutorImpl(service, new MigrationVerifierImpl(service, config), config),
                MigrationReporterImpl.getInstance(),
                config,
                Clock.systemUTC());
    }

    @Override
    public Mono<IRunSummary> run(IRunControl control) {
        return Mono.defer(() -> {
            config.validate();
            Instant startedAt = clock.instant();
            String runId = newRunId();
            log.info("Starting migration run [{}] with discovery", runId);
            return scanner.discover()
                    .onErrorResume(error -> {
                        log.error("Discovery failed unexpectedly in run [{}]", runId, error);
                        return Mono.just(DiscoveryResult.builder()
                                .status(DiscoveryStatus.FAILED)
                                .queryFailures(List.of(new IDiscoveryResult.QueryFailure("discover", 0L, 0L,
                                        ExceptionUtils.getRootCauseMessage(error))))
                                .build());
                    })
                    .flatMap(discovery -> migrate(runId, startedAt, discovery, control));
        });
    }

    @Override
    public Mono<IRunSummary> run(List<IParticipantAddress> participants, IRunControl control) {
        return Mono.defer(() -> {
            config.validate();
            Instant startedAt = clock.instant();
            String runId = newRunId();
            log.info("Starting migration run [{}] for [{}] supplied participants", runId, participants.size());
            return migrate(runId, startedAt, DiscoveryResult.supplied(ParticipantSet.of(participants)), control);
        });
    }

    @Override
    public Mono<IMigrationOutcome> repair(List<IParticipantAddress> participants) {
        return Mono.defer(() -> {
            config.validate();
            return executor.repair(participants);
        });
    }

    private Mono<IRunSummary> migrate(String runId, Instant startedAt, IDiscoveryResult discovery, IRunControl control) {
        List<IBatch> batches = planner.plan(discovery.getParticipants().asList(), config.getBatchSize());
        List<IMigrationOutcome> outcomes = new ArrayList<>();

        return executor.execute(batches, control)
                .doOnNext(outcomes::add)
                .then(Mono.fromSupplier(() -> List.copyOf(outcomes)))
                .onErrorResume(error -> {
                    log.error("Batch execution stopped unexpectedly in run [{}] after [{}] batches",
                            runId, outcomes.size(), error);
                    return Mono.just(List.copyOf(outcomes));
                })
                .map(completed -> reporter.summarize(runId, discovery, batches.size(), completed,
                        control.isAborted() && completed.size() < batches.size(), startedAt, clock.instant()))
                .flatMap(summary -> {
                    log.info("Run [{}] report:\n{}", runId, reporter.render(summary));
                    return audit(summary);
                });
    }

    private Mono<IRunSummary> audit(IRunSummary summary) {
        if (auditWriter == null) {
            return Mono.just(summary);
        }
        return auditWriter.write(summary)
                .thenReturn(summary)
                .onErrorResume(error -> {
                    log.warn("Could not write audit record for run [{}]: {}",
                            summary.getRunId(), ExceptionUtils.getRootCauseMessage(error));
                    return Mono.just(summary);
                });
    }

    private static String newRunId() {
        return UUID.randomUUID().toString();
    }
}
