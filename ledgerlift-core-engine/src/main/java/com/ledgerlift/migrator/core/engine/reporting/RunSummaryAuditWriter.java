package com.ledgerlift.migrator.core.engine.reporting;

import com.ledgerlift.migrator.core.engine.misc.LedgerLiftObjectMapper;
import com.ledgerlift.migrator.integration.contract.migration.IRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists run summaries as {@code run-<runId>.json} under an audit directory.
 */
@Slf4j
@RequiredArgsConstructor
public class RunSummaryAuditWriter {

    private final Path directory;

    public Mono<Path> write(IRunSummary summary) {
        return Mono.fromCallable(() -> {
                    Files.createDirectories(directory);
                    Path target = directory.resolve("run-" + summary.getRunId() + ".json");
                    String json = LedgerLiftObjectMapper.getInstance().writeValueAsString(RunSummaryRecord.from(summary));
                    Files.writeString(target, json, StandardCharsets.UTF_8);
                    log.info("Wrote audit record for run [{}] to [{}]", summary.getRunId(), target);
                    return target;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
