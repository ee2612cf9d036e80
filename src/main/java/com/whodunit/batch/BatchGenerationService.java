package com.whodunit.batch;

import com.whodunit.config.WhodunitProperties;
import com.whodunit.contract.ConfigurationException;
import com.whodunit.contract.GameConfiguration;
import com.whodunit.contract.GameConfigurationValidator;
import com.whodunit.contract.GameRecord;
import com.whodunit.engine.EngineFaultException;
import com.whodunit.engine.FaultKind;
import com.whodunit.engine.GameEngineService;
import com.whodunit.engine.GameOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Generates one game per seed over a contiguous seed range.
 *
 * Games share nothing, so they run on a fixed pool of workers with no
 * locking. A fault in one game is recorded and the batch moves on.
 */
@Service
public class BatchGenerationService {

    private static final Logger log = LoggerFactory.getLogger(BatchGenerationService.class);

    private final GameEngineService engine;
    private final GameConfigurationValidator validator;
    private final WhodunitProperties properties;

    public BatchGenerationService(GameEngineService engine,
                                  GameConfigurationValidator validator,
                                  WhodunitProperties properties) {
        this.engine = engine;
        this.validator = validator;
        this.properties = properties;
    }

    /**
     * @param configuration configuration for every game, or null for the default one
     * @throws ConfigurationException if the configuration is invalid; no game is played
     */
    public BatchReport run(GameConfiguration configuration, long seedStart, int count) {
        int maxCount = properties.getBatch().getMaxCount();
        if (count <= 0 || count > maxCount) {
            throw new IllegalArgumentException("count must be between 1 and " + maxCount + ", got " + count);
        }
        GameConfiguration effective = configuration != null ? configuration : engine.defaultConfiguration();
        validator.validate(effective);

        int workers = Math.max(1, Math.min(properties.getBatch().getWorkers(), count));
        log.info("Batch started: {} games from seed {} on {} worker(s)", count, seedStart, workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<SeedResult>> futures = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                long seed = seedStart + i;
                futures.add(pool.submit(() -> playOne(effective, seed)));
            }

            List<GameRecord> records = new ArrayList<>();
            List<BatchFault> faults = new ArrayList<>();
            for (Future<SeedResult> future : futures) {
                SeedResult result = await(future);
                if (result.record() != null) {
                    records.add(result.record());
                } else {
                    faults.add(result.fault());
                }
            }

            BatchReport report = BatchReport.of(count, records, faults);
            log.info("Batch finished: {}/{} converged, {} faults, propositions min={} max={} avg={}",
                report.converged(), count, faults.size(),
                report.minPropositions(), report.maxPropositions(),
                String.format("%.1f", report.averagePropositions()));
            return report;
        } finally {
            pool.shutdownNow();
        }
    }

    private SeedResult playOne(GameConfiguration configuration, long seed) {
        try {
            GameOutcome outcome = engine.play(configuration, seed);
            if (outcome instanceof GameOutcome.Exhausted exhausted) {
                return SeedResult.failed(new BatchFault(seed, FaultKind.ATTEMPTS_EXHAUSTED.name(),
                    "remaining suspects " + exhausted.remainingSuspects()));
            }
            return SeedResult.converged(outcome.record());
        } catch (EngineFaultException ex) {
            log.warn("Game seed={} faulted ({}): {}", seed, ex.getKind(), ex.getMessage());
            return SeedResult.failed(new BatchFault(seed, ex.getKind().name(), ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("Game seed={} failed unexpectedly", seed, ex);
            return SeedResult.failed(new BatchFault(seed, "UNEXPECTED", String.valueOf(ex.getMessage())));
        }
    }

    private static SeedResult await(Future<SeedResult> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("batch interrupted", ex);
        } catch (ExecutionException ex) {
            // playOne catches runtime failures itself, so only errors land here
            throw new IllegalStateException("batch worker failed", ex.getCause());
        }
    }

    private record SeedResult(GameRecord record, BatchFault fault) {
        static SeedResult converged(GameRecord record) {
            return new SeedResult(record, null);
        }

        static SeedResult failed(BatchFault fault) {
            return new SeedResult(null, fault);
        }
    }
}
