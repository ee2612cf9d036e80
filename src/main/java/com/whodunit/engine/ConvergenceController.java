package com.whodunit.engine;

import com.whodunit.contract.GameConfiguration;
import com.whodunit.contract.GameRecord;
import com.whodunit.contract.PropositionData;
import com.whodunit.generation.GenerationContext;
import com.whodunit.generation.Proposition;
import com.whodunit.generation.PropositionGenerator;
import com.whodunit.logic.Atom;
import com.whodunit.logic.AtomSpace;
import com.whodunit.scenario.KnowledgeBase;
import com.whodunit.scenario.Scenario;
import com.whodunit.scenario.ScenarioInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Runs one game from setup to a single suspect.
 *
 * Loop: generate a candidate, keep it only if the real killer stays
 * possible, recount suspects after every accept, stop at one. Because every
 * accepted proposition was checked against the real killer first, the last
 * suspect standing is always the real killer.
 *
 * Each call owns its atom space, knowledge base and random sequence, so the
 * controller itself holds no per-game state and can run games concurrently.
 */
public class ConvergenceController {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceController.class);

    private final ScenarioInitializer initializer;
    private final PropositionGenerator generator;
    private final FeasibilityOracle feasibilityOracle;
    private final SuspectCounter suspectCounter;
    private final int maxAttempts;

    public ConvergenceController(ScenarioInitializer initializer,
                                 PropositionGenerator generator,
                                 FeasibilityOracle feasibilityOracle,
                                 SuspectCounter suspectCounter,
                                 int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.initializer = initializer;
        this.generator = generator;
        this.feasibilityOracle = feasibilityOracle;
        this.suspectCounter = suspectCounter;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Plays one game. The configuration must already be validated.
     *
     * @throws EngineFaultException if an accepted proposition leaves no suspect
     *         or the solver fails
     */
    public GameOutcome run(GameConfiguration configuration, long seed) {
        EngineState state = EngineState.INITIALIZING;
        Random random = new Random(seed);
        AtomSpace atomSpace = AtomSpace.build(configuration);
        Scenario scenario = initializer.drawScenario(configuration, random);
        KnowledgeBase knowledgeBase = initializer.baseKnowledgeBase(atomSpace);
        Atom killerAtom = atomSpace.killer(scenario.killer());
        List<PropositionData> accepted = new ArrayList<>();

        GenerationContext context = new GenerationContext(
            scenario,
            atomSpace,
            () -> suspectCounter.count(knowledgeBase, atomSpace).suspects(),
            random);

        log.debug("Game seed={} initialized: {} atoms, {} base constraints",
            seed, atomSpace.size(), knowledgeBase.size());

        int attempts = 0;
        int rejected = 0;
        while (attempts < maxAttempts) {
            attempts++;
            state = transition(seed, state, EngineState.GENERATING);

            Optional<Proposition> candidate = generator.generate(context);
            if (candidate.isEmpty()) {
                continue;
            }
            Proposition proposition = candidate.get();

            if (!feasibilityOracle.isFeasible(knowledgeBase, proposition.formula(), killerAtom)) {
                state = transition(seed, state, EngineState.REJECTING);
                rejected++;
                log.debug("Game seed={} rejected (infeasible): {}", seed, proposition.formula());
                continue;
            }

            state = transition(seed, state, EngineState.ACCEPTING);
            int sequence = knowledgeBase.append(proposition.formula());
            accepted.add(proposition.data());
            log.debug("Game seed={} accepted #{} (kb entry {}): {}",
                seed, accepted.size(), sequence, proposition.formula());

            state = transition(seed, state, EngineState.CHECKING);
            SuspectReport report = suspectCounter.count(knowledgeBase, atomSpace);
            log.debug("Game seed={} suspects after {} propositions: {}", seed, accepted.size(), report.suspects());

            if (report.count() == 0) {
                throw new EngineFaultException(FaultKind.INCONSISTENT_KNOWLEDGE_BASE,
                    "no suspect left after accepting " + proposition.formula() + " (seed " + seed + ")");
            }
            if (report.isConverged()) {
                String identified = report.suspects().get(0);
                if (!scenario.isKiller(identified)) {
                    throw new EngineFaultException(FaultKind.INCONSISTENT_KNOWLEDGE_BASE,
                        "converged on " + identified + " but the killer is " + scenario.killer()
                            + " (seed " + seed + ")");
                }
                transition(seed, state, EngineState.CONVERGED);
                log.info("Game seed={} converged on {} after {} propositions ({} attempts, {} rejected)",
                    seed, identified, accepted.size(), attempts, rejected);
                return new GameOutcome.Converged(
                    toRecord(seed, configuration, scenario, accepted),
                    knowledgeBase.formulas(),
                    attempts);
            }
        }

        transition(seed, state, EngineState.TERMINATED_MAX_ATTEMPTS);
        SuspectReport remaining = suspectCounter.count(knowledgeBase, atomSpace);
        log.warn("Game seed={} hit the attempt bound ({}) with {} suspects left: {}",
            seed, maxAttempts, remaining.count(), remaining.suspects());
        return new GameOutcome.Exhausted(
            toRecord(seed, configuration, scenario, accepted),
            knowledgeBase.formulas(),
            attempts,
            remaining.suspects());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private static EngineState transition(long seed, EngineState from, EngineState to) {
        if (log.isTraceEnabled() && from != to) {
            log.trace("Game seed={} {} -> {}", seed, from, to);
        }
        return to;
    }

    private static GameRecord toRecord(long seed, GameConfiguration configuration,
                                       Scenario scenario, List<PropositionData> accepted) {
        return GameRecord.of(seed, scenario.killer(), configuration, scenario.groundTruth(), accepted);
    }
}
