package com.whodunit.engine;

import com.whodunit.contract.GameRecord;
import com.whodunit.logic.Formula;

import java.util.List;

/**
 * How a game run ended. Only {@link Converged} identifies a killer; an
 * {@link Exhausted} run carries the suspects that were left, never a guess.
 *
 * {@code knowledge} is the final knowledge base in append order. It stays on
 * the engine side and is not part of the record.
 */
public sealed interface GameOutcome {

    GameRecord record();

    List<Formula> knowledge();

    int attempts();

    EngineState finalState();

    record Converged(GameRecord record, List<Formula> knowledge, int attempts) implements GameOutcome {
        public Converged {
            knowledge = List.copyOf(knowledge);
        }

        /** The single remaining suspect, which is always the recorded killer. */
        public String identifiedKiller() {
            return record.killer();
        }

        @Override
        public EngineState finalState() {
            return EngineState.CONVERGED;
        }
    }

    record Exhausted(GameRecord record, List<Formula> knowledge, int attempts,
                     List<String> remainingSuspects) implements GameOutcome {
        public Exhausted {
            knowledge = List.copyOf(knowledge);
            remainingSuspects = List.copyOf(remainingSuspects);
        }

        @Override
        public EngineState finalState() {
            return EngineState.TERMINATED_MAX_ATTEMPTS;
        }
    }
}
