package com.whodunit.generation;

import com.whodunit.contract.PropositionType;

import java.util.Optional;

/**
 * One shape of clue. Templates read the ground truth, so everything they
 * produce is true in the scenario; whether it is also safe to reveal is
 * decided later by the feasibility check.
 */
public interface PropositionTemplate {

    PropositionType type();

    /** Relative weight in the generator's random draw. Must be positive. */
    int weight();

    /**
     * Builds one candidate.
     *
     * @return empty when this template cannot produce a candidate right now
     *         (missing atom, nobody left to target); the caller simply retries
     */
    Optional<Proposition> generate(GenerationContext context);
}
