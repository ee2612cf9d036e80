package com.whodunit.generation;

import com.whodunit.contract.PropositionData;
import com.whodunit.logic.Formula;

/**
 * A candidate clue: the formula the engine reasons with and the description
 * that is recorded if the clue is accepted.
 */
public record Proposition(Formula formula, PropositionData data) {
}
