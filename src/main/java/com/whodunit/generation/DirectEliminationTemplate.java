package com.whodunit.generation;

import com.whodunit.contract.AttributeCategory;
import com.whodunit.contract.PropositionData;
import com.whodunit.contract.PropositionType;
import com.whodunit.logic.Formula;

import java.util.List;
import java.util.Optional;

/**
 * "John was with pizza (alibi: not the killer)": clears an innocent who is
 * still a suspect by asserting an attribute together with its alibi.
 *
 * Asks for the current suspect list on every call, which costs a full
 * suspect count.
 */
public class DirectEliminationTemplate extends AbstractPropositionTemplate {

    public DirectEliminationTemplate(int weight) {
        super(weight);
    }

    @Override
    public PropositionType type() {
        return PropositionType.DIRECT_ELIMINATION;
    }

    @Override
    public Optional<Proposition> generate(GenerationContext context) {
        List<String> innocentSuspects = context.remainingSuspects().get().stream()
            .filter(name -> !context.scenario().isKiller(name))
            .toList();
        if (innocentSuspects.isEmpty()) {
            return Optional.empty();
        }

        String person = context.pick(innocentSuspects);
        AttributeCategory category = context.pick(CLUE_CATEGORIES);
        String value = context.trueValue(person, category);

        return context.atomSpace().attribute(person, value)
            .map(atom -> new Proposition(
                Formula.and(atom, Formula.implies(atom, Formula.not(context.atomSpace().killer(person)))),
                new PropositionData.DirectElimination(person, category, value)));
    }
}
