package com.whodunit.generation;

import com.whodunit.contract.AttributeCategory;
import com.whodunit.contract.PropositionData;
import com.whodunit.contract.PropositionType;
import com.whodunit.logic.Formula;

import java.util.List;
import java.util.Optional;

/**
 * "If John was with pizza, then John is not the killer". Only ever issued
 * for an innocent person, so it cannot rule out the real killer on its own.
 */
public class AlibiImplicationTemplate extends AbstractPropositionTemplate {

    public AlibiImplicationTemplate(int weight) {
        super(weight);
    }

    @Override
    public PropositionType type() {
        return PropositionType.ALIBI_IMPLICATION;
    }

    @Override
    public Optional<Proposition> generate(GenerationContext context) {
        List<String> innocents = context.scenario().innocents();
        if (innocents.isEmpty()) {
            return Optional.empty();
        }

        String person = context.pick(innocents);
        AttributeCategory category = context.pick(CLUE_CATEGORIES);
        String value = context.trueValue(person, category);

        return context.atomSpace().attribute(person, value)
            .map(atom -> new Proposition(
                Formula.implies(atom, Formula.not(context.atomSpace().killer(person))),
                new PropositionData.AlibiImplication(person, category, value)));
    }
}
