package com.whodunit.generation;

import com.whodunit.contract.AttributeCategory;
import com.whodunit.contract.PropositionData;
import com.whodunit.contract.PropositionType;
import com.whodunit.logic.Atom;
import com.whodunit.logic.Formula;

import java.util.Optional;

/**
 * "(Joe with wood) OR (John with pizza)": two true attributes of two
 * different people, only one of which is asserted.
 */
public class DisjunctionTemplate extends AbstractPropositionTemplate {

    public DisjunctionTemplate(int weight) {
        super(weight);
    }

    @Override
    public PropositionType type() {
        return PropositionType.DISJUNCTION;
    }

    @Override
    public Optional<Proposition> generate(GenerationContext context) {
        String person1 = context.pickPerson();
        String person2 = context.pickOtherPerson(person1);
        AttributeCategory category1 = context.pick(CLUE_CATEGORIES);
        AttributeCategory category2 = context.pick(CLUE_CATEGORIES);

        Optional<Atom> atom1 = context.trueAtom(person1, category1);
        Optional<Atom> atom2 = context.trueAtom(person2, category2);
        if (atom1.isEmpty() || atom2.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new Proposition(
            Formula.or(atom1.get(), atom2.get()),
            new PropositionData.Disjunction(person1, person2, category1, category2,
                context.trueValue(person1, category1),
                context.trueValue(person2, category2))));
    }
}
