package com.whodunit.generation;

import com.whodunit.contract.AttributeCategory;
import com.whodunit.contract.PropositionData;
import com.whodunit.contract.PropositionType;
import com.whodunit.logic.Atom;
import com.whodunit.logic.Formula;

import java.util.Optional;

/**
 * "(Will with steel) OR (Joe with fish and government)": one person's
 * material against two facts about a second person.
 */
public class CompoundDisjunctionTemplate extends AbstractPropositionTemplate {

    public CompoundDisjunctionTemplate(int weight) {
        super(weight);
    }

    @Override
    public PropositionType type() {
        return PropositionType.COMPOUND_DISJUNCTION;
    }

    @Override
    public Optional<Proposition> generate(GenerationContext context) {
        String person1 = context.pickPerson();
        String person2 = context.pickOtherPerson(person1);

        Optional<Atom> material1 = context.trueAtom(person1, AttributeCategory.MATERIAL);
        Optional<Atom> food2 = context.trueAtom(person2, AttributeCategory.FOOD);
        Optional<Atom> institution2 = context.trueAtom(person2, AttributeCategory.INSTITUTION);
        if (material1.isEmpty() || food2.isEmpty() || institution2.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new Proposition(
            Formula.or(material1.get(), Formula.and(food2.get(), institution2.get())),
            new PropositionData.CompoundDisjunction(person1, person2,
                context.trueValue(person1, AttributeCategory.MATERIAL),
                context.trueValue(person2, AttributeCategory.FOOD),
                context.trueValue(person2, AttributeCategory.INSTITUTION))));
    }
}
