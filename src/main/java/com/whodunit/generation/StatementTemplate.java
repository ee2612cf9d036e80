package com.whodunit.generation;

import com.whodunit.contract.AttributeCategory;
import com.whodunit.contract.PropositionData;
import com.whodunit.contract.PropositionType;

import java.util.List;
import java.util.Optional;

/**
 * "Joe was with wood": a single true attribute of a random person.
 */
public class StatementTemplate extends AbstractPropositionTemplate {

    private static final List<AttributeCategory> CATEGORIES = List.of(
        AttributeCategory.MATERIAL,
        AttributeCategory.INSTITUTION,
        AttributeCategory.FOOD,
        AttributeCategory.PLACE);

    public StatementTemplate(int weight) {
        super(weight);
    }

    @Override
    public PropositionType type() {
        return PropositionType.STATEMENT;
    }

    @Override
    public Optional<Proposition> generate(GenerationContext context) {
        String person = context.pickPerson();
        AttributeCategory category = context.pick(CATEGORIES);
        String value = context.trueValue(person, category);

        return context.atomSpace().attribute(person, value)
            .map(atom -> new Proposition(atom,
                new PropositionData.Statement(person, category, value)));
    }
}
