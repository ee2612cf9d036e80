package com.whodunit.generation;

import com.whodunit.contract.AttributeCategory;
import com.whodunit.logic.Atom;
import com.whodunit.logic.AtomSpace;
import com.whodunit.scenario.Scenario;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Read-only view of a running game handed to proposition templates.
 *
 * @param scenario the hidden ground truth
 * @param atomSpace atoms of the game
 * @param remainingSuspects recomputes who can still be the killer
 * @param random the game's own random sequence
 */
public record GenerationContext(
    Scenario scenario,
    AtomSpace atomSpace,
    Supplier<List<String>> remainingSuspects,
    Random random
) {

    public String pickPerson() {
        return pick(atomSpace.names());
    }

    public String pickOtherPerson(String person) {
        List<String> others = atomSpace.names().stream().filter(n -> !n.equals(person)).toList();
        return pick(others);
    }

    public <T> T pick(List<T> choices) {
        if (choices.isEmpty()) {
            throw new IllegalArgumentException("nothing to pick from");
        }
        return choices.get(random.nextInt(choices.size()));
    }

    /** The person's true value in the category. */
    public String trueValue(String person, AttributeCategory category) {
        return scenario.activityOf(person).valueOf(category);
    }

    /** Atom for the person's true value in the category, if the atom space has it. */
    public Optional<Atom> trueAtom(String person, AttributeCategory category) {
        return atomSpace.attribute(person, trueValue(person, category));
    }
}
