package com.whodunit.logic;

import java.util.function.Predicate;

/**
 * A boolean variable of the atom space. {@code id} is the 1-based variable
 * number handed to the SAT solver.
 */
public record Atom(String key, int id) implements Formula {

    public Atom {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("atom key is required");
        }
        if (id < 1) {
            throw new IllegalArgumentException("atom id must be positive: " + id);
        }
    }

    @Override
    public boolean evaluate(Predicate<Atom> assignment) {
        return assignment.test(this);
    }

    @Override
    public String toString() {
        return key;
    }
}
