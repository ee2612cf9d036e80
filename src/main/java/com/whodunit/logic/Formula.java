package com.whodunit.logic;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Propositional formula over {@link Atom}s.
 */
public sealed interface Formula permits Atom, Formula.Not, Formula.And, Formula.Or, Formula.Implies {

    /**
     * Truth value under the given assignment of atoms.
     */
    boolean evaluate(Predicate<Atom> assignment);

    static Formula not(Formula operand) {
        return new Not(operand);
    }

    static Formula and(Formula... operands) {
        return new And(List.of(operands));
    }

    static Formula and(List<? extends Formula> operands) {
        return new And(List.copyOf(operands));
    }

    static Formula or(Formula... operands) {
        return new Or(List.of(operands));
    }

    static Formula or(List<? extends Formula> operands) {
        return new Or(List.copyOf(operands));
    }

    static Formula implies(Formula antecedent, Formula consequent) {
        return new Implies(antecedent, consequent);
    }

    record Not(Formula operand) implements Formula {
        public Not {
            requireOperand(operand);
        }

        @Override
        public boolean evaluate(Predicate<Atom> assignment) {
            return !operand.evaluate(assignment);
        }

        @Override
        public String toString() {
            return "~" + operand;
        }
    }

    record And(List<Formula> operands) implements Formula {
        public And {
            operands = requireOperands(operands);
        }

        @Override
        public boolean evaluate(Predicate<Atom> assignment) {
            return operands.stream().allMatch(f -> f.evaluate(assignment));
        }

        @Override
        public String toString() {
            return join(operands, " & ");
        }
    }

    record Or(List<Formula> operands) implements Formula {
        public Or {
            operands = requireOperands(operands);
        }

        @Override
        public boolean evaluate(Predicate<Atom> assignment) {
            return operands.stream().anyMatch(f -> f.evaluate(assignment));
        }

        @Override
        public String toString() {
            return join(operands, " | ");
        }
    }

    record Implies(Formula antecedent, Formula consequent) implements Formula {
        public Implies {
            requireOperand(antecedent);
            requireOperand(consequent);
        }

        @Override
        public boolean evaluate(Predicate<Atom> assignment) {
            return !antecedent.evaluate(assignment) || consequent.evaluate(assignment);
        }

        @Override
        public String toString() {
            return "(" + antecedent + " >> " + consequent + ")";
        }
    }

    private static void requireOperand(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("formula operand must not be null");
        }
    }

    private static List<Formula> requireOperands(List<Formula> operands) {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("connective needs at least one operand");
        }
        // List.copyOf rejects null elements
        return List.copyOf(operands);
    }

    private static String join(List<Formula> operands, String separator) {
        return operands.stream().map(Formula::toString).collect(Collectors.joining(separator, "(", ")"));
    }
}
