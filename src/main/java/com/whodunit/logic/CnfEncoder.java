package com.whodunit.logic;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a conjunction of formulas into clauses (DIMACS-style int literals).
 *
 * Top-level shapes that already are clauses (literals, disjunctions of
 * literals, negated conjunctions, implications between literals) are added
 * directly. Anything nested gets a Tseitin variable allocated above the
 * highest atom id.
 */
final class CnfEncoder {

    private final List<int[]> clauses = new ArrayList<>();
    private int lastVar;

    CnfEncoder(int highestAtomId) {
        this.lastVar = highestAtomId;
    }

    void assertFormula(Formula formula) {
        if (formula instanceof Formula.And and) {
            and.operands().forEach(this::assertFormula);
        } else if (formula instanceof Formula.Or or) {
            addClause(or.operands().stream().mapToInt(this::literal).toArray());
        } else if (formula instanceof Formula.Not not && not.operand() instanceof Formula.And negated) {
            addClause(negated.operands().stream().mapToInt(f -> -literal(f)).toArray());
        } else if (formula instanceof Formula.Implies implies) {
            addClause(-literal(implies.antecedent()), literal(implies.consequent()));
        } else {
            addClause(literal(formula));
        }
    }

    /** Literal equivalent to the formula; introduces definitions as needed. */
    int literal(Formula formula) {
        if (formula instanceof Atom atom) {
            return atom.id();
        }
        if (formula instanceof Formula.Not not) {
            return -literal(not.operand());
        }
        if (formula instanceof Formula.Implies implies) {
            return define(false, new int[] {-literal(implies.antecedent()), literal(implies.consequent())});
        }
        if (formula instanceof Formula.And and) {
            return define(true, and.operands().stream().mapToInt(this::literal).toArray());
        }
        Formula.Or or = (Formula.Or) formula;
        return define(false, or.operands().stream().mapToInt(this::literal).toArray());
    }

    List<int[]> clauses() {
        return clauses;
    }

    int variableCount() {
        return lastVar;
    }

    // v <-> (l1 & ... & ln) when conjunctive, v <-> (l1 | ... | ln) otherwise
    private int define(boolean conjunctive, int[] operands) {
        int v = ++lastVar;
        int[] wide = new int[operands.length + 1];
        wide[0] = conjunctive ? v : -v;
        for (int i = 0; i < operands.length; i++) {
            int l = operands[i];
            wide[i + 1] = conjunctive ? -l : l;
            addClause(conjunctive ? -v : v, conjunctive ? l : -l);
        }
        addClause(wide);
        return v;
    }

    private void addClause(int... literals) {
        clauses.add(literals);
    }
}
