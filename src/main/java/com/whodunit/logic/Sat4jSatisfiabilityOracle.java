package com.whodunit.logic;

import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SatisfiabilityOracle} backed by the Sat4j CDCL solver.
 *
 * Each query loads a fresh solver, so instances hold no state and are safe
 * to share across threads. Probes are passed as assumptions, which lets one
 * loaded solver answer a whole suspect list.
 */
public class Sat4jSatisfiabilityOracle implements SatisfiabilityOracle {

    private static final Logger log = LoggerFactory.getLogger(Sat4jSatisfiabilityOracle.class);

    @Override
    public boolean isSatisfiable(List<Formula> conjunction) {
        Optional<ISolver> solver = load(conjunction, highestAtomId(conjunction, List.of()));
        if (solver.isEmpty()) {
            return false;
        }
        return solve(solver.get(), new VecInt());
    }

    @Override
    public List<Atom> satisfiableAtoms(List<Formula> conjunction, List<Atom> probes) {
        Optional<ISolver> solver = load(conjunction, highestAtomId(conjunction, probes));
        if (solver.isEmpty()) {
            return List.of();
        }
        List<Atom> result = new ArrayList<>();
        for (Atom probe : probes) {
            if (solve(solver.get(), new VecInt(new int[] {probe.id()}))) {
                result.add(probe);
            }
        }
        return result;
    }

    // empty when the clauses already contradict each other
    private Optional<ISolver> load(List<Formula> conjunction, int highestAtomId) {
        CnfEncoder encoder = new CnfEncoder(highestAtomId);
        conjunction.forEach(encoder::assertFormula);

        ISolver solver = SolverFactory.newDefault();
        solver.newVar(encoder.variableCount());
        solver.setExpectedNumberOfClauses(encoder.clauses().size());
        try {
            for (int[] clause : encoder.clauses()) {
                solver.addClause(new VecInt(clause));
            }
        } catch (ContradictionException ex) {
            log.trace("Contradiction while loading {} formulas: {}", conjunction.size(), ex.getMessage());
            return Optional.empty();
        }
        return Optional.of(solver);
    }

    private boolean solve(ISolver solver, VecInt assumptions) {
        try {
            return solver.isSatisfiable(assumptions);
        } catch (TimeoutException ex) {
            throw new SatisfiabilityException("SAT solver gave up before deciding the query", ex);
        }
    }

    private static int highestAtomId(List<Formula> conjunction, List<Atom> probes) {
        int highest = 0;
        for (Formula formula : conjunction) {
            highest = Math.max(highest, highestAtomId(formula));
        }
        for (Atom probe : probes) {
            highest = Math.max(highest, probe.id());
        }
        return highest;
    }

    private static int highestAtomId(Formula formula) {
        if (formula instanceof Atom atom) {
            return atom.id();
        }
        if (formula instanceof Formula.Not not) {
            return highestAtomId(not.operand());
        }
        if (formula instanceof Formula.Implies implies) {
            return Math.max(highestAtomId(implies.antecedent()), highestAtomId(implies.consequent()));
        }
        List<Formula> operands = formula instanceof Formula.And and
            ? and.operands()
            : ((Formula.Or) formula).operands();
        int highest = 0;
        for (Formula operand : operands) {
            highest = Math.max(highest, highestAtomId(operand));
        }
        return highest;
    }
}
