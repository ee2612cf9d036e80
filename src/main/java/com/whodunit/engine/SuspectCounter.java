package com.whodunit.engine;

import com.whodunit.logic.Atom;
import com.whodunit.logic.AtomSpace;
import com.whodunit.logic.Formula;
import com.whodunit.logic.SatisfiabilityException;
import com.whodunit.logic.SatisfiabilityOracle;
import com.whodunit.scenario.KnowledgeBase;

import java.util.List;

/**
 * Works out who can still be the killer by asking the oracle, for every
 * person, whether "person is the killer" fits the knowledge base.
 *
 * Always recomputes from the full knowledge base; nothing is cached between
 * calls.
 */
public class SuspectCounter {

    private final SatisfiabilityOracle oracle;

    public SuspectCounter(SatisfiabilityOracle oracle) {
        this.oracle = oracle;
    }

    public SuspectReport count(KnowledgeBase knowledgeBase, AtomSpace atomSpace) {
        return count(knowledgeBase.formulas(), atomSpace);
    }

    public SuspectReport count(List<Formula> knowledge, AtomSpace atomSpace) {
        List<String> names = atomSpace.names();
        if (knowledge.isEmpty()) {
            // an empty conjunction allows everyone
            return new SuspectReport(names);
        }

        List<Atom> possible;
        try {
            possible = oracle.satisfiableAtoms(knowledge, atomSpace.killerAtoms());
        } catch (SatisfiabilityException ex) {
            throw new EngineFaultException(FaultKind.SOLVER_FAILURE,
                "suspect count failed over " + knowledge.size() + " formulas", ex);
        }
        return new SuspectReport(names.stream()
            .filter(name -> possible.contains(atomSpace.killer(name)))
            .toList());
    }
}
